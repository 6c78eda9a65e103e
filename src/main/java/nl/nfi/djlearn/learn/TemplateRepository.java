package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.constraint.Constraint;
import nl.nfi.djlearn.constraint.ConstraintParser;
import org.json.JSONArray;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named groups of templates, read from JSON of the form
 * {@code {"group": [{"name": "...", "constraint": "..."}]}}.
 */
public final class TemplateRepository {

    private static final String DEFAULT_RESOURCE = "/templates.json";

    private final Map<String, List<Template>> groups;

    private TemplateRepository(final Map<String, List<Template>> groups) {
        this.groups = groups;
    }

    public static TemplateRepository defaults() {
        try (final InputStream input = TemplateRepository.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Missing template resource: %s".formatted(DEFAULT_RESOURCE));
            }
            return read(new JSONObject(new JSONTokener(input)));
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static TemplateRepository loadFrom(final Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Template file does not exist: %s".formatted(path));
        }
        try (final InputStream input = Files.newInputStream(path)) {
            return read(new JSONObject(new JSONTokener(input)));
        }
    }

    public static TemplateRepository of(final Map<String, List<String>> groups) {
        final Map<String, List<Template>> parsed = new LinkedHashMap<>();
        groups.forEach((group, constraints) -> {
            final List<Template> templates = new ArrayList<>();
            for (final String constraint : constraints) {
                templates.add(new Template(constraint, ConstraintParser.parse(constraint)));
            }
            parsed.put(group, List.copyOf(templates));
        });
        return new TemplateRepository(parsed);
    }

    private static TemplateRepository read(final JSONObject json) {
        final Map<String, List<Template>> groups = new LinkedHashMap<>();
        for (final String group : json.keySet()) {
            final JSONArray entries = json.getJSONArray(group);
            final List<Template> templates = new ArrayList<>();
            for (int i = 0; i < entries.length(); i++) {
                final JSONObject entry = entries.getJSONObject(i);
                final String text = entry.getString("constraint");
                templates.add(new Template(entry.optString("name", text), ConstraintParser.parse(text)));
            }
            groups.put(group, List.copyOf(templates));
        }
        return new TemplateRepository(groups);
    }

    public Set<String> groups() {
        return groups.keySet();
    }

    public List<Constraint> all() {
        return select(groups.keySet());
    }

    public List<Constraint> select(final Collection<String> names) {
        final List<Constraint> constraints = new ArrayList<>();
        for (final String name : names) {
            final List<Template> templates = groups.get(name);
            if (templates == null) {
                throw new IllegalArgumentException("Unknown template group: %s".formatted(name));
            }
            templates.forEach(template -> constraints.add(template.constraint()));
        }
        return constraints;
    }

    public record Template(String name, Constraint constraint) {
    }
}
