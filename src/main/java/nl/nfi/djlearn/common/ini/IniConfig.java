package nl.nfi.djlearn.common.ini;

import org.json.JSONArray;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.file.Files.readAllLines;

/**
 * Minimal INI reader: {@code [SECTION]} headers, {@code key = value} pairs and comment lines
 * starting with {@code #} or {@code ;}. List values are JSON arrays.
 */
public final class IniConfig {

    private final Map<String, Map<String, String>> sections;

    private IniConfig(final Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public static IniConfig empty() {
        return new IniConfig(Map.of());
    }

    public boolean hasSection(final String section) {
        return sections.containsKey(section);
    }

    public boolean hasKey(final String section, final String key) {
        return sections.containsKey(section) && sections.get(section).containsKey(key);
    }

    public IniSection getSection(final String section) {
        return IniSection.ofConfig(this, section);
    }

    public String getString(final String section, final String key) {
        if (!hasKey(section, key)) {
            throw new IllegalArgumentException("INI config does not contain key in given section: %s -> %s".formatted(section, key));
        }
        return sections.get(section).get(key);
    }

    public boolean getBoolean(final String section, final String key) {
        return Boolean.parseBoolean(getString(section, key));
    }

    public int getInt(final String section, final String key) {
        return Integer.parseInt(getString(section, key));
    }

    public long getLong(final String section, final String key) {
        return Long.parseLong(getString(section, key));
    }

    public double getDouble(final String section, final String key) {
        return Double.parseDouble(getString(section, key));
    }

    public List<String> getStringList(final String section, final String key) {
        final JSONArray array = new JSONArray(getString(section, key));
        final List<String> values = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }

    public static IniConfig loadFrom(final Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("INI config file path does not exist: %s".formatted(path));
        }

        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        Map<String, String> section = null;
        int lineNumber = 0;
        for (final String rawLine : readAllLines(path)) {
            lineNumber++;
            final String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                section = sections.computeIfAbsent(line.substring(1, line.length() - 1).trim(), title -> new LinkedHashMap<>());
                continue;
            }
            if (section == null) {
                throw new IllegalArgumentException("INI entry outside of a section at line %d: %s".formatted(lineNumber, path));
            }
            final int separator = line.indexOf('=');
            if (separator < 0) {
                section.put(line, "");
            } else {
                section.put(line.substring(0, separator).trim(), line.substring(separator + 1).trim());
            }
        }
        return new IniConfig(sections);
    }
}
