package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.grammar.Symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Literal values observed under each relevant symbol, split into an integer and a string
 * bucket.
 */
public final class ValueMaps {

    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");
    private static final int MIN_COMMON_SUBSTRING_LENGTH = 2;

    private final Map<Symbol, Set<String>> strings;
    private final Map<Symbol, Set<Long>> integers;

    private ValueMaps(final Map<Symbol, Set<String>> strings, final Map<Symbol, Set<Long>> integers) {
        this.strings = strings;
        this.integers = integers;
    }

    public static ValueMaps extract(final Collection<Symbol> symbols, final Collection<LabeledInput> inputs) {
        final Map<Symbol, Set<String>> strings = new LinkedHashMap<>();
        final Map<Symbol, Set<Long>> integers = new LinkedHashMap<>();

        for (final Symbol symbol : symbols) {
            final Set<String> stringBucket = new TreeSet<>();
            final Set<Long> integerBucket = new TreeSet<>();
            final List<String> observed = new ArrayList<>();

            for (final LabeledInput input : inputs) {
                for (final DerivationTree subtree : input.tree().findAll(symbol)) {
                    final String value = subtree.toString();
                    observed.add(value);
                    if (INTEGER.matcher(value).matches()) {
                        integerBucket.add(Long.parseLong(value));
                    } else {
                        stringBucket.add(value);
                    }
                }
            }

            final String common = longestCommonSubstring(observed);
            if (common.length() >= MIN_COMMON_SUBSTRING_LENGTH) {
                stringBucket.add(common);
            }
            strings.put(symbol, stringBucket);
            integers.put(symbol, integerBucket);
        }
        return new ValueMaps(strings, integers);
    }

    public Set<String> strings(final Symbol symbol) {
        return strings.getOrDefault(symbol, Set.of());
    }

    public Set<Long> integers(final Symbol symbol) {
        return integers.getOrDefault(symbol, Set.of());
    }

    /**
     * The smallest and largest integer observed for the symbol.
     */
    public Set<Long> filteredIntegers(final Symbol symbol) {
        final Set<Long> values = integers(symbol);
        if (values.isEmpty()) {
            return Set.of();
        }
        final TreeSet<Long> sorted = new TreeSet<>(values);
        return new TreeSet<>(List.of(sorted.first(), sorted.last()));
    }

    static String longestCommonSubstring(final List<String> values) {
        if (values.isEmpty()) {
            return "";
        }
        String shortest = values.get(0);
        for (final String value : values) {
            if (value.length() < shortest.length()) {
                shortest = value;
            }
        }
        for (int length = shortest.length(); length > 0; length--) {
            for (int start = 0; start + length <= shortest.length(); start++) {
                final String candidate = shortest.substring(start, start + length);
                if (values.stream().allMatch(value -> value.contains(candidate))) {
                    return candidate;
                }
            }
        }
        return "";
    }
}
