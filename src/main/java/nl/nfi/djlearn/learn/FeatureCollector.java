package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.grammar.Grammar;
import nl.nfi.djlearn.grammar.Symbol;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Derives a feature vector per input from the grammar's non-terminals: whether the symbol
 * occurs, how often, the maximum length of its text and the maximum numeric value it holds.
 */
public final class FeatureCollector {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final Grammar grammar;

    private FeatureCollector(final Grammar grammar) {
        this.grammar = grammar;
    }

    public static FeatureCollector forGrammar(final Grammar grammar) {
        return new FeatureCollector(grammar);
    }

    public static String exists(final Symbol symbol) {
        return "exists(%s)".formatted(symbol.name());
    }

    public static String count(final Symbol symbol) {
        return "count(%s)".formatted(symbol.name());
    }

    public static String length(final Symbol symbol) {
        return "len(%s)".formatted(symbol.name());
    }

    public static String numeric(final Symbol symbol) {
        return "num(%s)".formatted(symbol.name());
    }

    public Map<String, Double> collect(final DerivationTree tree) {
        final Map<String, Double> features = new LinkedHashMap<>();
        for (final Symbol symbol : grammar.nonTerminals()) {
            final List<DerivationTree> occurrences = tree.findAll(symbol);
            features.put(exists(symbol), occurrences.isEmpty() ? 0.0 : 1.0);
            features.put(count(symbol), (double) occurrences.size());

            double length = 0.0;
            double number = 0.0;
            for (final DerivationTree occurrence : occurrences) {
                final String text = occurrence.toString();
                length = Math.max(length, text.length());
                if (NUMBER.matcher(text).matches()) {
                    number = Math.max(number, Double.parseDouble(text));
                }
            }
            features.put(length(symbol), length);
            features.put(numeric(symbol), number);
        }
        return features;
    }

    /**
     * Attaches features to every input that has none yet.
     */
    public void annotate(final Collection<LabeledInput> inputs) {
        for (final LabeledInput input : inputs) {
            if (input.features().isEmpty()) {
                input.attachFeatures(collect(input.tree()));
            }
        }
    }
}
