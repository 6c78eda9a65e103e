package nl.nfi.djlearn.constraint;

import nl.nfi.djlearn.grammar.DerivationTree;

/**
 * Conversions between the runtime values of terms.
 */
final class Values {

    private Values() {
    }

    static String asString(final Object value) {
        if (value instanceof DerivationTree || value instanceof String || value instanceof Long) {
            return value.toString();
        }
        if (value instanceof Boolean bool) {
            return bool ? "true" : "false";
        }
        throw new ConstraintEvaluationException("Cannot convert to string: %s".formatted(value));
    }

    static long asLong(final Object value) {
        if (value instanceof Long number) {
            return number;
        }
        final String text = asString(value).trim();
        try {
            return Long.parseLong(text);
        } catch (final NumberFormatException e) {
            throw new ConstraintEvaluationException("Not an integer: %s".formatted(text), e);
        }
    }

    static boolean asBoolean(final Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw new ConstraintEvaluationException("Not a boolean: %s".formatted(value));
    }

    static boolean compare(final Object left, final ComparisonOperator operator, final Object right) {
        if (left instanceof Long l && right instanceof Long r) {
            return operator.test(Long.compare(l, r));
        }
        if (left instanceof Long || right instanceof Long) {
            // mixed types are never equal and have no order
            if (operator == ComparisonOperator.EQUAL) {
                return false;
            }
            if (operator == ComparisonOperator.NOT_EQUAL) {
                return true;
            }
            throw new ConstraintEvaluationException("Cannot order %s and %s".formatted(left, right));
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            if (operator.isOrdering()) {
                throw new ConstraintEvaluationException("Cannot order %s and %s".formatted(left, right));
            }
            return operator.test(asString(left).equals(asString(right)) ? 0 : 1);
        }
        return operator.test(Integer.signum(asString(left).compareTo(asString(right))));
    }
}
