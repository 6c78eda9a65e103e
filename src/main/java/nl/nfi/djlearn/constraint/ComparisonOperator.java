package nl.nfi.djlearn.constraint;

import java.util.Arrays;

public enum ComparisonOperator {

    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">=");

    private final String text;

    ComparisonOperator(final String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public boolean isOrdering() {
        return this != EQUAL && this != NOT_EQUAL;
    }

    /**
     * The operator that holds exactly when this one does not.
     */
    public ComparisonOperator negate() {
        return switch (this) {
            case EQUAL -> NOT_EQUAL;
            case NOT_EQUAL -> EQUAL;
            case LESS -> GREATER_EQUAL;
            case GREATER_EQUAL -> LESS;
            case LESS_EQUAL -> GREATER;
            case GREATER -> LESS_EQUAL;
        };
    }

    public boolean test(final int comparison) {
        return switch (this) {
            case EQUAL -> comparison == 0;
            case NOT_EQUAL -> comparison != 0;
            case LESS -> comparison < 0;
            case LESS_EQUAL -> comparison <= 0;
            case GREATER -> comparison > 0;
            case GREATER_EQUAL -> comparison >= 0;
        };
    }

    public static ComparisonOperator fromText(final String text) {
        return Arrays.stream(values())
                .filter(operator -> operator.text.equals(text))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown comparison operator: %s".formatted(text)));
    }

    @Override
    public String toString() {
        return text;
    }
}
