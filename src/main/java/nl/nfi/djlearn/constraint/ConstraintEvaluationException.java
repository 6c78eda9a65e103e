package nl.nfi.djlearn.constraint;

public final class ConstraintEvaluationException extends RuntimeException {

    public ConstraintEvaluationException(final String message) {
        super(message);
    }

    public ConstraintEvaluationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
