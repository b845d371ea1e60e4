package twothree;

/**
 * Thrown by {@link TwoThreeTree#validate()} when the structure is corrupt.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(final String message) {
        super(message);
    }
}
