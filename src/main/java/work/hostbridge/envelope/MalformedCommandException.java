package work.hostbridge.envelope;

/**
 * Raised when command text is valid JSON but does not have the command envelope shape.
 */
public final class MalformedCommandException extends RuntimeException {
    public MalformedCommandException(String message) {
        super(message);
    }
}
