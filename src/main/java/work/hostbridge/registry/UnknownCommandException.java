package work.hostbridge.registry;

/**
 * Raised when a command name has no registered handler.
 */
public final class UnknownCommandException extends RuntimeException {
    private final String command;

    public UnknownCommandException(String command) {
        super("Unknown or unsupported command type: " + command);
        this.command = command;
    }

    public String command() {
        return command;
    }
}
