package work.hostbridge.registry;

/**
 * A handler-providing unit picked up by {@link CommandRegistry#initialize()}.
 */
public interface CommandUnit {
    /**
     * Explicit wire name. When {@code null} or blank the registry derives one from the unit's class name.
     */
    default String commandName() {
        return null;
    }

    /**
     * Handler for this unit. Returning {@code null} marks the unit as misconfigured; it is skipped with a warning.
     */
    CommandHandler handler();

    static CommandUnit of(String name, CommandHandler handler) {
        return new CommandUnit() {
            @Override
            public String commandName() {
                return name;
            }

            @Override
            public CommandHandler handler() {
                return handler;
            }

            @Override
            public String toString() {
                return "CommandUnit[" + name + "]";
            }
        };
    }
}
