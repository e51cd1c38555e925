package work.hostbridge.registry;

import java.util.Map;

/**
 * Executable command registered in the {@link CommandRegistry}. Always invoked on the host loop thread.
 */
@FunctionalInterface
public interface CommandHandler {
    HandlerResult handle(Map<String, Object> params) throws Exception;
}
