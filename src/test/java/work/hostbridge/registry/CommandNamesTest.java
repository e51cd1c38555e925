package work.hostbridge.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class CommandNamesTest {
    @Test
    void convertsPascalCaseToSnakeCase() {
        assertEquals("manage_asset", CommandNames.toSnakeCase("ManageAsset"));
        assertEquals("execute_menu_item", CommandNames.toSnakeCase("ExecuteMenuItem"));
        assertEquals("read", CommandNames.toSnakeCase("Read"));
    }

    @Test
    void keepsAcronymsTogether() {
        assertEquals("http_server", CommandNames.toSnakeCase("HTTPServer"));
        assertEquals("get_http_response", CommandNames.toSnakeCase("GetHTTPResponse"));
    }

    @Test
    void explicitNameWinsOverClassName() {
        assertEquals("custom", CommandNames.derive(CommandUnit.of("  custom ", params -> HandlerResult.immediate(null))));
    }

    @Test
    void derivesFromClassNameWhenNoExplicitName() {
        assertEquals("rebuild_lighting", CommandNames.derive(new RebuildLighting()));
    }

    static final class RebuildLighting implements CommandUnit {
        @Override
        public CommandHandler handler() {
            return params -> HandlerResult.immediate("done");
        }
    }
}
