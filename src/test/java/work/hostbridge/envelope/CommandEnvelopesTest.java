package work.hostbridge.envelope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CommandEnvelopesTest {
    @Test
    void pingIgnoresCaseAndWhitespace() {
        assertTrue(CommandEnvelopes.isPing("ping"));
        assertTrue(CommandEnvelopes.isPing("  PiNg\n"));
        assertFalse(CommandEnvelopes.isPing("pingx"));
        assertFalse(CommandEnvelopes.isPing(null));
    }

    @Test
    void validJsonRequiresObjectOrArrayDelimiters() {
        assertTrue(CommandEnvelopes.isValidJson("{\"type\":\"x\"}"));
        assertTrue(CommandEnvelopes.isValidJson("  [1, 2]  "));
        assertFalse(CommandEnvelopes.isValidJson("\"just a string\""));
        assertFalse(CommandEnvelopes.isValidJson("42"));
        assertFalse(CommandEnvelopes.isValidJson("{not json}"));
        assertFalse(CommandEnvelopes.isValidJson(""));
    }

    @Test
    void trailingContentIsNotValidJson() {
        assertFalse(CommandEnvelopes.isValidJson("{\"type\":\"echo\"} garbage }"));
        assertFalse(CommandEnvelopes.isValidJson("{\"type\":\"ping\"}{\"type\":\"x\"}"));
        assertFalse(CommandEnvelopes.isValidJson("[1] [2]"));
        assertTrue(CommandEnvelopes.isValidJson("{\"type\":\"echo\"}\n"));
    }

    @Test
    void parsesTypeAndParams() {
        CommandEnvelope envelope = CommandEnvelopes.parse(
            "{\"type\":\"manage_editor\",\"params\":{\"action\":\"play\",\"n\":3,\"list\":[1,2]}}"
        );

        assertEquals("manage_editor", envelope.type());
        assertEquals("play", envelope.params().get("action"));
        assertEquals(3, envelope.params().get("n"));
        assertEquals(List.of(1, 2), envelope.params().get("list"));
    }

    @Test
    void missingParamsBecomeEmptyMap() {
        CommandEnvelope envelope = CommandEnvelopes.parse("{\"type\":\"read_console\"}");
        assertEquals(Map.of(), envelope.params());

        CommandEnvelope withNull = CommandEnvelopes.parse("{\"type\":\"read_console\",\"params\":null}");
        assertTrue(withNull.params().isEmpty());
    }

    @Test
    void missingTypeIsReportedAsNoType() {
        CommandEnvelope envelope = CommandEnvelopes.parse("{\"params\":{}}");
        assertNull(envelope.type());
        assertFalse(envelope.hasType());
        assertFalse(CommandEnvelopes.parse("{\"type\":\"  \"}").hasType());
    }

    @Test
    void rejectsNonObjectShapes() {
        var array = assertThrows(MalformedCommandException.class, () -> CommandEnvelopes.parse("[1]"));
        assertEquals("Command must be a JSON object", array.getMessage());

        var params = assertThrows(
            MalformedCommandException.class,
            () -> CommandEnvelopes.parse("{\"type\":\"x\",\"params\":[1]}")
        );
        assertEquals("Command params must be a JSON object", params.getMessage());
    }

    @Test
    void truncatesLongEchoes() {
        String longText = "x".repeat(80);
        assertEquals("x".repeat(50) + "...", CommandEnvelopes.truncate(longText));
        assertEquals("short", CommandEnvelopes.truncate("short"));
    }
}
