package work.hostbridge.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import work.hostbridge.host.FrameHostLoop;
import work.hostbridge.registry.HandlerResult;

class RunTestsTest {
    @SuppressWarnings("unchecked")
    private static Map<String, Object> await(FrameHostLoop loop, HandlerResult result) throws Exception {
        assertTrue(result instanceof HandlerResult.Deferred);
        CompletableFuture<?> future = ((HandlerResult.Deferred) result).future();
        loop.frameUntil(future::isDone, 50);
        assertTrue(future.isDone());
        return (Map<String, Object>) future.get();
    }

    @Test
    @SuppressWarnings("unchecked")
    void runsOneTestPerFrameAndSummarizes() throws Exception {
        var host = new EditorHost();
        host.registerTest("Passes", EditorHost.TestMode.EDIT_MODE, () -> {});
        host.registerTest("Fails", EditorHost.TestMode.EDIT_MODE, () -> {
            throw new AssertionError("expected 1 but was 2");
        });
        host.registerTest("PlayOnly", EditorHost.TestMode.PLAY_MODE, () -> {});
        var loop = new FrameHostLoop();

        HandlerResult result = new RunTests(host, loop).handle(Map.of());
        loop.frame();
        assertFalse(((HandlerResult.Deferred) result).future().isDone());

        var response = await(loop, result);

        assertEquals(true, response.get("success"));
        assertEquals("EditMode tests completed: 1/2 passed, 1 failed, 0 skipped", response.get("message"));
        var data = (Map<String, Object>) response.get("data");
        assertEquals("EditMode", data.get("mode"));
        assertEquals(Map.of("total", 2, "passed", 1, "failed", 1, "skipped", 0), data.get("summary"));
        var results = (List<Map<String, Object>>) data.get("results");
        assertEquals("Passed", results.get(0).get("outcome"));
        assertEquals("Failed", results.get(1).get("outcome"));
        assertEquals("expected 1 but was 2", results.get(1).get("message"));
    }

    @Test
    void selectsPlayModeTests() throws Exception {
        var host = new EditorHost();
        host.registerTest("EditOnly", EditorHost.TestMode.EDIT_MODE, () -> {});
        host.registerTest("PlayOnly", EditorHost.TestMode.PLAY_MODE, () -> {});
        var loop = new FrameHostLoop();

        var response = await(loop, new RunTests(host, loop).handle(Map.of("mode", "playmode")));

        assertEquals("PlayMode tests completed: 1/1 passed, 0 failed, 0 skipped", response.get("message"));
    }

    @Test
    void invalidModeIsImmediateError() {
        var loop = new FrameHostLoop();
        var result = new RunTests(new EditorHost(), loop).handle(Map.of("mode", "Batch"));

        assertTrue(result instanceof HandlerResult.Immediate);
        @SuppressWarnings("unchecked")
        var response = (Map<String, Object>) ((HandlerResult.Immediate) result).value();
        assertEquals("Unknown test mode: 'Batch'. Use 'EditMode' or 'PlayMode'.", response.get("error"));
        assertEquals(0, loop.postedCount());
    }

    @Test
    void stopsWhenTimeoutElapses() throws Exception {
        var host = new EditorHost();
        host.registerTest("Slow", EditorHost.TestMode.EDIT_MODE, () -> Thread.sleep(1_100));
        host.registerTest("NeverReached", EditorHost.TestMode.EDIT_MODE, () -> {
            throw new AssertionError("should not run");
        });
        var loop = new FrameHostLoop();

        var response = await(loop, new RunTests(host, loop).handle(Map.of("timeoutSeconds", 1)));

        assertEquals(false, response.get("success"));
        assertEquals("Test run timed out after 1 seconds", response.get("error"));
    }
}
