package net.hourglass.core.maintenance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesEventLogTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void append_writesOneJsonObjectPerLine() throws Exception {
        Path file = dir.resolve("logs/nested/watchdog_events.jsonl");
        var log = new JsonLinesEventLog(file);

        Map<String, Object> stuck = new LinkedHashMap<>();
        stuck.put("run_id", 7L);
        stuck.put("job_id", 3L);
        stuck.put("elapsed_sec", 2701L);
        stuck.put("timestamp", "2025-01-06T12:00:00Z");
        log.append(Watchdog.EVENT_STUCK_KILL, stuck);
        log.append(Watchdog.EVENT_ORPHAN_LOCK_CLEANUP, Map.of("count", 2));

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());

        JsonNode first = mapper.readTree(lines.get(0));
        assertEquals("stuck_kill", first.get("type").asText());
        assertEquals(7, first.get("run_id").asLong());
        assertEquals("2025-01-06T12:00:00Z", first.get("timestamp").asText());

        JsonNode second = mapper.readTree(lines.get(1));
        assertEquals("orphan_lock_cleanup", second.get("type").asText());
        assertEquals(2, second.get("count").asInt());
        assertTrue(second.hasNonNull("timestamp"));
    }

    @Test
    void append_swallowsWriteFailure() throws Exception {
        Path blocked = Files.createDirectory(dir.resolve("is-a-directory"));
        var log = new JsonLinesEventLog(blocked);
        assertDoesNotThrow(() -> log.append("consecutive_failures", Map.of("job_id", 1)));
    }
}
