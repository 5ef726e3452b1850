package net.hourglass.core.maintenance;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.hourglass.core.spi.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** 한 줄에 JSON 객체 하나씩 append */
public final class JsonLinesEventLog implements EventLog {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesEventLog.class);

    private final Path file;
    private final ObjectMapper mapper;

    public JsonLinesEventLog(Path file) {
        this(file, new ObjectMapper());
    }

    public JsonLinesEventLog(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public synchronized void append(String type, Map<String, Object> fields) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("type", type);
        record.putAll(fields);
        record.putIfAbsent("timestamp", Instant.now().toString());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            String line = mapper.writeValueAsString(record) + "\n";
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to write event {} to {}", type, file, e);
        }
    }

    public Path file() {
        return file;
    }
}
