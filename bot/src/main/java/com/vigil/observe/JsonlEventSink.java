package com.vigil.observe;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;

/**
 * Writes one JSON object per line: {@code ts}, {@code level}, {@code event} and the
 * data fields. Milestones go to their own file. Every record is mirrored to SLF4J.
 * I/O failures are logged and dropped.
 */
@Slf4j
public class JsonlEventSink implements EventSink {

    private final Path eventsFile;
    private final Path milestonesFile;
    private final Gson gson;
    private final Clock clock;

    public JsonlEventSink(Path eventsFile, Path milestonesFile, Gson gson, Clock clock) {
        this.eventsFile = eventsFile;
        this.milestonesFile = milestonesFile;
        this.gson = gson;
        this.clock = clock;
    }

    @Override
    public void log(EventLevel level, String event, Map<String, ?> data) {
        mirror(level, event, data);
        append(eventsFile, record(level.name().toLowerCase(Locale.ROOT), event, data));
    }

    @Override
    public void milestone(String name, Map<String, ?> data) {
        log.info("milestone {} {}", name, data);
        JsonObject record = record("info", name, data);
        record.addProperty("milestone", true);
        append(milestonesFile, record);
    }

    JsonObject record(String level, String event, Map<String, ?> data) {
        JsonObject record = new JsonObject();
        record.addProperty("ts", clock.instant().toString());
        record.addProperty("level", level);
        record.addProperty("event", event);
        if (data != null) {
            for (Map.Entry<String, ?> entry : data.entrySet()) {
                JsonElement value = gson.toJsonTree(entry.getValue());
                record.add(entry.getKey(), value);
            }
        }
        return record;
    }

    private synchronized void append(Path file, JsonObject record) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, gson.toJson(record) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Failed to append event to {}: {}", file, e.getMessage());
        }
    }

    private static void mirror(EventLevel level, String event, Map<String, ?> data) {
        switch (level) {
            case DEBUG:
                log.debug("{} {}", event, data);
                break;
            case WARN:
                log.warn("{} {}", event, data);
                break;
            case ERROR:
                log.error("{} {}", event, data);
                break;
            default:
                log.info("{} {}", event, data);
        }
    }
}
