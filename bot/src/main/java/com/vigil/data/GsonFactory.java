package com.vigil.data;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * Centralized factory for Gson instances used by config, session, progress and
 * event files.
 *
 * <p>{@link Instant} and {@link Duration} are written as ISO-8601 strings instead of
 * going through reflection, which the module system blocks for java.time internals.
 */
public final class GsonFactory {

    private GsonFactory() {
        // Utility class - prevent instantiation
    }

    public static Gson create() {
        return builder().create();
    }

    public static Gson createPrettyPrinting() {
        return builder().setPrettyPrinting().create();
    }

    public static GsonBuilder builder() {
        return new GsonBuilder()
                .disableHtmlEscaping()
                .registerTypeAdapter(Instant.class, new InstantAdapter())
                .registerTypeAdapter(Duration.class, new DurationAdapter());
    }

    // ========================================================================
    // TypeAdapters for java.time types (ISO-8601 format)
    // ========================================================================

    /**
     * Example: "2024-01-15T10:30:00Z"
     */
    private static class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.toString());
            }
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return Instant.parse(in.nextString());
        }
    }

    /**
     * Example: "PT1H30M"
     */
    private static class DurationAdapter extends TypeAdapter<Duration> {
        @Override
        public void write(JsonWriter out, Duration value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.toString());
            }
        }

        @Override
        public Duration read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return Duration.parse(in.nextString());
        }
    }
}
