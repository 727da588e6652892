package com.vigil.observe;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.vigil.data.GsonFactory;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Best progress ever reached and a bounded history of finished runs, kept in
 * {@code <dataDir>/progress.json}. Persistence failures are logged; progress
 * tracking never stops the runner.
 */
@Slf4j
public class ProgressStore {

    public static final String FILE_NAME = "progress.json";
    public static final int MAX_RUNS = 120;
    static final int SCHEMA_VERSION = 1;

    private final Path file;
    private final Clock clock;
    private final Gson gson;
    private ProgressData data;

    public ProgressStore(Path dataDir, int targetLevel, Clock clock) {
        this.file = dataDir.resolve(FILE_NAME);
        this.clock = clock;
        this.gson = GsonFactory.createPrettyPrinting();
        this.data = load(targetLevel);
    }

    // ========================================================================
    // Data
    // ========================================================================

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BestSnapshot {
        private Instant ts;
        private long adventurerId;
        private int level;
        private int xp;
        private long actionCount;

        boolean isBetterThan(@Nullable BestSnapshot other) {
            if (other == null) {
                return true;
            }
            if (level != other.level) {
                return level > other.level;
            }
            if (xp != other.xp) {
                return xp > other.xp;
            }
            return actionCount > other.actionCount;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RunRecord {
        private long adventurerId;
        private Instant startedAt;
        private Instant endedAt;
        private long durationMs;
        private int endLevel;
        private int endXp;
        private long endActionCount;
        private int maxLevel;
        private int maxXp;
    }

    @Data
    static class ProgressData {
        private int version = SCHEMA_VERSION;
        private int targetLevel;
        private Instant updatedAt;
        @Nullable
        private BestSnapshot best;
        private List<RunRecord> runs = new ArrayList<>();
    }

    // ========================================================================
    // Operations
    // ========================================================================

    /**
     * Replace the best snapshot when the sample is ahead by level, then xp, then action count.
     *
     * @return true if the sample became the new best
     */
    public synchronized boolean updateBest(long adventurerId, int level, int xp, long actionCount) {
        BestSnapshot sample = new BestSnapshot(clock.instant(), adventurerId, level, xp, actionCount);
        if (!sample.isBetterThan(data.getBest())) {
            return false;
        }
        data.setBest(sample);
        save();
        return true;
    }

    /**
     * Append a finished run, keeping only the most recent {@value #MAX_RUNS}.
     */
    public synchronized void appendRun(RunRecord run) {
        data.getRuns().add(run);
        while (data.getRuns().size() > MAX_RUNS) {
            data.getRuns().remove(0);
        }
        save();
    }

    @Nullable
    public synchronized BestSnapshot getBest() {
        return data.getBest();
    }

    public synchronized List<RunRecord> getRuns() {
        return Collections.unmodifiableList(new ArrayList<>(data.getRuns()));
    }

    public Path getFile() {
        return file;
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    private ProgressData load(int targetLevel) {
        ProgressData fresh = new ProgressData();
        fresh.setTargetLevel(targetLevel);
        fresh.setUpdatedAt(clock.instant());
        if (!Files.exists(file)) {
            return fresh;
        }
        try {
            ProgressData loaded = gson.fromJson(Files.readString(file, StandardCharsets.UTF_8), ProgressData.class);
            if (loaded == null || loaded.getVersion() != SCHEMA_VERSION) {
                log.warn("Ignoring progress file {} with unknown schema", file);
                return fresh;
            }
            if (loaded.getRuns() == null) {
                loaded.setRuns(new ArrayList<>());
            }
            loaded.setTargetLevel(targetLevel);
            return loaded;
        } catch (IOException | JsonParseException e) {
            log.warn("Failed to read progress file {}: {}", file, e.getMessage());
            return fresh;
        }
    }

    private void save() {
        data.setUpdatedAt(clock.instant());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, gson.toJson(data) + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to save progress: {}", e.getMessage());
        }
    }
}
