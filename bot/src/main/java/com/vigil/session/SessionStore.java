package com.vigil.session;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.vigil.data.GsonFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Loads and saves the session record as pretty-printed JSON. The previous file is
 * kept as {@code <file>.bak} on every save. A missing or unreadable file counts as
 * no session.
 */
@Slf4j
public class SessionStore {

    private final Path file;
    private final Gson gson;

    public SessionStore(Path file) {
        this.file = file;
        this.gson = GsonFactory.createPrettyPrinting();
    }

    public Path getFile() {
        return file;
    }

    public Optional<SessionRecord> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            SessionRecord record = gson.fromJson(json, SessionRecord.class);
            if (record == null || record.getAddress() == null || record.getAddress().isEmpty()) {
                log.warn("Session file {} has no address, ignoring it", file);
                return Optional.empty();
            }
            log.info("Loaded session for {} (adventurer {})", record.getAddress(), record.getAdventurerId());
            return Optional.of(record);
        } catch (IOException | JsonParseException e) {
            log.warn("Failed to read session file {}, treating as absent: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(SessionRecord record) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (Files.exists(file)) {
            Path backup = Paths.get(file.toString() + ".bak");
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
        }
        Files.writeString(file, gson.toJson(record), StandardCharsets.UTF_8);
        log.debug("Saved session to {} (adventurer {})", file, record.getAdventurerId());
    }
}
