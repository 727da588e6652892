package com.vigil.config;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.vigil.data.GsonFactory;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link RunnerConfig} in layers:
 * <ol>
 *   <li>bundled {@code /config/default.json}</li>
 *   <li>the file named by {@code VIGIL_CONFIG} (or passed explicitly)</li>
 *   <li>{@code config/local.json} under the working directory, when present</li>
 *   <li>environment overrides for sensitive or per-process values</li>
 * </ol>
 * JSON objects are deep-merged; any other value replaces the lower layer.
 */
@Slf4j
public class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "/config/default.json";
    public static final String LOCAL_FILE = "config/local.json";

    public static final String ENV_CONFIG = "VIGIL_CONFIG";
    public static final String ENV_BRIDGE_TOKEN = "VIGIL_BRIDGE_TOKEN";
    public static final String ENV_ADVENTURER_ID = "VIGIL_ADVENTURER_ID";

    private final Gson gson;
    private final Path workingDir;
    private final Map<String, String> env;

    public ConfigLoader() {
        this(Paths.get("").toAbsolutePath(), System.getenv());
    }

    public ConfigLoader(Path workingDir, Map<String, String> env) {
        this.gson = GsonFactory.create();
        this.workingDir = workingDir;
        this.env = env;
    }

    /**
     * @param explicitPath config file given on the command line, or null to use {@code VIGIL_CONFIG}
     * @throws ConfigException when a layer cannot be read or the result is invalid
     */
    public RunnerConfig load(@Nullable String explicitPath) {
        JsonObject merged = readDefaults();

        String overlayPath = explicitPath != null ? explicitPath : env.get(ENV_CONFIG);
        Path overlay = null;
        if (overlayPath != null && !overlayPath.trim().isEmpty()) {
            overlay = workingDir.resolve(overlayPath.trim()).normalize();
            if (!Files.exists(overlay)) {
                throw new ConfigException("Config file not found: " + overlay);
            }
            merged = deepMerge(merged, readFile(overlay));
            log.info("Loaded config overlay {}", overlay);
        }

        Path local = workingDir.resolve(LOCAL_FILE).normalize();
        if (Files.exists(local) && !local.equals(overlay)) {
            merged = deepMerge(merged, readFile(local));
            log.info("Loaded local config overrides {}", local);
        }

        RunnerConfig config;
        try {
            config = gson.fromJson(merged, RunnerConfig.class);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            throw new ConfigException("Config has a value of the wrong type: " + e.getMessage(), e);
        }
        applyEnvironment(config);
        config.validate();
        ensureDataDir(config);
        return config;
    }

    // ========================================================================
    // Layers
    // ========================================================================

    private JsonObject readDefaults() {
        try (InputStream is = ConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                log.warn("Bundled config {} not found, using built-in defaults", DEFAULT_RESOURCE);
                return new JsonObject();
            }
            return parseObject(new InputStreamReader(is, StandardCharsets.UTF_8), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    private JsonObject readFile(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parseObject(reader, path.toString());
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file " + path, e);
        }
    }

    private static JsonObject parseObject(Reader reader, String source) {
        try {
            JsonElement element = JsonParser.parseReader(reader);
            if (!element.isJsonObject()) {
                throw new ConfigException("Config " + source + " must contain a JSON object");
            }
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new ConfigException("Config " + source + " is not valid JSON: " + e.getMessage(), e);
        }
    }

    private void applyEnvironment(RunnerConfig config) {
        String token = env.get(ENV_BRIDGE_TOKEN);
        if (token != null && !token.isEmpty()) {
            config.getChain().setBridgeToken(token);
        }
        String adventurerId = env.get(ENV_ADVENTURER_ID);
        if (adventurerId != null && !adventurerId.trim().isEmpty()) {
            try {
                config.getSession().setAdventurerId(Long.parseLong(adventurerId.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigException(ENV_ADVENTURER_ID + " must be a number, got '" + adventurerId + "'", e);
            }
        }
    }

    private void ensureDataDir(RunnerConfig config) {
        Path dataDir = workingDir.resolve(config.getApp().getDataDir()).normalize();
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new ConfigException("Cannot create data directory " + dataDir, e);
        }
    }

    /**
     * Merge {@code override} into a copy of {@code base}. Nested objects merge
     * recursively; arrays and primitives replace.
     */
    static JsonObject deepMerge(JsonObject base, JsonObject override) {
        JsonObject out = base.deepCopy();
        for (Map.Entry<String, JsonElement> entry : override.entrySet()) {
            JsonElement existing = out.get(entry.getKey());
            JsonElement value = entry.getValue();
            if (existing != null && existing.isJsonObject() && value.isJsonObject()) {
                out.add(entry.getKey(), deepMerge(existing.getAsJsonObject(), value.getAsJsonObject()));
            } else {
                out.add(entry.getKey(), value.deepCopy());
            }
        }
        return out;
    }
}
