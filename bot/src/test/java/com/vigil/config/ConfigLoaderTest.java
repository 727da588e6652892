package com.vigil.config;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.vigil.state.StatType;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class ConfigLoaderTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path workDir;
    private Map<String, String> env;

    @Before
    public void setUp() {
        workDir = tmp.getRoot().toPath();
        env = new HashMap<>();
    }

    private Path write(String relative, String json) throws IOException {
        Path path = workDir.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.write(path, json.getBytes(StandardCharsets.UTF_8));
        return path;
    }

    @Test
    public void testLoad_BundledDefaults() {
        RunnerConfig config = new ConfigLoader(workDir, env).load(null);

        assertEquals(0.35, config.getPolicy().getFleeBelowHpPct(), 0.0);
        assertEquals(12, config.getPolicy().getStartingWeaponId());
        assertEquals(Arrays.asList(StatType.VITALITY, StatType.STRENGTH, StatType.DEXTERITY),
                config.getPolicy().getStatUpgradePriority());
        assertEquals(ChainConfig.SIGNER_CONTROLLER, config.getChain().getSigner());
        assertEquals(400, config.getPacing().getThinkDelay().getMin());
        assertTrue(Files.isDirectory(workDir.resolve("data")));
    }

    @Test
    public void testLoad_OverlayMergesSections() throws IOException {
        write("custom.json", "{\"app\":{\"dataDir\":\"./state\"},"
                + "\"policy\":{\"minFleeChance\":0.6},"
                + "\"pacing\":{\"thinkDelay\":{\"min\":10,\"max\":20}}}");

        RunnerConfig config = new ConfigLoader(workDir, env).load("custom.json");

        assertEquals(0.6, config.getPolicy().getMinFleeChance(), 0.0);
        // untouched siblings keep their defaults
        assertEquals(0.35, config.getPolicy().getFleeBelowHpPct(), 0.0);
        assertEquals(20, config.getPacing().getThinkDelay().getMax());
        assertEquals(5_000, config.getPacing().getMarketDwell().getMax());
        assertTrue(Files.isDirectory(workDir.resolve("state")));
    }

    @Test
    public void testLoad_OverlayFromEnvironmentThenLocalFile() throws IOException {
        write("env.json", "{\"recovery\":{\"idlePollMs\":250,\"failureBackoffMs\":10}}");
        write(ConfigLoader.LOCAL_FILE, "{\"recovery\":{\"idlePollMs\":500}}");
        env.put(ConfigLoader.ENV_CONFIG, "env.json");

        RunnerConfig config = new ConfigLoader(workDir, env).load(null);

        assertEquals(500, config.getRecovery().getIdlePollMs());
        assertEquals(10, config.getRecovery().getFailureBackoffMs());
    }

    @Test
    public void testLoad_EnvironmentOverrides() {
        env.put(ConfigLoader.ENV_BRIDGE_TOKEN, "secret");
        env.put(ConfigLoader.ENV_ADVENTURER_ID, " 4242 ");

        RunnerConfig config = new ConfigLoader(workDir, env).load(null);

        assertEquals("secret", config.getChain().getBridgeToken());
        assertEquals(4242L, config.getSession().getAdventurerId());
    }

    @Test(expected = ConfigException.class)
    public void testLoad_BadAdventurerIdFromEnvironment() {
        env.put(ConfigLoader.ENV_ADVENTURER_ID, "abc");
        new ConfigLoader(workDir, env).load(null);
    }

    @Test(expected = ConfigException.class)
    public void testLoad_MissingOverlayFile() {
        new ConfigLoader(workDir, env).load("nope.json");
    }

    @Test
    public void testLoad_InvalidJson() throws IOException {
        write("broken.json", "{\"policy\": ");
        try {
            new ConfigLoader(workDir, env).load("broken.json");
            fail("expected ConfigException");
        } catch (ConfigException e) {
            assertTrue(e.getMessage().contains("broken.json"));
        }
    }

    @Test
    public void testLoad_WrongValueType() throws IOException {
        write("typed.json", "{\"policy\":{\"slowFightTurns\":\"many\"}}");
        try {
            new ConfigLoader(workDir, env).load("typed.json");
            fail("expected ConfigException");
        } catch (ConfigException e) {
            assertTrue(e.getMessage().contains("wrong type"));
        }
    }

    @Test
    public void testLoad_ValidationListsEveryIssue() throws IOException {
        write("invalid.json", "{\"policy\":{\"fleeBelowHpPct\":1.5},\"chain\":{\"signer\":\"wallet\"}}");
        try {
            new ConfigLoader(workDir, env).load("invalid.json");
            fail("expected ConfigException");
        } catch (ConfigException e) {
            assertEquals(2, e.getIssues().size());
            assertTrue(e.getIssues().get(0).startsWith("policy.fleeBelowHpPct"));
            assertTrue(e.getIssues().get(1).startsWith("chain.signer"));
        }
    }

    @Test
    public void testDeepMerge_ArraysReplace() {
        JsonObject base = JsonParser.parseString("{\"a\":{\"x\":1,\"y\":[1,2]},\"b\":2}").getAsJsonObject();
        JsonObject override = JsonParser.parseString("{\"a\":{\"y\":[3]},\"c\":true}").getAsJsonObject();

        JsonObject merged = ConfigLoader.deepMerge(base, override);

        assertEquals(JsonParser.parseString("{\"a\":{\"x\":1,\"y\":[3]},\"b\":2,\"c\":true}"), merged);
        // inputs untouched
        assertEquals(2, base.getAsJsonObject("a").getAsJsonArray("y").size());
    }
}
