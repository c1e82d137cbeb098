package io.didacli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.didacli.error.ValidationException;
import io.didacli.testing.TestFiles;
import io.didacli.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class ConfigLoaderTest {
    private Path root;
    private Path cwd;
    private Path home;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("dida-config-");
        cwd = Files.createDirectories(root.resolve("work"));
        home = Files.createDirectories(root.resolve("home"));
    }

    @AfterEach
    void tearDown() throws Exception {
        TestFiles.deleteRecursively(root);
    }

    @Test
    void noFileYieldsEmptyConfig() {
        ConfigLoader.LoadedConfig loaded = new ConfigLoader(Map.of(), cwd, home).load(null);

        Assertions.assertNull(loaded.path());
        Assertions.assertEquals(0, loaded.raw().size());
        Assertions.assertTrue(loaded.warnings().isEmpty());
    }

    @Test
    void lookupOrderIsExplicitEnvCwdHome() throws Exception {
        Path explicit = write(root.resolve("explicit.json"), "{\"timezone\":\"UTC\"}");
        Path fromEnv = write(root.resolve("env.json"), "{\"timezone\":\"Europe/Paris\"}");
        Path inCwd = write(cwd.resolve("dida.config.json"), "{\"timezone\":\"Asia/Tokyo\"}");
        Path inHome = write(home.resolve(".config/dida.json"), "{\"timezone\":\"America/New_York\"}");

        ConfigLoader withEnv = new ConfigLoader(Map.of("DIDA_CONFIG", fromEnv.toString()), cwd, home);
        Assertions.assertEquals(explicit, withEnv.load(explicit.toString()).path());
        Assertions.assertEquals(fromEnv, withEnv.load(null).path());
        Assertions.assertEquals("Europe/Paris", withEnv.load(null).file().timezone());

        ConfigLoader noEnv = new ConfigLoader(Map.of(), cwd, home);
        Assertions.assertEquals(inCwd, noEnv.load(null).path());
        Files.delete(inCwd);
        Assertions.assertEquals(inHome, noEnv.load(null).path());
    }

    @Test
    void unreadableConfigBecomesEmptyWithWarning() throws Exception {
        Path broken = write(root.resolve("broken.json"), "{oops");
        ConfigLoader.LoadedConfig loaded = new ConfigLoader(Map.of(), cwd, home).load(broken.toString());

        Assertions.assertEquals(broken, loaded.path());
        Assertions.assertEquals(0, loaded.raw().size());
        Assertions.assertEquals(1, loaded.warnings().size());
        Assertions.assertTrue(loaded.warnings().get(0).startsWith("Failed to read config at "));

        Path array = write(root.resolve("array.json"), "[]");
        Assertions.assertEquals(1, new ConfigLoader(Map.of(), cwd, home).load(array.toString()).warnings().size());
    }

    @Test
    void mistypedValueIsAValidationError() throws Exception {
        Path bad = write(root.resolve("bad.json"), "{\"http\":{\"timeoutMs\":\"soon\"}}");
        Assertions.assertThrows(ValidationException.class,
                () -> new ConfigLoader(Map.of(), cwd, home).load(bad.toString()));
    }

    @Test
    void writePathPrefersExplicitThenEnvThenExistingCwdFile() throws Exception {
        ConfigLoader loader = new ConfigLoader(Map.of(), cwd, home);
        Assertions.assertEquals(home.resolve(".config/dida.json"), loader.resolveWritePath(null));
        write(cwd.resolve("dida.config.json"), "{}");
        Assertions.assertEquals(cwd.resolve("dida.config.json"), loader.resolveWritePath(null));
        Assertions.assertEquals(Path.of("/x/y.json"), loader.resolveWritePath("/x/y.json"));

        ConfigLoader withEnv = new ConfigLoader(Map.of("DIDA_CONFIG", "/env/dida.json"), cwd, home);
        Assertions.assertEquals(Path.of("/env/dida.json"), withEnv.resolveWritePath(null));
    }

    @Test
    void dottedPathsReadAndCreateNestedObjects() throws Exception {
        ObjectNode config = Jsons.mapper().createObjectNode();
        ConfigLoader.setByDottedPath(config, "http.timeoutMs", ConfigLoader.parseValue("30000"));
        ConfigLoader.setByDottedPath(config, "tags.requiredTags", ConfigLoader.parseValue("[\"work\",\"cli\"]"));
        ConfigLoader.setByDottedPath(config, "timezone", ConfigLoader.parseValue("Asia/Shanghai"));

        Assertions.assertEquals(30_000L, ConfigLoader.getByDottedPath(config, "http.timeoutMs").asLong());
        Assertions.assertTrue(ConfigLoader.getByDottedPath(config, "tags.requiredTags").isArray());
        Assertions.assertEquals("Asia/Shanghai", ConfigLoader.getByDottedPath(config, "timezone").asText());
        Assertions.assertNull(ConfigLoader.getByDottedPath(config, "http.retries"));
        Assertions.assertNull(ConfigLoader.getByDottedPath(config, "timezone.nested"));
        Assertions.assertThrows(ValidationException.class,
                () -> ConfigLoader.setByDottedPath(config, " . ", ConfigLoader.parseValue("1")));

        Path file = root.resolve("out/dida.json");
        ConfigLoader.write(file, config);
        JsonNode reread = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
        Assertions.assertEquals(config, reread);
    }

    private static Path write(Path file, String content) throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
