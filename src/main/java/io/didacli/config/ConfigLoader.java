package io.didacli.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.didacli.error.ValidationException;
import io.didacli.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds and reads the JSON config file. Lookup order: explicit path,
 * {@code $DIDA_CONFIG}, {@code ./dida.config.json}, {@code ~/.config/dida.json};
 * the first file that exists wins.
 */
public final class ConfigLoader {
    public static final String ENV_CONFIG = "DIDA_CONFIG";
    public static final String CWD_FILE_NAME = "dida.config.json";

    private final Map<String, String> env;
    private final Path cwd;
    private final Path home;

    public ConfigLoader(Map<String, String> env, Path cwd, Path home) {
        this.env = env == null ? Map.of() : env;
        this.cwd = cwd;
        this.home = home;
    }

    public static ConfigLoader system() {
        return new ConfigLoader(
                System.getenv(),
                Paths.get("").toAbsolutePath(),
                Paths.get(System.getProperty("user.home", "."))
        );
    }

    public Path defaultConfigPath() {
        return home.resolve(".config").resolve("dida.json");
    }

    public Path cwdConfigPath() {
        return cwd.resolve(CWD_FILE_NAME);
    }

    public LoadedConfig load(String explicitPath) {
        List<String> warnings = new ArrayList<>();
        for (Path candidate : candidates(explicitPath)) {
            if (!Files.exists(candidate)) {
                continue;
            }
            ObjectNode raw;
            try {
                JsonNode node = Jsons.mapper().readTree(Files.readString(candidate, StandardCharsets.UTF_8));
                if (node == null || !node.isObject()) {
                    warnings.add("Failed to read config at " + candidate + ": expected a JSON object");
                    return new LoadedConfig(Jsons.mapper().createObjectNode(), ConfigFile.empty(), candidate, warnings);
                }
                raw = (ObjectNode) node;
            } catch (IOException e) {
                warnings.add("Failed to read config at " + candidate + ": " + e.getMessage());
                return new LoadedConfig(Jsons.mapper().createObjectNode(), ConfigFile.empty(), candidate, warnings);
            }
            return new LoadedConfig(raw, toConfigFile(raw, candidate), candidate, warnings);
        }
        return new LoadedConfig(Jsons.mapper().createObjectNode(), ConfigFile.empty(), null, warnings);
    }

    /** Where {@code config set} writes when no file is named explicitly. */
    public Path resolveWritePath(String explicitPath) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            return Paths.get(explicitPath);
        }
        String fromEnv = env.get(ENV_CONFIG);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Paths.get(fromEnv);
        }
        if (Files.exists(cwdConfigPath())) {
            return cwdConfigPath();
        }
        return defaultConfigPath();
    }

    public static void write(Path file, ObjectNode config) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, Jsons.toJson(config), StandardCharsets.UTF_8);
    }

    public static ConfigFile toConfigFile(ObjectNode raw, Path source) {
        try {
            return Jsons.mapper().treeToValue(raw, ConfigFile.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid config" + (source == null ? "" : " at " + source) + ": "
                    + e.getOriginalMessage());
        }
    }

    public static JsonNode getByDottedPath(JsonNode root, String dottedPath) {
        JsonNode cur = root;
        for (String part : splitPath(dottedPath)) {
            if (cur == null || !cur.isObject()) {
                return null;
            }
            cur = cur.get(part);
        }
        return cur;
    }

    public static void setByDottedPath(ObjectNode root, String dottedPath, JsonNode value) {
        List<String> parts = splitPath(dottedPath);
        if (parts.isEmpty()) {
            throw new ValidationException("Missing key.", "key");
        }
        ObjectNode cur = root;
        for (int i = 0; i < parts.size() - 1; i++) {
            JsonNode next = cur.get(parts.get(i));
            if (next == null || !next.isObject()) {
                next = cur.putObject(parts.get(i));
            }
            cur = (ObjectNode) next;
        }
        cur.set(parts.get(parts.size() - 1), value);
    }

    /** JSON literals are parsed; anything else is taken as a plain string. */
    public static JsonNode parseValue(String raw) {
        try {
            return Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            return Jsons.mapper().getNodeFactory().textNode(raw);
        }
    }

    private List<Path> candidates(String explicitPath) {
        List<Path> out = new ArrayList<>();
        if (explicitPath != null && !explicitPath.isBlank()) {
            out.add(Paths.get(explicitPath));
        }
        String fromEnv = env.get(ENV_CONFIG);
        if (fromEnv != null && !fromEnv.isBlank()) {
            out.add(Paths.get(fromEnv));
        }
        out.add(cwdConfigPath());
        out.add(defaultConfigPath());
        return out;
    }

    private static List<String> splitPath(String dottedPath) {
        List<String> parts = new ArrayList<>();
        if (dottedPath == null) {
            return parts;
        }
        for (String part : dottedPath.split("\\.")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    public record LoadedConfig(
            ObjectNode raw,
            ConfigFile file,
            Path path,
            List<String> warnings
    ) {
    }
}
