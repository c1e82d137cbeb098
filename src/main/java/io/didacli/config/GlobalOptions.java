package io.didacli.config;

/** Values given on the command line; they win over the config file. */
public record GlobalOptions(
        String configPath,
        String token,
        String cacheDir,
        String timezone
) {
    public static GlobalOptions none() {
        return new GlobalOptions(null, null, null, null);
    }
}
