package io.didacli.cache;

public enum CacheSource {
    MEMORY,
    DISK,
    NONE
}
