package io.didacli.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.didacli.error.AuthException;
import io.didacli.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;

/**
 * Reads and writes the credential file. Writes go to a temp file in the same
 * directory and are moved over the target, so readers never observe a partial
 * file. On POSIX file systems the file is owner read/write only.
 */
public final class TokenStore {
    public static final long DEFAULT_SKEW_SECONDS = 60L;

    private static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-------");
    private static final Set<PosixFilePermission> DIR_PERMISSIONS = PosixFilePermissions.fromString("rwx------");
    private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public TokenStore() {
        this(Clock.systemUTC());
    }

    TokenStore(Clock clock) {
        this.clock = clock;
    }

    public Optional<Credential> load(Path path) throws IOException {
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            throw new AuthException("Invalid token file " + path + ": malformed JSON", e);
        }
        return Optional.of(Credential.fromNode(node, "Invalid token"));
    }

    public Credential save(Path path, Credential credential) throws IOException {
        Credential normalized = normalize(credential);
        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        boolean posix = supportsPosix(dir);
        if (!Files.isDirectory(dir)) {
            Files.createDirectories(dir);
            if (posix) {
                Files.setPosixFilePermissions(dir, DIR_PERMISSIONS);
            }
        }

        Path tmp = dir.resolve(".tmp-" + ProcessHandle.current().pid() + "-" + clock.millis() + "-" + randomSuffix() + ".json");
        byte[] bytes = Jsons.toJson(normalized).getBytes(StandardCharsets.UTF_8);
        try {
            Set<OpenOption> options = Set.of(StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            FileAttribute<?>[] attrs = posix
                    ? new FileAttribute<?>[]{PosixFilePermissions.asFileAttribute(FILE_PERMISSIONS)}
                    : new FileAttribute<?>[0];
            try (FileChannel channel = FileChannel.open(tmp, options, attrs)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            if (posix) {
                Files.setPosixFilePermissions(target, FILE_PERMISSIONS);
            }
            return normalized;
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    public void clear(Path path) throws IOException {
        Files.deleteIfExists(path);
    }

    public Credential normalize(Credential credential) {
        return credential.normalized(clock.millis());
    }

    public boolean isExpired(Credential credential) {
        return isExpired(credential, DEFAULT_SKEW_SECONDS);
    }

    /** A credential without {@code expiresAt} never expires. */
    public boolean isExpired(Credential credential, long skewSeconds) {
        if (credential == null || credential.expiresAt() == null) {
            return false;
        }
        return clock.millis() >= credential.expiresAt() - skewSeconds * 1000L;
    }

    private String randomSuffix() {
        StringBuilder sb = new StringBuilder(10);
        for (int i = 0; i < 10; i++) {
            sb.append(SUFFIX_ALPHABET.charAt(random.nextInt(SUFFIX_ALPHABET.length())));
        }
        return sb.toString();
    }

    private static boolean supportsPosix(Path dir) {
        return dir.getFileSystem().supportedFileAttributeViews().contains("posix");
    }
}
