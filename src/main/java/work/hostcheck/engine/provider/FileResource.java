package work.hostcheck.engine.provider;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Set;
import java.util.regex.Pattern;
import work.hostcheck.engine.resource.Attribute;
import work.hostcheck.engine.resource.Operation;
import work.hostcheck.engine.resource.ResourceType;
import work.hostcheck.engine.resource.Subject;

/**
 * Files, directories and symlinks on the local filesystem.
 */
@ResourceType(value = "File", description = "Test various files attributes")
public final class FileResource {
    @Attribute
    private final String path;

    private final Path target;

    public FileResource(@Subject String path) {
        this.path = path;
        this.target = Path.of(path);
    }

    @Attribute
    public boolean exists() {
        return Files.exists(target);
    }

    @Attribute
    public boolean isFile() {
        return Files.isRegularFile(target);
    }

    @Attribute
    public boolean isDirectory() {
        return Files.isDirectory(target);
    }

    @Attribute
    public boolean isSymlink() {
        return Files.isSymbolicLink(target);
    }

    @Attribute
    public String linkedTo() throws IOException {
        if (!Files.isSymbolicLink(target)) {
            throw new IllegalStateException(path + " is not a symlink");
        }
        return target.toRealPath().toString();
    }

    @Attribute
    public String user() throws IOException {
        return posix().owner().getName();
    }

    @Attribute
    public String group() throws IOException {
        return posix().group().getName();
    }

    /**
     * Permission bits as an integer, e.g. {@code 420} for {@code 0644}.
     */
    @Attribute
    public int mode() throws IOException {
        Set<PosixFilePermission> permissions = posix().permissions();
        int mode = 0;
        for (PosixFilePermission permission : permissions) {
            mode |= switch (permission) {
                case OWNER_READ -> 0400;
                case OWNER_WRITE -> 0200;
                case OWNER_EXECUTE -> 0100;
                case GROUP_READ -> 040;
                case GROUP_WRITE -> 020;
                case GROUP_EXECUTE -> 010;
                case OTHERS_READ -> 04;
                case OTHERS_WRITE -> 02;
                case OTHERS_EXECUTE -> 01;
            };
        }
        return mode;
    }

    @Attribute
    public long size() throws IOException {
        return Files.size(target);
    }

    @Attribute
    public long mtime() throws IOException {
        return Files.getLastModifiedTime(target).toInstant().getEpochSecond();
    }

    @Attribute
    public String contentString() throws IOException {
        return Files.readString(target, StandardCharsets.UTF_8);
    }

    @Attribute
    public String sha256sum() throws IOException {
        return digest("SHA-256");
    }

    @Attribute
    public String md5sum() throws IOException {
        return digest("MD5");
    }

    /**
     * Whether any line of the file matches {@code pattern}. Missing or unreadable files never match.
     */
    @Operation
    public boolean contains(String pattern) throws IOException {
        if (pattern == null || !Files.isRegularFile(target) || !Files.isReadable(target)) {
            return false;
        }
        Pattern compiled = Pattern.compile(pattern);
        try (var lines = Files.lines(target, StandardCharsets.UTF_8)) {
            return lines.anyMatch(line -> compiled.matcher(line).find());
        }
    }

    private PosixFileAttributes posix() throws IOException {
        return Files.readAttributes(target, PosixFileAttributes.class);
    }

    private String digest(String algorithm) throws IOException {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            return HexFormat.of().formatHex(digest.digest(Files.readAllBytes(target)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException(algorithm + " is not available", ex);
        }
    }
}
