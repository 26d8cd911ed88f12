package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.exception.StorageException;
import com.example.mediacatalog_backend.service.Interfaces.ObjectStat;
import com.example.mediacatalog_backend.service.Interfaces.ObjectStore;
import com.example.mediacatalog_backend.service.Interfaces.UploadLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Object store on the local filesystem. Upload locators point at this service's own
 * {@code PUT /objects/{objectId}} endpoint.
 */
public class LocalObjectStore implements ObjectStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalObjectStore.class);
    private static final String DEFAULT_MIME = "application/octet-stream";

    private final Path baseDir;
    private final String publicBaseUrl;
    private final Duration uploadTtl;
    private final Clock clock;

    public LocalObjectStore(Path baseDir, String publicBaseUrl, Duration uploadTtl, Clock clock) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.replaceAll("/+$", "");
        this.uploadTtl = uploadTtl;
        this.clock = clock;
        try {
            Files.createDirectories(this.baseDir);
            LOGGER.info("LocalObjectStore ready. base={}", this.baseDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create object store directory", e);
        }
    }

    @Override
    public boolean exists(String objectId) {
        return Files.isRegularFile(safeResolve(objectId));
    }

    @Override
    public ObjectStat stat(String objectId) {
        Path p = safeResolve(objectId);
        if (!Files.isRegularFile(p)) {
            throw new StorageException("Object not stored: " + objectId);
        }
        try {
            long size = Files.size(p);
            String mime = Files.probeContentType(p);
            return new ObjectStat(size, mime == null ? DEFAULT_MIME : mime, sha256(p));
        } catch (IOException e) {
            throw new StorageException("Stat failed: " + objectId, e);
        }
    }

    @Override
    public UploadLocator issueUploadLocator(String objectId) {
        safeResolve(objectId);
        String url = publicBaseUrl + "/objects/" + URLEncoder.encode(objectId, StandardCharsets.UTF_8);
        return new UploadLocator(objectId, url, clock.instant().plus(uploadTtl));
    }

    @Override
    public void write(String objectId, InputStream data) {
        Path target = safeResolve(objectId);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".part");
            try {
                Files.copy(data, tmp, REPLACE_EXISTING);
                Files.move(tmp, target, REPLACE_EXISTING, ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new StorageException("Write failed: " + objectId, e);
        }
    }

    @Override
    public void delete(String objectId) {
        Path p = safeResolve(objectId);
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + p, e);
        }
    }

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(baseDir) && Files.isWritable(baseDir);
    }

    public Path root() {
        return baseDir;
    }

    private Path safeResolve(String objectId) {
        if (objectId == null || objectId.isBlank()) {
            throw new StorageException("objectId is blank");
        }
        String normalizedKey = objectId.replace('\\', '/').replaceAll("^/+", "");
        Path p = baseDir.resolve(normalizedKey).normalize();
        if (!p.startsWith(baseDir) || p.equals(baseDir)) {
            throw new StorageException("Invalid objectId (path traversal?): " + objectId);
        }
        return p;
    }

    private static String sha256(Path p) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
        try (InputStream in = new DigestInputStream(Files.newInputStream(p), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
