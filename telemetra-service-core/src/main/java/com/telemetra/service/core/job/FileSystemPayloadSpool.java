package com.telemetra.service.core.job;

import com.telemetra.service.core.config.TelemetraProperties;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Spools uploads as files under {@code telemetra.jobs.spool-dir}; the reference is the file name. */
@Component
@Slf4j
public class FileSystemPayloadSpool implements PayloadSpool {

    private final Path root;

    @Autowired
    public FileSystemPayloadSpool(TelemetraProperties properties) {
        this(Paths.get(properties.getJobs().getSpoolDir()));
    }

    FileSystemPayloadSpool(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot create spool directory " + this.root, ex);
        }
        log.info("Payload spool directory {}", this.root);
    }

    @Override
    public String store(UUID jobId, InputStream payload) throws IOException {
        String ref = jobId + ".upload";
        Path target = resolve(ref);
        Path tmp = root.resolve(ref + ".part");
        try (InputStream in = payload) {
            Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            Files.deleteIfExists(tmp);
            throw ex;
        }
        log.debug("Spooled payload for job {} size={} bytes", jobId, Files.size(target));
        return ref;
    }

    @Override
    public InputStream open(String ref) throws IOException {
        return Files.newInputStream(resolve(ref));
    }

    @Override
    public void delete(String ref) {
        if (ref == null) {
            return;
        }
        try {
            Files.deleteIfExists(resolve(ref));
        } catch (IOException | IllegalArgumentException ex) {
            log.warn("Failed to delete spooled payload {}", ref, ex);
        }
    }

    private Path resolve(String ref) {
        Path path = root.resolve(ref).normalize();
        if (!path.getParent().equals(root)) {
            throw new IllegalArgumentException("Invalid payload reference: " + ref);
        }
        return path;
    }
}
