package com.telemetra.service.core.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemPayloadSpoolTest {

    @TempDir
    Path dir;

    @Test
    void storesOpensAndDeletesPayloads() throws Exception {
        FileSystemPayloadSpool spool = new FileSystemPayloadSpool(dir.resolve("spool"));
        UUID jobId = UUID.randomUUID();

        String ref = spool.store(jobId, new ByteArrayInputStream("hello".getBytes(StandardCharsets.UTF_8)));

        try (InputStream in = spool.open(ref)) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("hello");
        }
        spool.delete(ref);
        assertThat(Files.list(dir.resolve("spool"))).isEmpty();
    }

    @Test
    void referencesCannotEscapeTheSpoolDirectory() {
        FileSystemPayloadSpool spool = new FileSystemPayloadSpool(dir.resolve("spool"));

        assertThatThrownBy(() -> spool.open("../outside")).isInstanceOf(IllegalArgumentException.class);
    }
}
