package com.telemetra.controller.rest;

import com.telemetra.controller.rest.tenant.TenantResolver;
import com.telemetra.service.core.ingest.IngestionOutcome;
import com.telemetra.service.core.ingest.IngestionResult;
import com.telemetra.service.core.ingest.IngestionService;
import com.telemetra.service.core.job.IngestionJob;
import com.telemetra.service.core.job.IngestionJobService;
import com.telemetra.service.core.normalize.PayloadFormat;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.InputStreamSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/ingest")
public class IngestController {
    private final IngestionService ingestion;
    private final IngestionJobService jobs;
    private final TenantResolver tenants;

    public IngestController(IngestionService ingestion, IngestionJobService jobs, TenantResolver tenants) {
        this.ingestion = ingestion;
        this.jobs = jobs;
        this.tenants = tenants;
    }

    /** Raw JSON or CSV body. Small payloads answer 201 with counts, large ones 202 with a job. */
    @PostMapping(consumes = {MediaType.APPLICATION_JSON_VALUE, "text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<Object> ingestBody(
            @RequestBody byte[] body,
            @RequestHeader(value = "Content-Type", required = false) String contentType,
            @RequestParam(value = "file_name", required = false) String fileName,
            HttpServletRequest request)
            throws IOException {
        UUID tenant = tenants.resolve(request);
        return respond(ingestion.ingest(tenant, fileName, contentType, body.length, new ByteArrayResource(body)));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Object> ingestFile(@RequestPart("file") MultipartFile file, HttpServletRequest request)
            throws IOException {
        UUID tenant = tenants.resolve(request);
        requireContent(file);
        return respond(ingestion.ingest(
                tenant, file.getOriginalFilename(), file.getContentType(), file.getSize(), file));
    }

    /** Always queues; {@code format} overrides detection. */
    @PostMapping(value = "/jobs", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public IngestionJob submitJob(
            @RequestPart("file") MultipartFile file,
            @RequestParam(value = "format", required = false) String format,
            HttpServletRequest request)
            throws IOException {
        UUID tenant = tenants.resolve(request);
        requireContent(file);
        PayloadFormat payloadFormat = format == null || format.isBlank()
                ? ingestion.detectFormat(file.getOriginalFilename(), file.getContentType(), file)
                : PayloadFormat.fromWire(format.trim());
        try (InputStream in = file.getInputStream()) {
            return jobs.submit(tenant, file.getOriginalFilename(), payloadFormat, in);
        }
    }

    private static void requireContent(InputStreamSource file) {
        if (file instanceof MultipartFile multipart && multipart.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }
    }

    private static ResponseEntity<Object> respond(IngestionOutcome outcome) {
        if (outcome instanceof IngestionOutcome.Queued queued) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(queued.job());
        }
        IngestionResult result = ((IngestionOutcome.Completed) outcome).result();
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }
}
