package com.delta.prospector.company.api;

import com.delta.prospector.company.model.ExportArtifact;
import com.delta.prospector.company.model.ExportOutcome;
import com.delta.prospector.company.model.ExportRunResponse;
import com.delta.prospector.company.model.ExportStatus;
import com.delta.prospector.company.model.ExportStatusResponse;
import com.delta.prospector.company.service.ExportOrchestratorService;
import com.delta.prospector.company.service.ExportStateService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/export")
public class ExportController {
    static final String HEADER_RUN_ID = "X-Export-Run-Id";
    static final String HEADER_STATUS = "X-Export-Status";
    static final String HEADER_LAST_PAGE = "X-Export-Last-Successful-Page";
    static final String HEADER_FAILURE = "X-Export-Failure-Reason";

    private final ExportOrchestratorService orchestratorService;
    private final ExportStateService stateService;

    public ExportController(ExportOrchestratorService orchestratorService, ExportStateService stateService) {
        this.orchestratorService = orchestratorService;
        this.stateService = stateService;
    }

    @PostMapping("/start")
    public ResponseEntity<?> start(@RequestBody(required = false) ExportApiRequest request) {
        int startPage = request == null || request.startPage() == null ? 1 : request.startPage();
        if (startPage < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "start_page must be >= 1");
        }
        return toResponse(orchestratorService.runExport(startPage));
    }

    @PostMapping("/resume")
    public ResponseEntity<?> resume() {
        return toResponse(orchestratorService.resume());
    }

    @PostMapping("/start-async")
    public ExportRunResponse startAsync(@RequestBody(required = false) ExportApiRequest request) {
        boolean resume = request != null && Boolean.TRUE.equals(request.resume());
        Integer startPage = request == null ? null : request.startPage();
        if (startPage != null && startPage < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "start_page must be >= 1");
        }
        return orchestratorService.startAsync(startPage, resume);
    }

    @PostMapping("/stop")
    public ExportStatusResponse stop() {
        return orchestratorService.requestStop();
    }

    @GetMapping("/status")
    public ExportStatusResponse status() {
        return stateService.snapshot();
    }

    @GetMapping("/runs/{id}")
    public ExportStatusResponse runStatus(@PathVariable("id") long runId) {
        ExportStatusResponse snapshot = stateService.snapshot(runId);
        if (snapshot == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Export run not found: " + runId);
        }
        return snapshot;
    }

    @GetMapping("/runs/{id}/artifact")
    public ResponseEntity<byte[]> artifact(@PathVariable("id") long runId) {
        ExportArtifact artifact = stateService.findArtifact(runId);
        if (artifact == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No export file for run " + runId);
        }
        return fileResponse(artifact, HttpHeaders.EMPTY);
    }

    private ResponseEntity<?> toResponse(ExportOutcome outcome) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HEADER_RUN_ID, Long.toString(outcome.runId()));
        headers.add(HEADER_STATUS, outcome.status().name());
        headers.add(HEADER_LAST_PAGE, Integer.toString(outcome.lastSuccessfulPage()));
        if (outcome.failureReason() != null) {
            headers.add(HEADER_FAILURE, headerSafe(outcome.failureReason()));
        }

        if (outcome.hasArtifact()) {
            return fileResponse(outcome.artifact(), headers);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("run_id", outcome.runId());
        body.put("status", outcome.status().name());
        if (outcome.status() == ExportStatus.COMPLETED) {
            body.put("error", "No companies found matching the criteria");
            body.put("reason", "no_companies");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).headers(headers).body(body);
        }
        body.put("error", outcome.failureReason() == null ? "Export failed" : outcome.failureReason());
        body.put("reason", "export_failed");
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).headers(headers).body(body);
    }

    private ResponseEntity<byte[]> fileResponse(ExportArtifact artifact, HttpHeaders extraHeaders) {
        HttpHeaders headers = new HttpHeaders();
        headers.putAll(extraHeaders);
        headers.setContentDisposition(ContentDisposition.attachment().filename(artifact.fileName()).build());
        byte[] content = artifact.content();
        return ResponseEntity.ok()
            .headers(headers)
            .contentType(MediaType.parseMediaType(artifact.contentType()))
            .contentLength(content.length)
            .body(content);
    }

    private String headerSafe(String value) {
        String flattened = value.replaceAll("[\\r\\n\\t]+", " ").replaceAll("[^\\x20-\\x7E]", "?");
        return flattened.length() > 200 ? flattened.substring(0, 200) : flattened;
    }
}
