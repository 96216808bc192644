package com.delta.leadgen.leads.api;

import com.delta.leadgen.config.LeadGeneratorProperties;
import com.delta.leadgen.leads.model.LeadBatch;
import com.delta.leadgen.leads.model.LeadExport;
import com.delta.leadgen.leads.model.LeadGenerationMetadata;
import com.delta.leadgen.leads.model.LeadGenerationResponse;
import com.delta.leadgen.leads.model.LeadJobAccepted;
import com.delta.leadgen.leads.model.LeadJobView;
import com.delta.leadgen.leads.model.LeadRequest;
import com.delta.leadgen.leads.service.GenerationOutcome;
import com.delta.leadgen.leads.service.LeadJobHandle;
import com.delta.leadgen.leads.service.LeadJobOrchestrator;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/v1/leads")
public class LeadController {
    private final LeadJobOrchestrator orchestrator;
    private final LeadGeneratorProperties properties;

    public LeadController(LeadJobOrchestrator orchestrator, LeadGeneratorProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @PostMapping("/generate")
    public LeadGenerationResponse generate(@RequestBody LeadApiRequest request) {
        GenerationOutcome outcome = orchestrator.runSync(toLeadRequest(request));
        LeadBatch batch = outcome.batch();
        boolean scraping = request.enableWebScraping() != null && request.enableWebScraping();
        LeadGenerationMetadata metadata = new LeadGenerationMetadata(
            request.industry() == null ? null : request.industry().strip(),
            request.country() == null ? null : request.country().strip(),
            request.number(),
            batch.size(),
            scraping,
            outcome.enhancementError(),
            Instant.now()
        );
        return new LeadGenerationResponse(
            true,
            "Successfully generated " + batch.size() + " leads",
            batch,
            metadata
        );
    }

    @PostMapping("/generate-async")
    public ResponseEntity<LeadJobAccepted> generateAsync(@RequestBody LeadApiRequest request) {
        LeadJobHandle handle = orchestrator.submit(toLeadRequest(request));
        return ResponseEntity.accepted().body(new LeadJobAccepted(
            true,
            "Lead generation job queued",
            handle.jobId(),
            "/api/v1/leads/status/" + handle.jobId()
        ));
    }

    @GetMapping("/status/{jobId}")
    public LeadJobView getStatus(@PathVariable("jobId") String jobId) {
        return orchestrator.getStatus(jobId);
    }

    @GetMapping("/jobs")
    public List<LeadJobView> listJobs(@RequestParam(name = "limit", required = false) Integer limit) {
        int defaultLimit = properties.getJobs().getListLimit();
        int safeLimit = limit == null ? defaultLimit : Math.max(1, Math.min(limit, 500));
        return orchestrator.listJobs(safeLimit);
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public Map<String, Object> cancel(@PathVariable("jobId") String jobId) {
        boolean requested = orchestrator.cancel(jobId);
        return Map.of(
            "job_id", jobId,
            "cancel_requested", requested
        );
    }

    @GetMapping("/export/{jobId}")
    public ResponseEntity<?> export(
        @PathVariable("jobId") String jobId,
        @RequestParam(name = "format", required = false, defaultValue = "json") String format
    ) {
        String normalized = format.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("json")) {
            LeadExport export = orchestrator.export(jobId);
            return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(export);
        }
        if (normalized.equals("csv")) {
            String csv = orchestrator.exportCsv(jobId);
            return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv"))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"leads_" + jobId + ".csv\"")
                .body(csv);
        }
        throw new ResponseStatusException(BAD_REQUEST, "Unsupported export format: " + format);
    }

    private LeadRequest toLeadRequest(LeadApiRequest request) {
        if (request == null) {
            return null;
        }
        return new LeadRequest(
            request.industry(),
            request.number() == null ? 0 : request.number(),
            request.country(),
            request.enableWebScraping() != null && request.enableWebScraping()
        );
    }
}
