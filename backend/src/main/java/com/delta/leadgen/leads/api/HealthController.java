package com.delta.leadgen.leads.api;

import com.delta.leadgen.leads.generation.LeadGenerator;
import com.delta.leadgen.leads.model.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {
    static final String VERSION = "1.0.0";

    private final LeadGenerator leadGenerator;

    public HealthController(LeadGenerator leadGenerator) {
        this.leadGenerator = leadGenerator;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("message", "Lead Generator API");
        body.put("version", VERSION);
        body.put("health", "/health");
        return body;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", Instant.now(), VERSION, leadGenerator.isConfigured());
    }
}
