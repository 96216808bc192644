package com.delta.leadgen.leads.service;

import com.delta.leadgen.config.LeadGeneratorProperties;
import com.delta.leadgen.leads.generation.LeadGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class LeadGeneratorStartupCheck implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(LeadGeneratorStartupCheck.class);

    private final LeadGenerator leadGenerator;
    private final LeadGeneratorProperties properties;

    public LeadGeneratorStartupCheck(LeadGenerator leadGenerator, LeadGeneratorProperties properties) {
        this.leadGenerator = leadGenerator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!leadGenerator.isConfigured()) {
            log.warn("No generation API key configured; lead generation requests will be rejected until GEMINI_API_KEY is set");
            return;
        }
        log.info(
            "Lead generation ready: model={} maxAttempts={} initialDelayMs={} maxDelayMs={} workers={}",
            properties.getGemini().getModel(),
            properties.getRetry().getMaxAttempts(),
            properties.getRetry().getInitialDelayMs(),
            properties.getRetry().getMaxDelayMs(),
            properties.getJobs().getWorkerThreads()
        );
    }
}
