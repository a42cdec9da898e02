package org.example.analysis.controller;

import org.example.analysis.service.analysis.AnalysisJobService;
import org.example.analysis.service.analysis.AnalysisJobService.JobState;
import org.example.analysis.service.llm.LlmProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
public class HealthController {

    private final LlmProvider analysisLlmProvider;
    private final AnalysisJobService analysisJobService;

    public HealthController(@Qualifier("analysisLlmProvider") LlmProvider analysisLlmProvider,
                            AnalysisJobService analysisJobService) {
        this.analysisLlmProvider = analysisLlmProvider;
        this.analysisJobService = analysisJobService;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/details")
    public HealthDetails healthDetails() {
        boolean providerAvailable = analysisLlmProvider.isAvailable();
        return new HealthDetails(
                providerAvailable ? "ok" : "degraded",
                LocalDateTime.now(),
                new ProviderHealth(analysisLlmProvider.getProviderName(), providerAvailable),
                new JobHealth(
                        analysisJobService.countJobs(JobState.QUEUED),
                        analysisJobService.countJobs(JobState.RUNNING) + analysisJobService.countJobs(JobState.CANCELLING)
                )
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            LocalDateTime asOf,
            ProviderHealth analysisProvider,
            JobHealth jobs
    ) {
    }

    public record ProviderHealth(String name, boolean available) {}

    public record JobHealth(long queued, long running) {}
}
