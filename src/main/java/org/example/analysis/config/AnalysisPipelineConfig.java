package org.example.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.analysis.service.analysis.checkpoint.ChapterAnalysisCheckpoint;
import org.example.analysis.service.analysis.checkpoint.CheckpointManager;
import org.example.analysis.service.analysis.checkpoint.FileCheckpointManager;
import org.example.analysis.service.analysis.task.InferenceRetrier;
import org.example.analysis.service.analysis.task.RetryPolicy;
import org.example.analysis.service.analysis.task.Sleeper;
import org.example.analysis.service.llm.LlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires checkpointing and retry from {@link AnalysisProperties}.
 */
@Configuration
public class AnalysisPipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipelineConfig.class);

    @Bean
    public Clock analysisClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CheckpointManager<ChapterAnalysisCheckpoint> chapterCheckpointManager(AnalysisProperties properties,
                                                                                 Clock analysisClock) {
        AnalysisProperties.Checkpoint checkpoint = properties.getCheckpoint();
        Path directory = Path.of(checkpoint.getDirectory());
        log.info("Chapter checkpoints in {} (expiry {})", directory.toAbsolutePath(), checkpoint.getExpiry());
        return new FileCheckpointManager<>(directory, ChapterAnalysisCheckpoint.class, new ObjectMapper(),
                checkpoint.getExpiry(), analysisClock);
    }

    @Bean
    public InferenceRetrier inferenceRetrier(@Qualifier("analysisLlmProvider") LlmProvider llmProvider,
                                             AnalysisProperties properties) {
        RetryPolicy policy = RetryPolicy.from(properties.getRetry());
        log.info("Inference retry: {} attempts, backoff {} x{} capped at {}",
                policy.maxAttempts(), policy.initialBackoff(), policy.multiplier(), policy.maxBackoff());
        return new InferenceRetrier(llmProvider, policy, Sleeper.threadSleep());
    }
}
