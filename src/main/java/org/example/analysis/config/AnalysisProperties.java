package org.example.analysis.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables for the analysis pipeline: checkpoint storage, inference retry,
 * chapter sampling for book-level insights and the job pool.
 */
@Component
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    private Checkpoint checkpoint = new Checkpoint();
    private Retry retry = new Retry();
    private Sampling sampling = new Sampling();
    private Jobs jobs = new Jobs();

    public Checkpoint getCheckpoint() { return checkpoint; }
    public void setCheckpoint(Checkpoint checkpoint) { this.checkpoint = checkpoint; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Sampling getSampling() { return sampling; }
    public void setSampling(Sampling sampling) { this.sampling = sampling; }

    public Jobs getJobs() { return jobs; }
    public void setJobs(Jobs jobs) { this.jobs = jobs; }

    public static class Checkpoint {
        private String directory = "./data/batched_analysis_checkpoints";
        private Duration expiry = Duration.ofHours(24);

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public Duration getExpiry() { return expiry; }
        public void setExpiry(Duration expiry) { this.expiry = expiry; }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }

    public static class Sampling {
        private int chapterSampleChars = 1500;
        private int themeSampleChars = 3000;

        public int getChapterSampleChars() { return chapterSampleChars; }
        public void setChapterSampleChars(int chapterSampleChars) { this.chapterSampleChars = chapterSampleChars; }

        public int getThemeSampleChars() { return themeSampleChars; }
        public void setThemeSampleChars(int themeSampleChars) { this.themeSampleChars = themeSampleChars; }
    }

    public static class Jobs {
        private int maxConcurrent = 2;
        private Duration retention = Duration.ofHours(6);

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
    }
}
