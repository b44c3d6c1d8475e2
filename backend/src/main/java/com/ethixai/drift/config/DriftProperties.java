package com.ethixai.drift.config;

import com.ethixai.drift.model.Severity;
import com.ethixai.drift.model.WindowMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "drift")
@Data
@Validated
public class DriftProperties {

    @Valid
    private Histogram histogram = new Histogram();
    @Valid
    private Thresholds thresholds = new Thresholds();
    @Valid
    private Windows windows = new Windows();
    @Valid
    private Worker worker = new Worker();
    @Valid
    private Alerts alerts = new Alerts();
    @Valid
    private Aggregation aggregation = new Aggregation();
    @Valid
    private Fairness fairness = new Fairness();
    @Valid
    private Retention retention = new Retention();
    @Valid
    private Notifications notifications = new Notifications();
    @Valid
    private Scheduler scheduler = new Scheduler();

    public Window window(WindowMode mode) {
        return mode == WindowMode.BATCH ? windows.getBatch() : windows.getStreaming();
    }

    @Data
    public static class Histogram {
        @Min(2)
        private int binCount = 20;

        @Positive
        private double epsilon = 1e-6;
    }

    @Data
    public static class Thresholds {
        @Positive
        private double psiWarning = 0.1;
        @Positive
        private double psiCritical = 0.25;

        @Positive
        private double klWarning = 0.1;
        @Positive
        private double klCritical = 0.3;

        @Positive
        private double fairnessWarning = 0.05;
        @Positive
        private double fairnessCritical = 0.1;

        @Positive
        private double nullRateWarning = 0.05;
        @Positive
        private double nullRateCritical = 0.15;

        @Positive
        private double newCategoryWarningRate = 0.02;

        // cosine similarity: lower is worse
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double explanationWarning = 0.9;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double explanationCritical = 0.7;
    }

    @Data
    public static class Windows {
        @Valid
        private Window streaming = new Window(Duration.ofMinutes(5), 1000);
        @Valid
        private Window batch = new Window(Duration.ofHours(24), 10_000);
    }

    @Data
    public static class Window {
        @NotNull
        private Duration length;

        @Min(1)
        private int maxSamples;

        public Window() {
        }

        public Window(Duration length, int maxSamples) {
            this.length = length;
            this.maxSamples = maxSamples;
        }
    }

    @Data
    public static class Worker {
        @Min(1)
        private int minSamples = 30;

        @NotNull
        private Duration cycleTimeout = Duration.ofSeconds(60);

        @Min(1)
        private int retryAttempts = 3;

        @NotNull
        private Duration retryBaseDelay = Duration.ofMillis(500);
    }

    @Data
    public static class Alerts {
        @NotNull
        private Duration dedupWindow = Duration.ofHours(24);

        @Min(1)
        private int retrainCriticalAlerts = 2;

        @NotNull
        private Duration retrainLookback = Duration.ofHours(24);
    }

    @Data
    public static class Aggregation {
        @NotNull
        private AggregationStrategy strategy = AggregationStrategy.WORST_CASE;

        // QUORUM only: critical signals needed before the window is critical
        @Min(1)
        private int quorum = 2;
    }

    public enum AggregationStrategy {
        WORST_CASE,
        QUORUM
    }

    @Data
    public static class Fairness {
        private double positiveThreshold = 0.5;
    }

    @Data
    public static class Retention {
        @NotNull
        private Duration snapshots = Duration.ofDays(30);
        @NotNull
        private Duration alerts = Duration.ofDays(90);
        @NotNull
        private Duration dailySummaries = Duration.ofDays(365);
    }

    @Data
    public static class Notifications {
        private boolean enabled = true;

        @NotNull
        private Severity minSeverity = Severity.WARNING;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;
        private String streamingCron = "0 */5 * * * *";
        private String batchCron = "0 30 1 * * *";
        private String cleanupCron = "0 0 3 * * *";
        // empty means every model that has a baseline
        private List<String> models = new ArrayList<>();
    }
}
