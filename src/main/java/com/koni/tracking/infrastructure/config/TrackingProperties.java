package com.koni.tracking.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Settings of the tracking server, bound from the {@code tracking} prefix.
 */
@ConfigurationProperties(prefix = "tracking")
@Data
@Validated
public class TrackingProperties {

    @Valid
    private final Database database = new Database();
    @Valid
    private final Ingestion ingestion = new Ingestion();
    @Valid
    private final Summarization summarization = new Summarization();
    @Valid
    private final Violation violation = new Violation();
    @Valid
    private final Movement movement = new Movement();
    @Valid
    private final Schedule schedule = new Schedule();
    @Valid
    private final Maintenance maintenance = new Maintenance();
    @Valid
    private final Export export = new Export();

    @Data
    public static class Database {
        @NotBlank
        private String url = "jdbc:postgresql://localhost:5432/bedis";
        @NotBlank
        private String username = "postgres";
        private String password = "";
        @NotBlank
        private String applicationName = "beacon-tracking-server";
        @Positive
        private int poolSize = 8;
        @Positive
        private int acquisitionAttempts = 5;
        @NotNull
        private Duration acquisitionWait = Duration.ofMillis(100);
    }

    @Data
    public static class Ingestion {
        @Positive
        private int workers = 8;
        @Positive
        private int bufferSlots = 16;
        @Positive
        private int bufferCapacity = 4096;
        @NotNull
        private Path stagingDirectory = Path.of(System.getProperty("java.io.tmpdir"), "beacon-tracking", "staging");
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        /**
         * When off, panic samples are stored like any other and no panic violation is stamped.
         */
        private boolean panicMonitoringEnabled = true;
    }

    @Data
    public static class Summarization {
        /**
         * Delay between two analytics cycles: summarization, violation rules and event collection.
         */
        @NotNull
        private Duration interval = Duration.ofSeconds(5);
        @NotNull
        private Duration preFilterWindow = Duration.ofSeconds(30);
        @NotNull
        private Duration currentWindow = Duration.ofSeconds(10);
        @Positive
        private int rssiTolerance = 5;
        @Positive
        private int anchorTolerance = 500;
    }

    @Data
    public static class Violation {
        @NotNull
        private Duration recencyWindow = Duration.ofSeconds(30);
        @NotNull
        private Duration minimumGap = Duration.ofSeconds(60);
        @Positive
        private int defaultFeedCapacity = 4096;
    }

    @Data
    public static class Movement {
        @NotNull
        private Duration timeWindow = Duration.ofMinutes(10);
        @NotNull
        private Duration slot = Duration.ofMinutes(1);
        @Positive
        private int rssiDelta = 5;
    }

    @Data
    public static class Schedule {
        @NotNull
        private Duration interval = Duration.ofSeconds(60);
        @Min(-12)
        @Max(14)
        private int utcOffsetHours = 0;
    }

    @Data
    public static class Maintenance {
        @NotNull
        private Duration interval = Duration.ofHours(1);
        @NotNull
        private Duration retention = Duration.ofHours(24);
        @NotEmpty
        private List<String> vacuumTables = List.of(
                "tracking_table", "lbeacon_table", "gateway_table", "object_table", "notification_table");
    }

    @Data
    public static class Export {
        @NotNull
        private Duration interval = Duration.ofSeconds(30);
        @NotNull
        private Path geofenceSettingsFile = Path.of("geofence", "geo_fence_settings.txt");
        @NotNull
        private Path geofenceObjectsFile = Path.of("geofence", "geo_fence_objects.txt");
    }
}
