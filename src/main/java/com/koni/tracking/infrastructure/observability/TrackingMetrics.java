package com.koni.tracking.infrastructure.observability;

import com.koni.tracking.domain.model.MonitorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Counters and timers of the ingestion and analytics pipelines.
 */
@Slf4j
@Component
public class TrackingMetrics {

    private final Counter reportsReceived;
    private final Counter samplesStaged;
    private final Counter panicStamps;
    private final Counter parseFailures;
    private final Counter dispatchFailures;
    private final Counter poolExhausted;
    private final Counter eventsDelivered;
    private final Map<MonitorType, Counter> eventsCreated = new EnumMap<>(MonitorType.class);
    private final Timer summarizationTime;

    public TrackingMetrics(MeterRegistry registry) {
        this.reportsReceived = Counter.builder("tracking.reports.received.total")
                .description("Total tracking reports received")
                .register(registry);

        this.samplesStaged = Counter.builder("tracking.samples.staged.total")
                .description("Total tracking samples staged for bulk load")
                .register(registry);

        this.panicStamps = Counter.builder("tracking.panic.stamped.total")
                .description("Total panic violations stamped by the ingestion fast path")
                .register(registry);

        this.parseFailures = Counter.builder("tracking.parse.failures.total")
                .description("Total inbound messages rejected as malformed")
                .register(registry);

        this.dispatchFailures = Counter.builder("tracking.dispatch.failures.total")
                .description("Total inbound messages whose processing failed on a worker")
                .register(registry);

        this.poolExhausted = Counter.builder("tracking.pool.exhausted.total")
                .description("Total connection acquisitions that gave up with every connection on loan")
                .register(registry);

        this.eventsDelivered = Counter.builder("tracking.violations.delivered.total")
                .description("Total violation events delivered through the feed")
                .register(registry);

        for (MonitorType type : MonitorType.values()) {
            eventsCreated.put(type, Counter.builder("tracking.violations.created.total")
                    .description("Total violation events created")
                    .tag("monitor_type", type.name().toLowerCase())
                    .register(registry));
        }

        this.summarizationTime = Timer.builder("tracking.summarization.time")
                .description("Time to run one location summarization cycle")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordReportReceived(int samples) {
        reportsReceived.increment();
        samplesStaged.increment(samples);
        log.debug("Tracking report counted: samples={}", samples);
    }

    public void recordPanicStamped() {
        panicStamps.increment();
    }

    public void recordParseFailure() {
        parseFailures.increment();
        log.debug("Parse failure counter incremented");
    }

    public void recordDispatchFailure() {
        dispatchFailures.increment();
        log.debug("Dispatch failure counter incremented");
    }

    public void recordPoolExhausted() {
        poolExhausted.increment();
        log.debug("Pool exhaustion counter incremented");
    }

    public void recordViolationsCreated(MonitorType monitorType, int count) {
        eventsCreated.get(monitorType).increment(count);
    }

    public void recordViolationsDelivered(int count) {
        eventsDelivered.increment(count);
    }

    /**
     * Record the duration of a summarization cycle.
     * 
     * @param cycle the cycle to time
     */
    public void recordSummarizationTime(Runnable cycle) {
        summarizationTime.record(cycle);
    }
}
