package com.tracematrix.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for matrix generation, validation and export.
 */
@Service
public class TraceabilityMetrics {

    private final MeterRegistry registry;

    public TraceabilityMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one scanner pass.
     *
     * @param artifact  artifact kind, e.g. "requirements" or "branches"
     * @param ms        scan duration
     * @param artifacts number of records the scanner returned
     */
    public void recordScan(String artifact, long ms, int artifacts) {
        Timer.builder("tracematrix.scan.duration")
                .tag("artifact", artifact)
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("tracematrix.scan.artifacts")
                .tag("artifact", artifact)
                .register(registry)
                .record(artifacts);
    }

    public void recordGeneration(long ms) {
        Timer.builder("tracematrix.generate.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRequirementCoverage(int percentage) {
        DistributionSummary.builder("tracematrix.requirements.coverage")
                .description("Share of requirements with at least one test")
                .baseUnit("percent")
                .register(registry)
                .record(percentage);
    }

    public void recordValidation(boolean passed) {
        Counter.builder("tracematrix.validations")
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordExport(String format) {
        Counter.builder("tracematrix.exports")
                .tag("format", format)
                .register(registry)
                .increment();
    }

    public void recordSignatureCheck(boolean valid) {
        Counter.builder("tracematrix.signature.checks")
                .tag("result", valid ? "valid" : "invalid")
                .register(registry)
                .increment();
    }
}
