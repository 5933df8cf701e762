package com.segments.domain.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Latency and outcome metrics per report type.
 *
 * - report.latency (timer): tagged by type
 * - report.executed (counter): tagged by type and result (success | error kind)
 */
@Component
@RequiredArgsConstructor
public class ReportMetrics {

    private final MeterRegistry meterRegistry;

    public <T> T timed(String type, Supplier<T> report) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            T result = report.get();
            executed(type, "success");
            return result;
        } catch (RuntimeException e) {
            executed(type, e.getClass().getSimpleName());
            throw e;
        } finally {
            sample.stop(Timer.builder("report.latency")
                    .tag("type", type)
                    .register(meterRegistry));
        }
    }

    private void executed(String type, String result) {
        Counter.builder("report.executed")
                .tag("type", type)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
