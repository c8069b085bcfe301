package com.example.roledocs.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Метрики разбора defaults-файлов и генерации документации.
 */
@Component
public class ParserMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer parseDuration;
    private final Counter documentsTotal;
    private final Counter failedTotal;
    private final AtomicInteger lastVariablesCount;

    public ParserMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.parseDuration = Timer.builder("roledocs.parse.duration")
            .description("Duration of role defaults parsing")
            .register(meterRegistry);

        this.documentsTotal = Counter.builder("roledocs.documents.parsed.total")
            .description("Total number of parsed defaults documents")
            .register(meterRegistry);

        this.failedTotal = Counter.builder("roledocs.documents.failed.total")
            .description("Total number of failed documentation runs")
            .register(meterRegistry);

        this.lastVariablesCount = new AtomicInteger(0);
        Gauge.builder("roledocs.variables.count", lastVariablesCount, AtomicInteger::get)
            .description("Number of variables found in last parsed document")
            .register(meterRegistry);
    }

    /**
     * Создаёт Timer.Sample для измерения времени разбора.
     */
    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordParseDuration(Timer.Sample sample) {
        sample.stop(parseDuration);
    }

    /**
     * Отмечает разобранный документ и число найденных переменных.
     */
    public void recordParsed(int variablesCount) {
        documentsTotal.increment();
        lastVariablesCount.set(variablesCount);
    }

    public void recordFailed() {
        failedTotal.increment();
    }
}
