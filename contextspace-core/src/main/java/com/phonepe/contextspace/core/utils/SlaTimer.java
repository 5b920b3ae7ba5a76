package com.phonepe.contextspace.core.utils;

import com.google.common.base.Stopwatch;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Times store calls against their latency budget. Overruns are only logged, never enforced.
 */
@Slf4j
@UtilityClass
public class SlaTimer {

    public static <T> T timed(String operation, Duration budget, Supplier<T> call) {
        final var stopwatch = Stopwatch.createStarted();
        try {
            return call.get();
        }
        finally {
            report(operation, budget, stopwatch);
        }
    }

    public static void timed(String operation, Duration budget, Runnable call) {
        timed(operation, budget, () -> {
            call.run();
            return null;
        });
    }

    public static void report(String operation, Duration budget, Stopwatch stopwatch) {
        final var elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
        if (budget != null && elapsed > budget.toMillis()) {
            log.warn("{} took {} ms, exceeding SLA of {} ms", operation, elapsed, budget.toMillis());
        }
        else {
            log.debug("{} took {} ms", operation, elapsed);
        }
    }
}
