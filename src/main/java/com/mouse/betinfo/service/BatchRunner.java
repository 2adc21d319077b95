package com.mouse.betinfo.service;

import com.mouse.betinfo.config.LedgerProperties;
import com.mouse.betinfo.model.BatchReport;
import com.mouse.betinfo.model.UnitFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Fans a batch out as one task per game on the shared batch executor. Each unit
 * either succeeds, is skipped (nothing to do), or fails on its own; the caller gets
 * all three lists back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchRunner {

    private final ExecutorService ledgerBatchExecutor;
    private final LedgerProperties properties;

    public <T> BatchReport<T> run(String operation, List<String> units, Function<String, Optional<T>> work) {
        return runMany(operation, units, unit -> work.apply(unit).map(List::of).orElse(List.of()));
    }

    public <T> BatchReport<T> runMany(String operation, List<String> units, Function<String, ? extends Collection<T>> work) {
        log.info("▶️ BATCH START | op={} | units={}", operation, units.size());
        Map<String, Future<? extends Collection<T>>> futures = new LinkedHashMap<>();
        for (String unit : units) {
            futures.put(unit, ledgerBatchExecutor.submit(() -> work.apply(unit)));
        }

        List<T> successes = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<UnitFailure> failures = new ArrayList<>();
        long timeout = properties.getBatch().getTimeoutSeconds();

        for (Map.Entry<String, Future<? extends Collection<T>>> entry : futures.entrySet()) {
            String unit = entry.getKey();
            Future<? extends Collection<T>> future = entry.getValue();
            try {
                Collection<T> produced = future.get(timeout, TimeUnit.SECONDS);
                if (produced == null || produced.isEmpty()) {
                    skipped.add(unit);
                } else {
                    successes.addAll(produced);
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("UNIT FAIL | op={} | unit={} | error={}", operation, unit, cause.getMessage(), cause);
                failures.add(UnitFailure.of(unit, cause));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("UNIT TIMEOUT | op={} | unit={} | timeoutSeconds={}", operation, unit, timeout);
                failures.add(new UnitFailure(unit, "TimeoutException", "No result after " + timeout + "s"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                failures.add(new UnitFailure(unit, "InterruptedException", "Batch interrupted"));
            }
        }

        log.info("⏹️ BATCH DONE | op={} | ok={} | skipped={} | failed={}",
                operation, successes.size(), skipped.size(), failures.size());
        return new BatchReport<>(operation, successes, skipped, failures);
    }
}
