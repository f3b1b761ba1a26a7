package com.github.collomatique.ilp.solvers;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import com.github.collomatique.ilp.Config;
import com.github.collomatique.ilp.FeasableConfig;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one feasibility search per starting config on an executor. The first feasible config
 * cancels the remaining searches.
 */
@Slf4j
@RequiredArgsConstructor
public class ParallelSearch<V> {

    private final FeasabilitySolver<V> solver;
    private final ExecutorService executor;

    public SearchOutcome<V> restoreFeasability(List<Config<V>> starts, Set<FeasableConfig<V>> excluded, SearchLimits limits) {
        if (starts.isEmpty()) {
            throw new IllegalArgumentException("at least one starting config is required");
        }
        var token = limits.cancellation().child();
        var taskLimits = limits.withCancellation(token);
        var completion = new ExecutorCompletionService<SearchOutcome<V>>(executor);
        List<Future<SearchOutcome<V>>> futures = new ArrayList<>();
        for (var start : starts) {
            futures.add(completion.submit(() -> solver.restoreFeasability(start, excluded, taskLimits)));
        }

        long steps = 0;
        SearchOutcome.Reason limitReason = null;
        try {
            for (int i = 0; i < starts.size(); i++) {
                var outcome = completion.take().get();
                steps += outcome.steps();
                if (outcome instanceof SearchOutcome.Found<V> found) {
                    token.cancel();
                    log.debug("search {} of {} found a feasible config", i + 1, starts.size());
                    return new SearchOutcome.Found<>(found.feasable(), steps);
                }
                if (outcome instanceof SearchOutcome.TimeLimit<V> timeLimit && limitReason == null) {
                    limitReason = timeLimit.reason();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            return new SearchOutcome.TimeLimit<>(SearchOutcome.Reason.CANCELLED, steps);
        } catch (ExecutionException e) {
            token.cancel();
            throw new RuntimeException("feasibility search failed", e.getCause());
        } finally {
            futures.forEach(f -> f.cancel(false));
        }

        if (limitReason != null) {
            return new SearchOutcome.TimeLimit<>(limitReason, steps);
        }
        return new SearchOutcome.NotFound<>(steps);
    }
}
