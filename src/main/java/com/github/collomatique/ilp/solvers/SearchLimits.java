package com.github.collomatique.ilp.solvers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Bounds of a search: a step budget, a deadline, a cancellation token and an optional budget
 * shared between concurrent searches. Checked once per exploration step.
 */
@ToString
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SearchLimits {

    private final long maxSteps;
    private final Optional<Instant> deadline;
    private final CancellationToken cancellation;
    @ToString.Exclude
    private final AtomicLong sharedBudget;
    @ToString.Exclude
    private final Clock clock;

    public static SearchLimits unlimited() {
        return new SearchLimits(Long.MAX_VALUE, Optional.empty(), new CancellationToken(), null, Clock.systemUTC());
    }

    public SearchLimits withMaxSteps(long maxSteps) {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be non-negative, got " + maxSteps);
        }
        return new SearchLimits(maxSteps, deadline, cancellation, sharedBudget, clock);
    }

    public SearchLimits withTimeLimit(Duration timeLimit) {
        return withDeadline(clock.instant().plus(timeLimit));
    }

    public SearchLimits withDeadline(Instant deadline) {
        return new SearchLimits(maxSteps, Optional.of(deadline), cancellation, sharedBudget, clock);
    }

    public SearchLimits withCancellation(CancellationToken cancellation) {
        return new SearchLimits(maxSteps, deadline, cancellation, sharedBudget, clock);
    }

    public SearchLimits withSharedBudget(AtomicLong sharedBudget) {
        return new SearchLimits(maxSteps, deadline, cancellation, sharedBudget, clock);
    }

    public SearchLimits withClock(Clock clock) {
        return new SearchLimits(maxSteps, deadline, cancellation, sharedBudget, clock);
    }

    /**
     * Accounts for one more exploration step after {@code stepsSoFar} steps, returning the
     * reason to stop if any limit is hit.
     */
    public Optional<SearchOutcome.Reason> consumeStep(long stepsSoFar) {
        if (cancellation.isCancelled()) {
            return Optional.of(SearchOutcome.Reason.CANCELLED);
        }
        if (deadline.isPresent() && !clock.instant().isBefore(deadline.get())) {
            return Optional.of(SearchOutcome.Reason.DEADLINE);
        }
        if (stepsSoFar >= maxSteps) {
            return Optional.of(SearchOutcome.Reason.STEP_BUDGET);
        }
        if (sharedBudget != null && sharedBudget.getAndDecrement() <= 0) {
            return Optional.of(SearchOutcome.Reason.STEP_BUDGET);
        }
        return Optional.empty();
    }
}
