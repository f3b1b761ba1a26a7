package com.github.collomatique.colloscope;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Executors;

import com.github.collomatique.ConfigReader;
import com.github.collomatique.ilp.Config;
import com.github.collomatique.ilp.FeasableConfig;
import com.github.collomatique.ilp.repr.ReprKind;
import com.github.collomatique.ilp.solvers.BfsSolver;
import com.github.collomatique.ilp.solvers.ConfigInitializer;
import com.github.collomatique.ilp.solvers.NullInitializer;
import com.github.collomatique.ilp.solvers.ParallelSearch;
import com.github.collomatique.ilp.solvers.RandomInitializer;
import com.github.collomatique.ilp.solvers.SearchLimits;
import com.github.collomatique.ilp.solvers.SearchOutcome;
import com.github.collomatique.ilp.solvers.SimulatedAnnealing;
import com.github.collomatique.problem.ColloProblem;
import com.github.collomatique.problem.FnCall;
import com.github.collomatique.problem.ObjectiveSense;
import com.github.collomatique.problem.ProblemBuilder;
import com.github.collomatique.problem.ProblemVar;
import com.github.collomatique.problem.Script;
import com.github.collomatique.problem.ScriptStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds a colloscope from the bundled scripts: group composition first, whose
 * {@code group_used} is then exposed as {@code $GroupUsed} to the schedule script.
 * <p>
 * Compiled scripts are kept between calls.
 */
@Slf4j
public class ColloscopeSolver implements ConfigReader.ConfigTarget {

    private final ScriptStore store = new ScriptStore(ColloscopeSchema.SCHEMA);
    private ReprKind reprKind = ReprKind.DENSE;
    private String initializer = "null";
    private double randomProbability = 0.5;
    private long maxSteps = Long.MAX_VALUE;
    private Optional<Duration> timeLimit = Optional.empty();
    private int threads = 1;
    private int annealingIterations = 0;
    private long seed = 0;

    @Override
    public void setReprKind(ReprKind reprKind) {
        this.reprKind = reprKind;
    }

    @Override
    public void setInitializer(String initializer, double randomProbability) {
        if (!initializer.equals("null") && !initializer.equals("random")) {
            throw new IllegalArgumentException("unknown initializer " + initializer);
        }
        this.initializer = initializer;
        this.randomProbability = randomProbability;
    }

    @Override
    public void setSearchLimits(long maxSteps, Optional<Duration> timeLimit) {
        this.maxSteps = maxSteps;
        this.timeLimit = timeLimit;
    }

    @Override
    public void setThreads(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("at least one thread is required, got " + threads);
        }
        this.threads = threads;
    }

    @Override
    public void setAnnealingIterations(int annealingIterations) {
        this.annealingIterations = annealingIterations;
    }

    @Override
    public void setSeed(long seed) {
        this.seed = seed;
    }

    public ScriptStore store() {
        return store;
    }

    /** A bundled script from {@code /scripts/<name>.colloml}. */
    public static Script loadScript(String name) {
        var resource = "/scripts/" + name + ".colloml";
        try (var in = ColloscopeSolver.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("no bundled script " + resource);
            }
            return new Script(name, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public ColloProblem<ColloscopeVar> buildProblem(ColloscopeData data) {
        var groups = loadScript("groups");
        var slots = loadScript("slots");
        var builder = new ProblemBuilder<>(data, store, new ColloscopeVars());
        builder.addConstraints(groups, List.of(FnCall.of("group_constraints")));
        builder.addObjective(groups, FnCall.of("used_groups"), 1, ObjectiveSense.MINIMIZE);
        builder.addReifiedVariables(groups, Map.of("group_used", "GroupUsed"));
        builder.addConstraints(slots, List.of(FnCall.of("schedule_constraints")));
        return builder.build(reprKind);
    }

    public Optional<Colloscope> solve(ColloscopeData data) {
        var problem = buildProblem(data);
        var random = new Random(seed);
        var limits = SearchLimits.unlimited().withMaxSteps(maxSteps);
        if (timeLimit.isPresent()) {
            limits = limits.withTimeLimit(timeLimit.get());
        }

        var found = search(problem, random, limits);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        var best = found.get();
        if (annealingIterations > 0) {
            var annealed = new SimulatedAnnealing<>(problem.problem(), new BfsSolver<>())
                    .initConfig(best.inner())
                    .stepLimits(limits)
                    .bestIn(annealingIterations, random);
            if (annealed.isPresent() && annealed.get().config().objectiveValue() < best.objectiveValue()) {
                best = annealed.get().config();
            }
        }
        log.info("found a colloscope with objective {}", best.objectiveValue());
        return Optional.of(new ColloscopeTranslator(data).translate(problem.solution(best)));
    }

    private Optional<FeasableConfig<ProblemVar<ColloscopeVar>>> search(ColloProblem<ColloscopeVar> problem,
            Random random, SearchLimits limits) {
        ConfigInitializer<ProblemVar<ColloscopeVar>> init = initializer.equals("random")
                ? new RandomInitializer<>(randomProbability, random)
                : new NullInitializer<>();
        var solver = new BfsSolver<ProblemVar<ColloscopeVar>>();
        SearchOutcome<ProblemVar<ColloscopeVar>> outcome;
        if (threads == 1) {
            outcome = solver.restoreFeasability(init.buildInitConfig(problem.problem()), Set.of(), limits);
        } else {
            List<Config<ProblemVar<ColloscopeVar>>> starts = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                starts.add(init.buildInitConfig(problem.problem()));
            }
            var executor = Executors.newFixedThreadPool(threads);
            try {
                outcome = new ParallelSearch<>(solver, executor).restoreFeasability(starts, Set.of(), limits);
            } finally {
                executor.shutdownNow();
            }
        }
        if (outcome.config().isEmpty()) {
            log.info("no colloscope found after {} steps: {}", outcome.steps(), outcome);
        }
        return outcome.config();
    }
}
