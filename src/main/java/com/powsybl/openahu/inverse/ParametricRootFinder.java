/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.inverse;

import com.google.common.base.Stopwatch;
import com.powsybl.openahu.AhuException;
import com.powsybl.openahu.InvalidParameterException;
import com.powsybl.openahu.ahu.AhuSolver;
import com.powsybl.openahu.ahu.AhuSolverResult;
import com.powsybl.openahu.network.AhuInputs;
import com.powsybl.openahu.network.AhuParameters;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.powsybl.openahu.util.Markers.PERFORMANCE_MARKER;

/**
 * Solves the inverse problem: finds the value of one design parameter for which a controlled output of the direct
 * solver reaches a target.
 * <p>
 * The parameter bracket is first scanned at evenly spaced values, a sub-interval where the output crosses the target
 * is then refined with a Brent solver. No direction of variation is assumed: when the output is not monotonous and
 * crosses the target several times, the sub-interval containing, or else nearest to, the design parameter value of
 * the input parameters is refined and the result reports that the root is not unique.
 *
 * @author Open AHU developers
 */
public class ParametricRootFinder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParametricRootFinder.class);

    private static final double RELATIVE_ACCURACY = 1e-14;

    private final AhuSolver solver;

    private final RootFinderParameters parameters;

    public ParametricRootFinder() {
        this(new AhuSolver(), new RootFinderParameters());
    }

    public ParametricRootFinder(AhuSolver solver, RootFinderParameters parameters) {
        this.solver = Objects.requireNonNull(solver);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public RootFinderParameters getParameters() {
        return parameters;
    }

    private record Trial(double parameterValue, double output, AhuSolverResult result) {
    }

    /**
     * Scanned sub-interval crossing the target, lower and upper are the same trial for a scan point on the target.
     */
    private record Crossing(Trial lower, Trial upper) {

        boolean isExact() {
            return lower == upper;
        }

        double distanceTo(double value) {
            if (value < lower.parameterValue()) {
                return lower.parameterValue() - value;
            }
            return Math.max(value - upper.parameterValue(), 0);
        }
    }

    /**
     * Trial solves of one search, cached by parameter value so that bracket ends are not solved twice.
     */
    private final class Search {

        private final AhuParameters ahuParameters;

        private final AhuInputs inputs;

        private final DesignParameter designParameter;

        private final ControlledOutput output;

        private final double target;

        private final double startValue;

        private final Map<Double, Trial> trials = new ConcurrentHashMap<>();

        private final AtomicInteger evaluationCount = new AtomicInteger();

        private Search(AhuParameters ahuParameters, AhuInputs inputs, DesignParameter designParameter, ControlledOutput output, double target) {
            this.ahuParameters = ahuParameters;
            this.inputs = inputs;
            this.designParameter = designParameter;
            this.output = output;
            this.target = target;
            this.startValue = designParameter.getValue(ahuParameters);
        }

        private Trial evaluate(double value) {
            Trial trial = trials.get(value);
            if (trial == null) {
                AhuSolverResult result = solver.solve(designParameter.apply(ahuParameters, value), inputs);
                evaluationCount.incrementAndGet();
                trial = new Trial(value, output.getValue(result), result);
                trials.put(value, trial);
                LOGGER.debug("Trial {}={}: {}={} (target {})", designParameter, value, output, trial.output(), target);
            }
            return trial;
        }

        private double residual(double value) {
            return evaluate(value).output() - target;
        }

        private Trial bestTrial() {
            return trials.values().stream()
                    .min(Comparator.comparingDouble(trial -> Math.abs(trial.output() - target)))
                    .orElseThrow();
        }
    }

    public RootFinderResult find(AhuParameters ahuParameters, AhuInputs inputs, DesignParameter designParameter,
                                 ControlledOutput output, double target) {
        Objects.requireNonNull(ahuParameters);
        Objects.requireNonNull(inputs);
        Objects.requireNonNull(designParameter);
        Objects.requireNonNull(output);
        if (!Double.isFinite(target)) {
            throw new InvalidParameterException("Invalid root finder target: " + target);
        }
        int scanSize = parameters.getBracketScanIntervals() + 1;
        if (scanSize > parameters.getMaxIterations()) {
            throw new InvalidParameterException("Bracket scan needs " + scanSize + " solves but only "
                    + parameters.getMaxIterations() + " are allowed");
        }

        Stopwatch stopwatch = Stopwatch.createStarted();

        AhuParameters searchParameters = ahuParameters;
        ControlledOutput searchOutput = output;
        double searchTarget = target;
        if (output.isHumidity()) {
            // humidity is reached by the design parameter only
            searchParameters = ahuParameters.withHumidityControllerGain(0);
        }
        if (output == ControlledOutput.ZONE_RELATIVE_HUMIDITY) {
            searchOutput = ControlledOutput.ZONE_HUMIDITY_RATIO;
            searchTarget = solver.getPsychrometricProperties().humidityRatio(inputs.getZoneTemperatureSetpoint(), target);
        }

        double lowerBound = designParameter.getLowerBound(searchParameters, parameters);
        double upperBound = designParameter.getUpperBound(searchParameters, parameters);
        if (lowerBound >= upperBound) {
            throw new InvalidParameterException("Empty " + designParameter + " bracket [" + lowerBound + ", " + upperBound + "]");
        }

        LOGGER.debug("Searching {} in [{}, {}] so that {}={}", designParameter, lowerBound, upperBound, searchOutput, searchTarget);

        Search search = new Search(searchParameters, inputs, designParameter, searchOutput, searchTarget);
        List<Trial> scan = scan(search, lowerBound, upperBound);

        RootFinderResult.Builder builder = RootFinderResult.builder()
                .setDesignParameter(designParameter)
                .setControlledOutput(searchOutput)
                .setTarget(searchTarget)
                .setBoundaryOutputs(scan.get(0).output(), scan.get(scan.size() - 1).output())
                .setAchievableRange(scan.stream().mapToDouble(Trial::output).min().orElseThrow(),
                                    scan.stream().mapToDouble(Trial::output).max().orElseThrow());

        RootFinderResult result = refine(search, scan, builder);

        stopwatch.stop();
        LOGGER.debug(PERFORMANCE_MARKER, "Root finding done in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));

        return result;
    }

    private static List<Crossing> findCrossings(List<Trial> scan, double target) {
        List<Crossing> crossings = new ArrayList<>();
        for (int i = 0; i < scan.size(); i++) {
            Trial trial = scan.get(i);
            double residual = trial.output() - target;
            if (residual == 0) {
                crossings.add(new Crossing(trial, trial));
            } else if (i < scan.size() - 1) {
                Trial next = scan.get(i + 1);
                if (Math.signum(residual) * Math.signum(next.output() - target) < 0) {
                    crossings.add(new Crossing(trial, next));
                }
            }
        }
        return crossings;
    }

    private RootFinderResult refine(Search search, List<Trial> scan, RootFinderResult.Builder builder) {
        DesignParameter designParameter = search.designParameter;
        List<Crossing> crossings = findCrossings(scan, search.target);
        builder.setCrossingCount(crossings.size());

        if (crossings.isEmpty()) {
            Trial best = search.bestTrial();
            LOGGER.warn("{} target {} not reachable by {} in [{}, {}], outputs at bracket ends are {} and {}",
                    search.output, search.target, designParameter, scan.get(0).parameterValue(),
                    scan.get(scan.size() - 1).parameterValue(), scan.get(0).output(), scan.get(scan.size() - 1).output());
            return builder.setStatus(RootFinderStatus.INFEASIBLE_TARGET)
                    .setTrial(best.parameterValue(), best.output(), best.result())
                    .setEvaluationCount(search.evaluationCount.get())
                    .build();
        }

        // first one wins on a tie
        Crossing crossing = crossings.stream()
                .min(Comparator.comparingDouble(c -> c.distanceTo(search.startValue)))
                .orElseThrow();
        if (crossings.size() > 1) {
            LOGGER.warn("{} target {} crossed in {} sub-intervals of {}, keeping [{}, {}] nearest to {}={}",
                    search.output, search.target, crossings.size(), designParameter, crossing.lower().parameterValue(),
                    crossing.upper().parameterValue(), designParameter, search.startValue);
        }
        if (crossing.isExact()) {
            return converged(search, crossing.lower(), builder);
        }
        Trial lower = crossing.lower();
        Trial upper = crossing.upper();

        int remainingEvaluations = parameters.getMaxIterations() - search.evaluationCount.get();
        if (remainingEvaluations > 0) {
            LOGGER.debug("{} target bracketed by {} in [{}, {}]", search.output, designParameter, lower.parameterValue(), upper.parameterValue());
            BrentSolver brentSolver = new BrentSolver(RELATIVE_ACCURACY, parameters.getAbsoluteTolerance(), parameters.getFunctionTolerance());
            try {
                // bracket ends are already solved and are not counted twice
                double root = brentSolver.solve(remainingEvaluations + 2, search::residual, lower.parameterValue(), upper.parameterValue());
                return converged(search, search.evaluate(root), builder);
            } catch (TooManyEvaluationsException e) {
                LOGGER.debug("Brent solver stopped: {}", e.getMessage());
            }
        }

        Trial best = search.bestTrial();
        LOGGER.warn("Root finder reached {} solves without convergence, best trial {}={} gives {}={} (target {})",
                parameters.getMaxIterations(), designParameter, best.parameterValue(), search.output, best.output(), search.target);
        return builder.setStatus(RootFinderStatus.MAX_ITERATIONS_REACHED)
                .setTrial(best.parameterValue(), best.output(), best.result())
                .setEvaluationCount(search.evaluationCount.get())
                .build();
    }

    private RootFinderResult converged(Search search, Trial trial, RootFinderResult.Builder builder) {
        LOGGER.info("Root finder converged: {}={} gives {}={} (target {}) in {} solves",
                search.designParameter, trial.parameterValue(), search.output, trial.output(), search.target,
                search.evaluationCount.get());
        return builder.setStatus(RootFinderStatus.CONVERGED)
                .setTrial(trial.parameterValue(), trial.output(), trial.result())
                .setEvaluationCount(search.evaluationCount.get())
                .build();
    }

    private List<Trial> scan(Search search, double lowerBound, double upperBound) {
        int intervals = parameters.getBracketScanIntervals();
        double[] values = new double[intervals + 1];
        for (int i = 0; i < intervals; i++) {
            values[i] = lowerBound + i * (upperBound - lowerBound) / intervals;
        }
        values[intervals] = upperBound;

        List<Trial> trials = new ArrayList<>(values.length);
        if (parameters.getThreadCount() == 1) {
            for (double value : values) {
                trials.add(search.evaluate(value));
            }
            return trials;
        }

        ExecutorService executor = Executors.newFixedThreadPool(parameters.getThreadCount());
        try {
            List<CompletableFuture<Trial>> futures = new ArrayList<>(values.length);
            for (double value : values) {
                futures.add(CompletableFuture.supplyAsync(() -> search.evaluate(value), executor));
            }
            try {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                        .get(); // get instead of join to be interruptible
            } catch (InterruptedException e) {
                for (var future : futures) {
                    future.cancel(true);
                }
                Thread.currentThread().interrupt();
                throw new AhuException("Bracket scan interrupted", e);
            } catch (ExecutionException e) {
                throw unwrap(e.getCause());
            }
            for (CompletableFuture<Trial> future : futures) {
                trials.add(future.join());
            }
        } finally {
            executor.shutdownNow();
        }
        return trials;
    }

    private static RuntimeException unwrap(Throwable cause) {
        Throwable t = cause;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new AhuException("Bracket scan failed", t);
    }
}
