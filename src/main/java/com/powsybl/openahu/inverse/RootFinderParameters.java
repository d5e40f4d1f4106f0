/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.inverse;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.openahu.InvalidParameterException;
import com.powsybl.openahu.ahu.AhuSolverParameters;

/**
 * Parametric root finder parameters, loaded from the same configuration module as the direct solver ones.
 *
 * @author Open AHU developers
 */
public class RootFinderParameters {

    public static final String ABSOLUTE_TOLERANCE_PARAM_NAME = "rootFinderAbsoluteTolerance";
    public static final String FUNCTION_TOLERANCE_PARAM_NAME = "rootFinderFunctionTolerance";
    public static final String MAX_ITERATIONS_PARAM_NAME = "rootFinderMaxIterations";
    public static final String MAX_SUPPLY_MASS_FLOW_PARAM_NAME = "maxSupplyMassFlow";
    public static final String BRACKET_SCAN_INTERVALS_PARAM_NAME = "bracketScanIntervals";
    public static final String THREAD_COUNT_PARAM_NAME = "threadCount";

    public static final double DEFAULT_ABSOLUTE_TOLERANCE = 1e-7;
    public static final double DEFAULT_FUNCTION_TOLERANCE = 1e-12;
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_MAX_SUPPLY_MASS_FLOW = 100;
    public static final int DEFAULT_BRACKET_SCAN_INTERVALS = 10;
    public static final int DEFAULT_THREAD_COUNT = 1;

    private double absoluteTolerance = DEFAULT_ABSOLUTE_TOLERANCE;

    private double functionTolerance = DEFAULT_FUNCTION_TOLERANCE;

    private int maxIterations = DEFAULT_MAX_ITERATIONS;

    private double maxSupplyMassFlow = DEFAULT_MAX_SUPPLY_MASS_FLOW;

    private int bracketScanIntervals = DEFAULT_BRACKET_SCAN_INTERVALS;

    private int threadCount = DEFAULT_THREAD_COUNT;

    public static RootFinderParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static RootFinderParameters load(PlatformConfig platformConfig) {
        RootFinderParameters parameters = new RootFinderParameters();
        platformConfig.getOptionalModuleConfig(AhuSolverParameters.MODULE_NAME)
            .ifPresent(config -> parameters
                .setAbsoluteTolerance(config.getDoubleProperty(ABSOLUTE_TOLERANCE_PARAM_NAME, DEFAULT_ABSOLUTE_TOLERANCE))
                .setFunctionTolerance(config.getDoubleProperty(FUNCTION_TOLERANCE_PARAM_NAME, DEFAULT_FUNCTION_TOLERANCE))
                .setMaxIterations(config.getIntProperty(MAX_ITERATIONS_PARAM_NAME, DEFAULT_MAX_ITERATIONS))
                .setMaxSupplyMassFlow(config.getDoubleProperty(MAX_SUPPLY_MASS_FLOW_PARAM_NAME, DEFAULT_MAX_SUPPLY_MASS_FLOW))
                .setBracketScanIntervals(config.getIntProperty(BRACKET_SCAN_INTERVALS_PARAM_NAME, DEFAULT_BRACKET_SCAN_INTERVALS))
                .setThreadCount(config.getIntProperty(THREAD_COUNT_PARAM_NAME, DEFAULT_THREAD_COUNT)));
        return parameters;
    }

    /**
     * Convergence is reached when two successive trial parameter values differ by less than this tolerance.
     */
    public double getAbsoluteTolerance() {
        return absoluteTolerance;
    }

    public RootFinderParameters setAbsoluteTolerance(double absoluteTolerance) {
        if (absoluteTolerance <= 0 || Double.isNaN(absoluteTolerance)) {
            throw new InvalidParameterException("Invalid root finder absolute tolerance: " + absoluteTolerance);
        }
        this.absoluteTolerance = absoluteTolerance;
        return this;
    }

    public double getFunctionTolerance() {
        return functionTolerance;
    }

    public RootFinderParameters setFunctionTolerance(double functionTolerance) {
        if (functionTolerance < 0 || Double.isNaN(functionTolerance)) {
            throw new InvalidParameterException("Invalid root finder function tolerance: " + functionTolerance);
        }
        this.functionTolerance = functionTolerance;
        return this;
    }

    /**
     * Maximum number of direct solves, bracket scan included.
     */
    public int getMaxIterations() {
        return maxIterations;
    }

    public RootFinderParameters setMaxIterations(int maxIterations) {
        if (maxIterations < 1) {
            throw new InvalidParameterException("Invalid root finder max iterations: " + maxIterations);
        }
        this.maxIterations = maxIterations;
        return this;
    }

    public double getMaxSupplyMassFlow() {
        return maxSupplyMassFlow;
    }

    public RootFinderParameters setMaxSupplyMassFlow(double maxSupplyMassFlow) {
        if (maxSupplyMassFlow <= 0 || !Double.isFinite(maxSupplyMassFlow)) {
            throw new InvalidParameterException("Invalid max supply mass flow: " + maxSupplyMassFlow);
        }
        this.maxSupplyMassFlow = maxSupplyMassFlow;
        return this;
    }

    public int getBracketScanIntervals() {
        return bracketScanIntervals;
    }

    public RootFinderParameters setBracketScanIntervals(int bracketScanIntervals) {
        if (bracketScanIntervals < 1) {
            throw new InvalidParameterException("Invalid bracket scan interval count: " + bracketScanIntervals);
        }
        this.bracketScanIntervals = bracketScanIntervals;
        return this;
    }

    public int getThreadCount() {
        return threadCount;
    }

    public RootFinderParameters setThreadCount(int threadCount) {
        if (threadCount < 1) {
            throw new InvalidParameterException("Invalid thread count: " + threadCount);
        }
        this.threadCount = threadCount;
        return this;
    }

    @Override
    public String toString() {
        return "RootFinderParameters(" +
                "absoluteTolerance=" + absoluteTolerance +
                ", functionTolerance=" + functionTolerance +
                ", maxIterations=" + maxIterations +
                ", maxSupplyMassFlow=" + maxSupplyMassFlow +
                ", bracketScanIntervals=" + bracketScanIntervals +
                ", threadCount=" + threadCount +
                ')';
    }
}
