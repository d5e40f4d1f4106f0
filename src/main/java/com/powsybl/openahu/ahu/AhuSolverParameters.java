/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.openahu.InvalidParameterException;

/**
 * Direct solver numerical parameters.
 *
 * @author Open AHU developers
 */
public class AhuSolverParameters {

    public static final String MODULE_NAME = "open-ahu-default-parameters";

    public static final String SATURATION_TEMPERATURE_INITIAL_GUESS_PARAM_NAME = "saturationTemperatureInitialGuess";
    public static final String MAX_SATURATION_ITERATIONS_PARAM_NAME = "maxSaturationIterations";
    public static final String SATURATION_HUMIDITY_RATIO_EPS_PARAM_NAME = "saturationHumidityRatioEps";
    public static final String MAX_OUTER_LOOP_ITERATIONS_PARAM_NAME = "maxOuterLoopIterations";
    public static final String MAX_CONTROLLER_SWITCH_COUNT_PARAM_NAME = "maxControllerSwitchCount";
    public static final String MAX_CONDITION_NUMBER_PARAM_NAME = "maxConditionNumber";

    public static final double DEFAULT_SATURATION_TEMPERATURE_INITIAL_GUESS = 5;
    public static final int DEFAULT_MAX_SATURATION_ITERATIONS = 50;
    public static final double DEFAULT_SATURATION_HUMIDITY_RATIO_EPS = 1e-9;
    public static final int DEFAULT_MAX_OUTER_LOOP_ITERATIONS = 20;
    public static final int DEFAULT_MAX_CONTROLLER_SWITCH_COUNT = 2;
    public static final double DEFAULT_MAX_CONDITION_NUMBER = 1e12;

    private double saturationTemperatureInitialGuess = DEFAULT_SATURATION_TEMPERATURE_INITIAL_GUESS;

    private int maxSaturationIterations = DEFAULT_MAX_SATURATION_ITERATIONS;

    private double saturationHumidityRatioEps = DEFAULT_SATURATION_HUMIDITY_RATIO_EPS;

    private int maxOuterLoopIterations = DEFAULT_MAX_OUTER_LOOP_ITERATIONS;

    private int maxControllerSwitchCount = DEFAULT_MAX_CONTROLLER_SWITCH_COUNT;

    private double maxConditionNumber = DEFAULT_MAX_CONDITION_NUMBER;

    public static AhuSolverParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static AhuSolverParameters load(PlatformConfig platformConfig) {
        AhuSolverParameters parameters = new AhuSolverParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setSaturationTemperatureInitialGuess(config.getDoubleProperty(SATURATION_TEMPERATURE_INITIAL_GUESS_PARAM_NAME, DEFAULT_SATURATION_TEMPERATURE_INITIAL_GUESS))
                .setMaxSaturationIterations(config.getIntProperty(MAX_SATURATION_ITERATIONS_PARAM_NAME, DEFAULT_MAX_SATURATION_ITERATIONS))
                .setSaturationHumidityRatioEps(config.getDoubleProperty(SATURATION_HUMIDITY_RATIO_EPS_PARAM_NAME, DEFAULT_SATURATION_HUMIDITY_RATIO_EPS))
                .setMaxOuterLoopIterations(config.getIntProperty(MAX_OUTER_LOOP_ITERATIONS_PARAM_NAME, DEFAULT_MAX_OUTER_LOOP_ITERATIONS))
                .setMaxControllerSwitchCount(config.getIntProperty(MAX_CONTROLLER_SWITCH_COUNT_PARAM_NAME, DEFAULT_MAX_CONTROLLER_SWITCH_COUNT))
                .setMaxConditionNumber(config.getDoubleProperty(MAX_CONDITION_NUMBER_PARAM_NAME, DEFAULT_MAX_CONDITION_NUMBER)));
        return parameters;
    }

    public double getSaturationTemperatureInitialGuess() {
        return saturationTemperatureInitialGuess;
    }

    public AhuSolverParameters setSaturationTemperatureInitialGuess(double saturationTemperatureInitialGuess) {
        if (!Double.isFinite(saturationTemperatureInitialGuess)) {
            throw new InvalidParameterException("Invalid saturation temperature initial guess: " + saturationTemperatureInitialGuess);
        }
        this.saturationTemperatureInitialGuess = saturationTemperatureInitialGuess;
        return this;
    }

    public int getMaxSaturationIterations() {
        return maxSaturationIterations;
    }

    public AhuSolverParameters setMaxSaturationIterations(int maxSaturationIterations) {
        if (maxSaturationIterations < 1) {
            throw new InvalidParameterException("Invalid max saturation iterations: " + maxSaturationIterations);
        }
        this.maxSaturationIterations = maxSaturationIterations;
        return this;
    }

    public double getSaturationHumidityRatioEps() {
        return saturationHumidityRatioEps;
    }

    public AhuSolverParameters setSaturationHumidityRatioEps(double saturationHumidityRatioEps) {
        if (saturationHumidityRatioEps <= 0 || Double.isNaN(saturationHumidityRatioEps)) {
            throw new InvalidParameterException("Invalid saturation humidity ratio epsilon: " + saturationHumidityRatioEps);
        }
        this.saturationHumidityRatioEps = saturationHumidityRatioEps;
        return this;
    }

    public int getMaxOuterLoopIterations() {
        return maxOuterLoopIterations;
    }

    public AhuSolverParameters setMaxOuterLoopIterations(int maxOuterLoopIterations) {
        if (maxOuterLoopIterations < 0) {
            throw new InvalidParameterException("Invalid max outer loop iterations: " + maxOuterLoopIterations);
        }
        this.maxOuterLoopIterations = maxOuterLoopIterations;
        return this;
    }

    public int getMaxControllerSwitchCount() {
        return maxControllerSwitchCount;
    }

    public AhuSolverParameters setMaxControllerSwitchCount(int maxControllerSwitchCount) {
        if (maxControllerSwitchCount < 0) {
            throw new InvalidParameterException("Invalid max controller switch count: " + maxControllerSwitchCount);
        }
        this.maxControllerSwitchCount = maxControllerSwitchCount;
        return this;
    }

    public double getMaxConditionNumber() {
        return maxConditionNumber;
    }

    public AhuSolverParameters setMaxConditionNumber(double maxConditionNumber) {
        if (maxConditionNumber <= 1 || Double.isNaN(maxConditionNumber)) {
            throw new InvalidParameterException("Invalid max condition number: " + maxConditionNumber);
        }
        this.maxConditionNumber = maxConditionNumber;
        return this;
    }

    @Override
    public String toString() {
        return "AhuSolverParameters(" +
                "saturationTemperatureInitialGuess=" + saturationTemperatureInitialGuess +
                ", maxSaturationIterations=" + maxSaturationIterations +
                ", saturationHumidityRatioEps=" + saturationHumidityRatioEps +
                ", maxOuterLoopIterations=" + maxOuterLoopIterations +
                ", maxControllerSwitchCount=" + maxControllerSwitchCount +
                ", maxConditionNumber=" + maxConditionNumber +
                ')';
    }
}
