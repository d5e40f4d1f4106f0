/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu;

import com.google.common.base.Stopwatch;
import com.powsybl.math.matrix.DenseMatrixFactory;
import com.powsybl.math.matrix.MatrixFactory;
import com.powsybl.openahu.SolverNotConvergedException;
import com.powsybl.openahu.ahu.outerloop.AhuOuterLoop;
import com.powsybl.openahu.ahu.outerloop.AhuOuterLoopContext;
import com.powsybl.openahu.ahu.outerloop.CoilCapacityOuterLoop;
import com.powsybl.openahu.ahu.outerloop.CoilHumidityModeOuterLoop;
import com.powsybl.openahu.ahu.outerloop.OuterLoopResult;
import com.powsybl.openahu.ahu.outerloop.OuterLoopStatus;
import com.powsybl.openahu.equations.EquationSystem;
import com.powsybl.openahu.equations.LinearSystemMatrix;
import com.powsybl.openahu.network.AhuInputs;
import com.powsybl.openahu.network.AhuNetwork;
import com.powsybl.openahu.network.AhuParameters;
import com.powsybl.openahu.network.CoilHumidityMode;
import com.powsybl.openahu.network.CoilTemperatureMode;
import com.powsybl.openahu.network.CoolingCoil;
import com.powsybl.openahu.network.StatePoint;
import com.powsybl.openahu.psychro.DefaultPsychrometricProperties;
import com.powsybl.openahu.psychro.PsychrometricProperties;
import org.apache.commons.lang3.mutable.MutableInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.powsybl.openahu.util.Markers.PERFORMANCE_MARKER;

/**
 * Direct solver: solves the balance equations of the unit for fixed design parameters.
 * <p>
 * The system is linear except for the wet coil characteristic, which is linearized around the previous coil outlet
 * temperature until the outlet humidity ratio lies on the saturation curve. Coil operating modes are then checked by
 * outer loops, any mode change triggering a new solve.
 * <p>
 * A solver instance holds no state between two calls and can be shared between threads.
 *
 * @author Open AHU developers
 */
public class AhuSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(AhuSolver.class);

    private final PsychrometricProperties psychrometricProperties;

    private final AhuSolverParameters parameters;

    private final MatrixFactory matrixFactory;

    public AhuSolver() {
        this(new DefaultPsychrometricProperties(), new AhuSolverParameters(), new DenseMatrixFactory());
    }

    public AhuSolver(AhuSolverParameters parameters) {
        this(new DefaultPsychrometricProperties(), parameters, new DenseMatrixFactory());
    }

    public AhuSolver(PsychrometricProperties psychrometricProperties, AhuSolverParameters parameters, MatrixFactory matrixFactory) {
        this.psychrometricProperties = Objects.requireNonNull(psychrometricProperties);
        this.parameters = Objects.requireNonNull(parameters);
        this.matrixFactory = Objects.requireNonNull(matrixFactory);
    }

    public PsychrometricProperties getPsychrometricProperties() {
        return psychrometricProperties;
    }

    public AhuSolverParameters getParameters() {
        return parameters;
    }

    private List<AhuOuterLoop> createOuterLoops() {
        return List.of(new CoilCapacityOuterLoop(parameters.getMaxControllerSwitchCount()),
                       new CoilHumidityModeOuterLoop());
    }

    private static void solveLinearSystem(AhuNetwork network, EquationSystem<AhuVariableType, AhuEquationType> equationSystem,
                                          LinearSystemMatrix<AhuVariableType, AhuEquationType> matrix) {
        double[] targets = AhuTargetVector.createArray(equationSystem, network);
        equationSystem.getStateVector().set(matrix.solve(targets));
        AhuEquationSystemUpdater.updateNetwork(equationSystem, network);
    }

    /**
     * Solve until the wet coil outlet lies on the saturation curve.
     *
     * @return the number of linear solves
     */
    private int runSaturationLoop(AhuNetwork network, EquationSystem<AhuVariableType, AhuEquationType> equationSystem,
                                  LinearSystemMatrix<AhuVariableType, AhuEquationType> matrix) {
        CoolingCoil coil = network.getCoolingCoil();
        int iteration = 0;
        while (true) {
            solveLinearSystem(network, equationSystem, matrix);
            iteration++;

            if (coil.getHumidityMode() != CoilHumidityMode.WET) {
                return iteration;
            }
            double outletTemperature = network.getTemperature(StatePoint.COIL_OUTLET);
            if (coil.getTemperatureMode() == CoilTemperatureMode.CONTROLLED && outletTemperature < coil.getMinOutletTemperature()) {
                // beyond coil capacity, the capacity outer loop will switch the coil
                return iteration;
            }
            double mismatch = Math.abs(psychrometricProperties.saturationHumidityRatio(outletTemperature)
                    - network.getHumidityRatio(StatePoint.COIL_OUTLET));
            LOGGER.debug("Saturation iteration {}: coil outlet at {} °C, humidity ratio mismatch {}", iteration, outletTemperature, mismatch);
            if (mismatch < parameters.getSaturationHumidityRatioEps()) {
                return iteration;
            }
            if (iteration >= parameters.getMaxSaturationIterations()) {
                throw new SolverNotConvergedException("Coil saturation loop did not converge in " + iteration
                        + " iterations (humidity ratio mismatch " + mismatch + ")", iteration);
            }
            coil.setSaturationTemperature(outletTemperature);
            matrix.invalidate();
        }
    }

    public AhuSolverResult solve(AhuParameters ahuParameters, AhuInputs inputs) {
        Objects.requireNonNull(ahuParameters);
        Objects.requireNonNull(inputs);

        Stopwatch stopwatch = Stopwatch.createStarted();

        AhuNetwork network = new AhuNetwork(ahuParameters, inputs, psychrometricProperties, parameters.getSaturationTemperatureInitialGuess());
        LOGGER.debug("Solving {}", network);
        EquationSystem<AhuVariableType, AhuEquationType> equationSystem = new AhuEquationSystemCreator(network).create();
        List<AhuOuterLoop> outerLoops = createOuterLoops();
        AhuOuterLoopContext context = new AhuOuterLoopContext(network);
        MutableInt saturationIterations = new MutableInt();
        double conditionNumber;

        try (LinearSystemMatrix<AhuVariableType, AhuEquationType> matrix
                     = new LinearSystemMatrix<>(equationSystem, matrixFactory, parameters.getMaxConditionNumber())) {
            outerLoops.forEach(outerLoop -> outerLoop.initialize(context));

            saturationIterations.add(runSaturationLoop(network, equationSystem, matrix));

            // each outer loop runs until stable, and all of them again as long as one has changed something
            boolean unstable;
            do {
                unstable = false;
                for (AhuOuterLoop outerLoop : outerLoops) {
                    OuterLoopResult result;
                    do {
                        result = outerLoop.check(context);
                        if (result.status() == OuterLoopStatus.UNSTABLE) {
                            unstable = true;
                            context.setIteration(context.getIteration() + 1);
                            LOGGER.debug("Outer loop '{}' iteration {}: {}", result.outerLoopName(), context.getIteration(), result.statusText());
                            if (context.getIteration() > parameters.getMaxOuterLoopIterations()) {
                                throw new SolverNotConvergedException("Coil operating modes did not stabilize in "
                                        + parameters.getMaxOuterLoopIterations() + " outer loop iterations", context.getIteration());
                            }
                            AhuEquationSystemUpdater.update(equationSystem, network);
                            saturationIterations.add(runSaturationLoop(network, equationSystem, matrix));
                        }
                    } while (result.status() == OuterLoopStatus.UNSTABLE);
                }
            } while (unstable);

            conditionNumber = matrix.getConditionNumber();
        }

        AhuSolverResult result = AhuSolverResult.create(network, saturationIterations.intValue(), context.getIteration(), conditionNumber);

        stopwatch.stop();
        LOGGER.info("AHU solved: coil {}/{}, zone at {} °C and {} kg/kg, coil total heat {} W ({} linear solves, {} outer loop iterations)",
                result.getCoilTemperatureMode(), result.getCoilHumidityMode(), result.getZoneTemperature(), result.getZoneHumidityRatio(),
                result.getCoilTotalHeat(), result.getSaturationIterations(), result.getOuterLoopIterations());
        LOGGER.debug(PERFORMANCE_MARKER, "AHU solved in {} us", stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return result;
    }
}
