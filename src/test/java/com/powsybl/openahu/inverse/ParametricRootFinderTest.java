/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.inverse;

import com.powsybl.openahu.AhuException;
import com.powsybl.openahu.InvalidParameterException;
import com.powsybl.openahu.SingularSystemException;
import com.powsybl.openahu.ahu.AhuSolver;
import com.powsybl.openahu.ahu.AhuSolverResult;
import com.powsybl.openahu.network.AhuInputs;
import com.powsybl.openahu.network.AhuParameters;
import com.powsybl.openahu.network.StatePoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * @author Open AHU developers
 */
class ParametricRootFinderTest {

    private final AhuSolver solver = new AhuSolver();

    private final AhuInputs inputs = AhuInputs.createDefault();

    private RootFinderParameters parameters;

    @BeforeEach
    void setUp() {
        parameters = new RootFinderParameters();
    }

    @Test
    void testBypassFraction() {
        double target = solver.solve(AhuParameters.createDefault().withBypassFraction(0.25), inputs).getZoneHumidityRatio();

        RootFinderResult result = new ParametricRootFinder(solver, parameters)
                .find(AhuParameters.createDefault(), inputs, DesignParameter.BYPASS_FRACTION, ControlledOutput.ZONE_HUMIDITY_RATIO, target);

        assertEquals(RootFinderStatus.CONVERGED, result.getStatus());
        assertTrue(result.isAuthoritative());
        assertEquals(0.25, result.getConvergedParameterValue(), 1e-5);
        assertEquals(target, result.getOutputValue(), 1e-9);
        AhuSolverResult solverResult = result.getSolverResult().orElseThrow();
        assertEquals(result.getParameterValue(), solverResult.getParameters().getBypassFraction(), 0);
        assertEquals(0.012146, result.getLowerBoundOutput(), 1e-5);
        assertEquals(0.015418, result.getUpperBoundOutput(), 1e-5);
        assertTrue(result.getEvaluationCount() <= parameters.getMaxIterations());
    }

    @Test
    void testSupplyMassFlow() {
        AhuParameters ahuParameters = AhuParameters.createDefault();
        double target = solver.solve(ahuParameters.withSupplyMassFlow(5), inputs).getSupplyTemperature();
        assertEquals(18.4, target, 1e-4);

        RootFinderResult result = new ParametricRootFinder(solver, parameters)
                .find(ahuParameters, inputs, DesignParameter.SUPPLY_MASS_FLOW, ControlledOutput.SUPPLY_TEMPERATURE, target);

        assertEquals(RootFinderStatus.CONVERGED, result.getStatus());
        assertEquals(5, result.getConvergedParameterValue(), 1e-5);
        assertTrue(result.isUniqueRoot());
        assertEquals(target, result.getSolverResult().orElseThrow().getState(StatePoint.SUPPLY).temperature(), 1e-8);
        // supply temperature rises with the supply flow
        assertTrue(result.getLowerBoundOutput() < result.getUpperBoundOutput());
    }

    @Test
    void testInfeasibleTarget() {
        RootFinderResult result = new ParametricRootFinder(solver, parameters)
                .find(AhuParameters.createDefault(), inputs, DesignParameter.BYPASS_FRACTION, ControlledOutput.ZONE_HUMIDITY_RATIO, 0.005);

        assertEquals(RootFinderStatus.INFEASIBLE_TARGET, result.getStatus());
        assertFalse(result.isAuthoritative());
        assertThrows(AhuException.class, result::getConvergedParameterValue);
        assertEquals(0.012146, result.getLowerBoundOutput(), 1e-5);
        assertEquals(0.015418, result.getUpperBoundOutput(), 1e-5);
        assertEquals(0.009526, result.getMinAchievableOutput(), 1e-5);
        assertEquals(0.015418, result.getMaxAchievableOutput(), 1e-5);
        // closest scan point
        assertEquals(0.6, result.getParameterValue(), 1e-12);
        assertEquals(11, result.getEvaluationCount());
        assertEquals(0, result.getCrossingCount());
        assertTrue(result.getSolverResult().isPresent());
    }

    @Test
    void testRootNearestToInitialBypassFraction() {
        // zone humidity ratio falls with the bypass fraction until the coil is capacity limited, then rises
        double target = solver.solve(AhuParameters.createDefault().withBypassFraction(0.75), inputs).getZoneHumidityRatio();
        ParametricRootFinder rootFinder = new ParametricRootFinder(solver, parameters);

        RootFinderResult result = rootFinder.find(AhuParameters.createDefault().withBypassFraction(0.8), inputs,
                DesignParameter.BYPASS_FRACTION, ControlledOutput.ZONE_HUMIDITY_RATIO, target);
        assertEquals(RootFinderStatus.CONVERGED, result.getStatus());
        assertEquals(0.75, result.getConvergedParameterValue(), 1e-5);
        assertEquals(2, result.getCrossingCount());
        assertFalse(result.isUniqueRoot());

        // same target from the default bypass fraction gives the other root
        result = rootFinder.find(AhuParameters.createDefault(), inputs, DesignParameter.BYPASS_FRACTION,
                ControlledOutput.ZONE_HUMIDITY_RATIO, target);
        assertEquals(RootFinderStatus.CONVERGED, result.getStatus());
        assertTrue(result.getParameterValue() > 0.2 && result.getParameterValue() < 0.3);
        assertFalse(result.isUniqueRoot());
    }

    @Test
    void testRootOnScanPoint() {
        double target = solver.solve(AhuParameters.createDefault().withBypassFraction(0.7), inputs).getZoneHumidityRatio();

        RootFinderResult result = new ParametricRootFinder(solver, parameters)
                .find(AhuParameters.createDefault().withBypassFraction(0.7), inputs, DesignParameter.BYPASS_FRACTION,
                        ControlledOutput.ZONE_HUMIDITY_RATIO, target);

        assertEquals(RootFinderStatus.CONVERGED, result.getStatus());
        assertEquals(0.7, result.getConvergedParameterValue(), 0);
        assertEquals(11, result.getEvaluationCount());
        assertEquals(2, result.getCrossingCount());
    }

    @Test
    void testMaxIterationsReached() {
        parameters.setBracketScanIntervals(2)
                .setMaxIterations(5)
                .setAbsoluteTolerance(1e-15)
                .setFunctionTolerance(0);
        double target = solver.solve(AhuParameters.createDefault().withBypassFraction(0.3), inputs).getZoneHumidityRatio();

        RootFinderResult result = new ParametricRootFinder(solver, parameters)
                .find(AhuParameters.createDefault(), inputs, DesignParameter.BYPASS_FRACTION, ControlledOutput.ZONE_HUMIDITY_RATIO, target);

        assertEquals(RootFinderStatus.MAX_ITERATIONS_REACHED, result.getStatus());
        assertFalse(result.isAuthoritative());
        assertEquals(5, result.getEvaluationCount());
        assertTrue(result.getParameterValue() > 0 && result.getParameterValue() < 0.5);
    }

    @Test
    void testZoneRelativeHumidity() {
        RootFinderResult result = new ParametricRootFinder(solver, parameters)
                .find(AhuParameters.createDefault(), inputs, DesignParameter.BYPASS_FRACTION, ControlledOutput.ZONE_RELATIVE_HUMIDITY, 0.55);

        assertEquals(RootFinderStatus.CONVERGED, result.getStatus());
        // searched as a humidity ratio at the zone setpoint temperature
        assertEquals(ControlledOutput.ZONE_HUMIDITY_RATIO, result.getControlledOutput());
        assertEquals(0.0102384, result.getTarget(), 1e-7);
        assertEquals(0.0102384, result.getSolverResult().orElseThrow().getZoneHumidityRatio(), 1e-7);
        assertTrue(result.getParameterValue() > 0.3 && result.getParameterValue() < 0.4);
    }

    @Test
    void testHumidityControllerDisabled() {
        AhuParameters ahuParameters = AhuParameters.createDefault().withHumidityControllerGain(1e10);
        RootFinderResult result = new ParametricRootFinder(solver, parameters)
                .find(ahuParameters, inputs, DesignParameter.BYPASS_FRACTION, ControlledOutput.ZONE_HUMIDITY_RATIO, 0.0105897);

        assertEquals(RootFinderStatus.CONVERGED, result.getStatus());
        AhuSolverResult solverResult = result.getSolverResult().orElseThrow();
        assertEquals(0, solverResult.getParameters().getHumidityControllerGain(), 0);
        assertEquals(0, solverResult.getHeatingCoilHeat(), 1e-6);
        assertEquals(0.3, result.getParameterValue(), 1e-4);
    }

    @Test
    void testParallelScan() {
        RootFinderResult sequential = new ParametricRootFinder(solver, parameters)
                .find(AhuParameters.createDefault(), inputs, DesignParameter.BYPASS_FRACTION, ControlledOutput.ZONE_HUMIDITY_RATIO, 0.0105);
        RootFinderResult parallel = new ParametricRootFinder(solver, new RootFinderParameters().setThreadCount(4))
                .find(AhuParameters.createDefault(), inputs, DesignParameter.BYPASS_FRACTION, ControlledOutput.ZONE_HUMIDITY_RATIO, 0.0105);

        assertEquals(RootFinderStatus.CONVERGED, parallel.getStatus());
        assertEquals(sequential.getParameterValue(), parallel.getParameterValue(), 0);
        assertEquals(sequential.getEvaluationCount(), parallel.getEvaluationCount());
        assertEquals(sequential.getMinAchievableOutput(), parallel.getMinAchievableOutput(), 0);
    }

    @Test
    void testInvalidSearch() {
        ParametricRootFinder rootFinder = new ParametricRootFinder(solver, parameters);
        AhuParameters ahuParameters = AhuParameters.createDefault();
        assertThrows(InvalidParameterException.class, () -> rootFinder.find(ahuParameters, inputs, DesignParameter.BYPASS_FRACTION,
                ControlledOutput.ZONE_TEMPERATURE, Double.NaN));
        assertThrows(NullPointerException.class, () -> rootFinder.find(ahuParameters, inputs, null,
                ControlledOutput.ZONE_TEMPERATURE, 24));

        parameters.setMaxSupplyMassFlow(1);
        InvalidParameterException e = assertThrows(InvalidParameterException.class, () -> rootFinder.find(ahuParameters, inputs,
                DesignParameter.SUPPLY_MASS_FLOW, ControlledOutput.SUPPLY_TEMPERATURE, 15));
        assertTrue(e.getMessage().startsWith("Empty SUPPLY_MASS_FLOW bracket"));

        parameters.setMaxSupplyMassFlow(100).setMaxIterations(10);
        e = assertThrows(InvalidParameterException.class, () -> rootFinder.find(ahuParameters, inputs,
                DesignParameter.BYPASS_FRACTION, ControlledOutput.ZONE_TEMPERATURE, 24));
        assertEquals("Bracket scan needs 11 solves but only 10 are allowed", e.getMessage());
    }

    @Test
    void testSolverFailurePropagated() {
        AhuSolver failingSolver = mock(AhuSolver.class);
        when(failingSolver.solve(any(), any())).thenThrow(new SingularSystemException("Singular system", Double.POSITIVE_INFINITY, 1e12));
        AhuParameters ahuParameters = AhuParameters.createDefault();

        ParametricRootFinder sequential = new ParametricRootFinder(failingSolver, parameters);
        assertThrows(SingularSystemException.class, () -> sequential.find(ahuParameters, inputs, DesignParameter.BYPASS_FRACTION,
                ControlledOutput.ZONE_TEMPERATURE, 24));

        ParametricRootFinder parallel = new ParametricRootFinder(failingSolver, new RootFinderParameters().setThreadCount(3));
        assertThrows(SingularSystemException.class, () -> parallel.find(ahuParameters, inputs, DesignParameter.BYPASS_FRACTION,
                ControlledOutput.ZONE_TEMPERATURE, 24));
    }
}
