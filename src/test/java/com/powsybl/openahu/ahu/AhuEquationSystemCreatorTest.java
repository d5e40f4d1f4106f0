/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu;

import com.powsybl.openahu.equations.Equation;
import com.powsybl.openahu.equations.EquationSystem;
import com.powsybl.openahu.network.AhuInputs;
import com.powsybl.openahu.network.AhuNetwork;
import com.powsybl.openahu.network.AhuParameters;
import com.powsybl.openahu.network.CoilHumidityMode;
import com.powsybl.openahu.network.CoilTemperatureMode;
import com.powsybl.openahu.psychro.DefaultPsychrometricProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open AHU developers
 */
class AhuEquationSystemCreatorTest {

    private static AhuNetwork createNetwork(AhuParameters parameters) {
        return new AhuNetwork(parameters, AhuInputs.createDefault(), new DefaultPsychrometricProperties(), 5);
    }

    private static List<AhuEquationType> activeTypes(EquationSystem<AhuVariableType, AhuEquationType> equationSystem) {
        return equationSystem.getIndex().getSortedEquationsToSolve().stream().map(Equation::getType).toList();
    }

    @Test
    void testSquareSystem() {
        AhuNetwork network = createNetwork(AhuParameters.createDefault());
        EquationSystem<AhuVariableType, AhuEquationType> equationSystem = new AhuEquationSystemCreator(network).create();
        assertEquals(16, equationSystem.getIndex().getColumnCount());
        assertEquals(16, equationSystem.getIndex().getRowCount());
        List<AhuEquationType> types = activeTypes(equationSystem);
        assertTrue(types.contains(AhuEquationType.COIL_SATURATION));
        assertTrue(types.contains(AhuEquationType.TEMPERATURE_CONTROL));
        assertFalse(types.contains(AhuEquationType.COIL_DRY));
        assertFalse(types.contains(AhuEquationType.COIL_MIN_TEMPERATURE));
        assertFalse(types.contains(AhuEquationType.COIL_IDLE));
        // all equations are created once, only the active ones are solved
        assertEquals(19, equationSystem.getEquations().size());
    }

    @Test
    void testModeUpdate() {
        AhuNetwork network = createNetwork(AhuParameters.createDefault());
        EquationSystem<AhuVariableType, AhuEquationType> equationSystem = new AhuEquationSystemCreator(network).create();
        network.getCoolingCoil().setHumidityMode(CoilHumidityMode.DRY);
        network.getCoolingCoil().setTemperatureMode(CoilTemperatureMode.CAPACITY_LIMITED);
        AhuEquationSystemUpdater.update(equationSystem, network);

        List<AhuEquationType> types = activeTypes(equationSystem);
        assertEquals(16, types.size());
        assertTrue(types.contains(AhuEquationType.COIL_DRY));
        assertTrue(types.contains(AhuEquationType.COIL_MIN_TEMPERATURE));
        assertFalse(types.contains(AhuEquationType.COIL_SATURATION));
        assertFalse(types.contains(AhuEquationType.TEMPERATURE_CONTROL));
    }

    @Test
    void testSwitchedOffCoil() {
        AhuNetwork network = createNetwork(AhuParameters.createDefault());
        EquationSystem<AhuVariableType, AhuEquationType> equationSystem = new AhuEquationSystemCreator(network).create();
        network.getCoolingCoil().setHumidityMode(CoilHumidityMode.DRY);
        network.getCoolingCoil().setTemperatureMode(CoilTemperatureMode.SWITCHED_OFF);
        AhuEquationSystemUpdater.update(equationSystem, network);

        List<AhuEquationType> types = activeTypes(equationSystem);
        assertEquals(16, types.size());
        assertTrue(types.contains(AhuEquationType.COIL_IDLE));
        assertTrue(types.contains(AhuEquationType.COIL_DRY));
        assertFalse(types.contains(AhuEquationType.TEMPERATURE_CONTROL));
        assertFalse(types.contains(AhuEquationType.COIL_MIN_TEMPERATURE));
    }

    @Test
    void testIdleCoil() {
        AhuNetwork network = createNetwork(AhuParameters.createDefault().withBypassFraction(1));
        EquationSystem<AhuVariableType, AhuEquationType> equationSystem = new AhuEquationSystemCreator(network).create();
        List<AhuEquationType> types = activeTypes(equationSystem);
        assertEquals(16, types.size());
        assertTrue(types.contains(AhuEquationType.COIL_IDLE));
        assertTrue(types.contains(AhuEquationType.COIL_DRY));
        assertFalse(types.contains(AhuEquationType.TEMPERATURE_CONTROL));
    }

    @Test
    void testHumidityControllerEquation() {
        AhuNetwork network = createNetwork(AhuParameters.createDefault().withHumidityControllerGain(1e8));
        EquationSystem<AhuVariableType, AhuEquationType> equationSystem = new AhuEquationSystemCreator(network).create();
        String humidityControl = equationSystem.writeToString().lines()
                .filter(line -> line.startsWith(AhuEquationType.HUMIDITY_CONTROL.getSymbol()))
                .findFirst()
                .orElseThrow();
        assertEquals(AhuEquationType.HUMIDITY_CONTROL.getSymbol() + "0 = 1.0 * w5 + -1.0E-8 * QsHC0", humidityControl);
    }
}
