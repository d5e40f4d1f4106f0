/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openahu.equations.Equation;
import com.powsybl.openahu.equations.EquationSystem;
import com.powsybl.openahu.network.AhuNetwork;
import com.powsybl.openahu.network.CoilHumidityMode;
import com.powsybl.openahu.network.CoilTemperatureMode;
import com.powsybl.openahu.network.CoolingCoil;
import com.powsybl.openahu.network.StatePoint;

import java.util.Objects;

/**
 * Keeps the equation system in sync with the coil operating modes, and the network in sync with the solved state.
 *
 * @author Open AHU developers
 */
public final class AhuEquationSystemUpdater {

    private AhuEquationSystemUpdater() {
    }

    private static Equation<AhuVariableType, AhuEquationType> getCoilEquation(EquationSystem<AhuVariableType, AhuEquationType> equationSystem,
                                                                              AhuEquationType type) {
        return equationSystem.getEquation(AhuEquationSystemCreator.ELEMENT_NUM, type)
                .orElseThrow(() -> new PowsyblException("Coil equation " + type + " not found"));
    }

    /**
     * Activate the coil humidity side equation (saturation or dry) and the temperature side equation (controller,
     * capacity limit or idle) matching the coil modes.
     */
    public static void update(EquationSystem<AhuVariableType, AhuEquationType> equationSystem, AhuNetwork network) {
        Objects.requireNonNull(equationSystem);
        Objects.requireNonNull(network);
        CoolingCoil coil = network.getCoolingCoil();

        CoilHumidityMode humidityMode = coil.getHumidityMode();
        getCoilEquation(equationSystem, AhuEquationType.COIL_SATURATION).setActive(humidityMode == CoilHumidityMode.WET);
        getCoilEquation(equationSystem, AhuEquationType.COIL_DRY).setActive(humidityMode == CoilHumidityMode.DRY);

        CoilTemperatureMode temperatureMode = coil.getTemperatureMode();
        getCoilEquation(equationSystem, AhuEquationType.TEMPERATURE_CONTROL).setActive(temperatureMode == CoilTemperatureMode.CONTROLLED);
        getCoilEquation(equationSystem, AhuEquationType.COIL_MIN_TEMPERATURE).setActive(temperatureMode == CoilTemperatureMode.CAPACITY_LIMITED);
        getCoilEquation(equationSystem, AhuEquationType.COIL_IDLE).setActive(temperatureMode == CoilTemperatureMode.IDLE
                || temperatureMode == CoilTemperatureMode.SWITCHED_OFF);
    }

    private static double getValue(EquationSystem<AhuVariableType, AhuEquationType> equationSystem, int elementNum, AhuVariableType type) {
        return equationSystem.getValue(equationSystem.getVariable(elementNum, type));
    }

    /**
     * Copy the solved state vector to the network.
     */
    public static void updateNetwork(EquationSystem<AhuVariableType, AhuEquationType> equationSystem, AhuNetwork network) {
        Objects.requireNonNull(equationSystem);
        Objects.requireNonNull(network);
        for (StatePoint point : StatePoint.values()) {
            if (point.isUnknown()) {
                network.setTemperature(point, getValue(equationSystem, point.getNum(), AhuVariableType.TEMPERATURE));
                network.setHumidityRatio(point, getValue(equationSystem, point.getNum(), AhuVariableType.HUMIDITY_RATIO));
            }
        }
        int num = AhuEquationSystemCreator.ELEMENT_NUM;
        network.setCoilTotalHeat(getValue(equationSystem, num, AhuVariableType.COIL_TOTAL_HEAT));
        network.setCoilSensibleHeat(getValue(equationSystem, num, AhuVariableType.COIL_SENSIBLE_HEAT));
        network.setCoilLatentHeat(getValue(equationSystem, num, AhuVariableType.COIL_LATENT_HEAT));
        network.setHeatingCoilHeat(getValue(equationSystem, num, AhuVariableType.HEATING_COIL_HEAT));
        network.setZoneSensibleLoad(getValue(equationSystem, num, AhuVariableType.ZONE_SENSIBLE_LOAD));
        network.setZoneLatentLoad(getValue(equationSystem, num, AhuVariableType.ZONE_LATENT_LOAD));
    }
}
