/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu;

import com.powsybl.openahu.equations.EquationSystem;
import com.powsybl.openahu.equations.EquationTerm;
import com.powsybl.openahu.network.AhuInputs;
import com.powsybl.openahu.network.AhuNetwork;
import com.powsybl.openahu.network.AhuParameters;
import com.powsybl.openahu.network.CoolingCoil;
import com.powsybl.openahu.network.FlowSplit;
import com.powsybl.openahu.network.StatePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static com.powsybl.openahu.psychro.AirProperties.LATENT_HEAT;
import static com.powsybl.openahu.psychro.AirProperties.SPECIFIC_HEAT;

/**
 * Balance equation assembler. Creates the mass and energy balances of every element of the unit plus the controller
 * equations. Every equation is linear in the unknowns, the right hand sides are given by {@link AhuTargetVector}.
 * <p>
 * All the coil equations are created, the coil operating modes then select which of them are active
 * (see {@link AhuEquationSystemUpdater}).
 *
 * @author Open AHU developers
 */
public class AhuEquationSystemCreator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AhuEquationSystemCreator.class);

    /**
     * Outdoor air and recycled air mixing box.
     */
    public static final int OUTDOOR_MIXING_BOX_NUM = 0;

    /**
     * Treated air and bypassed air mixing box.
     */
    public static final int BYPASS_MIXING_BOX_NUM = 1;

    public static final int ELEMENT_NUM = 0;

    private final AhuNetwork network;

    public AhuEquationSystemCreator(AhuNetwork network) {
        this.network = Objects.requireNonNull(network);
    }

    private static EquationTerm<AhuVariableType, AhuEquationType> temperature(EquationSystem<AhuVariableType, AhuEquationType> equationSystem,
                                                                               StatePoint point, double coefficient) {
        return equationSystem.getVariable(point.getNum(), AhuVariableType.TEMPERATURE)
                .<AhuEquationType>createTerm()
                .multiply(coefficient);
    }

    private static EquationTerm<AhuVariableType, AhuEquationType> humidityRatio(EquationSystem<AhuVariableType, AhuEquationType> equationSystem,
                                                                                 StatePoint point, double coefficient) {
        return equationSystem.getVariable(point.getNum(), AhuVariableType.HUMIDITY_RATIO)
                .<AhuEquationType>createTerm()
                .multiply(coefficient);
    }

    private static EquationTerm<AhuVariableType, AhuEquationType> heat(EquationSystem<AhuVariableType, AhuEquationType> equationSystem,
                                                                        AhuVariableType type, double coefficient) {
        return equationSystem.getVariable(ELEMENT_NUM, type)
                .<AhuEquationType>createTerm()
                .multiply(coefficient);
    }

    private void createOutdoorMixingBoxEquations(EquationSystem<AhuVariableType, AhuEquationType> equationSystem) {
        FlowSplit flowSplit = network.getFlowSplit();
        double m = flowSplit.getSupplyFlow();
        double recycled = flowSplit.getRecycledFlow();
        // m.θM - (m - mo).θI = mo.θo
        equationSystem.createEquation(OUTDOOR_MIXING_BOX_NUM, AhuEquationType.MIXING_ENERGY)
                .addTerm(temperature(equationSystem, StatePoint.MIXED, m * SPECIFIC_HEAT))
                .addTerm(temperature(equationSystem, StatePoint.ZONE, -recycled * SPECIFIC_HEAT));
        equationSystem.createEquation(OUTDOOR_MIXING_BOX_NUM, AhuEquationType.MIXING_MOISTURE)
                .addTerm(humidityRatio(equationSystem, StatePoint.MIXED, m * LATENT_HEAT))
                .addTerm(humidityRatio(equationSystem, StatePoint.ZONE, -recycled * LATENT_HEAT));
    }

    private void createCoolingCoilEquations(EquationSystem<AhuVariableType, AhuEquationType> equationSystem) {
        double treated = network.getFlowSplit().getTreatedFlow();
        CoolingCoil coil = network.getCoolingCoil();

        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.COIL_SENSIBLE_HEAT)
                .addTerm(temperature(equationSystem, StatePoint.MIXED, treated * SPECIFIC_HEAT))
                .addTerm(temperature(equationSystem, StatePoint.COIL_OUTLET, -treated * SPECIFIC_HEAT))
                .addTerm(heat(equationSystem, AhuVariableType.COIL_SENSIBLE_HEAT, 1));
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.COIL_LATENT_HEAT)
                .addTerm(humidityRatio(equationSystem, StatePoint.MIXED, treated * LATENT_HEAT))
                .addTerm(humidityRatio(equationSystem, StatePoint.COIL_OUTLET, -treated * LATENT_HEAT))
                .addTerm(heat(equationSystem, AhuVariableType.COIL_LATENT_HEAT, 1));
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.COIL_TOTAL_HEAT)
                .addTerm(heat(equationSystem, AhuVariableType.COIL_TOTAL_HEAT, -1))
                .addTerm(heat(equationSystem, AhuVariableType.COIL_SENSIBLE_HEAT, 1))
                .addTerm(heat(equationSystem, AhuVariableType.COIL_LATENT_HEAT, 1));

        // ws'(θs0).θs - ws = ws'(θs0).θs0 - ws(θs0), slope follows the linearization point
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.COIL_SATURATION)
                .addTerm(equationSystem.getVariable(StatePoint.COIL_OUTLET.getNum(), AhuVariableType.TEMPERATURE)
                        .<AhuEquationType>createTerm()
                        .multiply(coil::getSaturationSlope))
                .addTerm(humidityRatio(equationSystem, StatePoint.COIL_OUTLET, -1));
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.COIL_DRY)
                .addTerm(humidityRatio(equationSystem, StatePoint.COIL_OUTLET, 1))
                .addTerm(humidityRatio(equationSystem, StatePoint.MIXED, -1));
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.COIL_IDLE)
                .addTerm(temperature(equationSystem, StatePoint.COIL_OUTLET, 1))
                .addTerm(temperature(equationSystem, StatePoint.MIXED, -1));
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.COIL_MIN_TEMPERATURE)
                .addTerm(temperature(equationSystem, StatePoint.COIL_OUTLET, 1));
    }

    private void createBypassMixingBoxEquations(EquationSystem<AhuVariableType, AhuEquationType> equationSystem) {
        FlowSplit flowSplit = network.getFlowSplit();
        double m = flowSplit.getSupplyFlow();
        double bypass = flowSplit.getBypassFlow();
        double treated = flowSplit.getTreatedFlow();
        equationSystem.createEquation(BYPASS_MIXING_BOX_NUM, AhuEquationType.MIXING_ENERGY)
                .addTerm(temperature(equationSystem, StatePoint.MIXED, bypass * SPECIFIC_HEAT))
                .addTerm(temperature(equationSystem, StatePoint.COIL_OUTLET, treated * SPECIFIC_HEAT))
                .addTerm(temperature(equationSystem, StatePoint.BYPASS_MIXED, -m * SPECIFIC_HEAT));
        equationSystem.createEquation(BYPASS_MIXING_BOX_NUM, AhuEquationType.MIXING_MOISTURE)
                .addTerm(humidityRatio(equationSystem, StatePoint.MIXED, bypass * LATENT_HEAT))
                .addTerm(humidityRatio(equationSystem, StatePoint.COIL_OUTLET, treated * LATENT_HEAT))
                .addTerm(humidityRatio(equationSystem, StatePoint.BYPASS_MIXED, -m * LATENT_HEAT));
    }

    private void createHeatingCoilEquations(EquationSystem<AhuVariableType, AhuEquationType> equationSystem) {
        double m = network.getFlowSplit().getSupplyFlow();
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.HEATING_COIL_ENERGY)
                .addTerm(temperature(equationSystem, StatePoint.BYPASS_MIXED, m * SPECIFIC_HEAT))
                .addTerm(temperature(equationSystem, StatePoint.SUPPLY, -m * SPECIFIC_HEAT))
                .addTerm(heat(equationSystem, AhuVariableType.HEATING_COIL_HEAT, 1));
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.HEATING_COIL_MOISTURE)
                .addTerm(humidityRatio(equationSystem, StatePoint.BYPASS_MIXED, m * LATENT_HEAT))
                .addTerm(humidityRatio(equationSystem, StatePoint.SUPPLY, -m * LATENT_HEAT));
    }

    private void createThermalZoneEquations(EquationSystem<AhuVariableType, AhuEquationType> equationSystem) {
        double m = network.getFlowSplit().getSupplyFlow();
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.ZONE_SENSIBLE)
                .addTerm(temperature(equationSystem, StatePoint.SUPPLY, m * SPECIFIC_HEAT))
                .addTerm(temperature(equationSystem, StatePoint.ZONE, -m * SPECIFIC_HEAT))
                .addTerm(heat(equationSystem, AhuVariableType.ZONE_SENSIBLE_LOAD, 1));
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.ZONE_LATENT)
                .addTerm(humidityRatio(equationSystem, StatePoint.SUPPLY, m * LATENT_HEAT))
                .addTerm(humidityRatio(equationSystem, StatePoint.ZONE, -m * LATENT_HEAT))
                .addTerm(heat(equationSystem, AhuVariableType.ZONE_LATENT_LOAD, 1));
    }

    private void createBuildingEquations(EquationSystem<AhuVariableType, AhuEquationType> equationSystem) {
        AhuInputs inputs = network.getInputs();
        double mi = inputs.getInfiltrationMassFlow();
        // (UA + mi.c).θI + QsTZ = (UA + mi.c).θo + Qsa
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.BUILDING_SENSIBLE)
                .addTerm(temperature(equationSystem, StatePoint.ZONE, inputs.getBuildingConductance() + mi * SPECIFIC_HEAT))
                .addTerm(heat(equationSystem, AhuVariableType.ZONE_SENSIBLE_LOAD, 1));
        // mi.l.wI + QlTZ = mi.l.wo + Qla
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.BUILDING_LATENT)
                .addTerm(humidityRatio(equationSystem, StatePoint.ZONE, mi * LATENT_HEAT))
                .addTerm(heat(equationSystem, AhuVariableType.ZONE_LATENT_LOAD, 1));
    }

    private void createControllerEquations(EquationSystem<AhuVariableType, AhuEquationType> equationSystem) {
        AhuParameters parameters = network.getParameters();
        // θI + Qt / Kθ = θI,sp, exact equality for an infinite gain
        equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.TEMPERATURE_CONTROL)
                .addTerm(temperature(equationSystem, StatePoint.ZONE, 1))
                .addTerm(heat(equationSystem, AhuVariableType.COIL_TOTAL_HEAT, 1 / parameters.getTemperatureControllerGain()));
        if (parameters.isHumidityControlled()) {
            // wI - QsHC / Kw = wI,sp
            equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.HUMIDITY_CONTROL)
                    .addTerm(humidityRatio(equationSystem, StatePoint.ZONE, 1))
                    .addTerm(heat(equationSystem, AhuVariableType.HEATING_COIL_HEAT, -1 / parameters.getHumidityControllerGain()));
        } else {
            // reheating coil off
            equationSystem.createEquation(ELEMENT_NUM, AhuEquationType.HUMIDITY_CONTROL)
                    .addTerm(heat(equationSystem, AhuVariableType.HEATING_COIL_HEAT, 1));
        }
    }

    public EquationSystem<AhuVariableType, AhuEquationType> create() {
        EquationSystem<AhuVariableType, AhuEquationType> equationSystem = new EquationSystem<>();

        createOutdoorMixingBoxEquations(equationSystem);
        createCoolingCoilEquations(equationSystem);
        createBypassMixingBoxEquations(equationSystem);
        createHeatingCoilEquations(equationSystem);
        createThermalZoneEquations(equationSystem);
        createBuildingEquations(equationSystem);
        createControllerEquations(equationSystem);

        AhuEquationSystemUpdater.update(equationSystem, network);

        LOGGER.debug("Equation system created with {} equations ({} active)", equationSystem.getEquations().size(),
                equationSystem.getIndex().getColumnCount());

        return equationSystem;
    }
}
