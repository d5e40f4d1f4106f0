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
import com.powsybl.openahu.equations.TargetVector;
import com.powsybl.openahu.network.AhuInputs;
import com.powsybl.openahu.network.AhuNetwork;
import com.powsybl.openahu.network.CoolingCoil;

import java.util.Objects;

import static com.powsybl.openahu.psychro.AirProperties.LATENT_HEAT;
import static com.powsybl.openahu.psychro.AirProperties.SPECIFIC_HEAT;

/**
 * @author Open AHU developers
 */
public final class AhuTargetVector {

    private AhuTargetVector() {
    }

    public static void init(Equation<AhuVariableType, AhuEquationType> equation, AhuNetwork network, double[] targets) {
        AhuInputs inputs = network.getInputs();
        double outdoorFlow = network.getFlowSplit().getOutdoorFlow();
        double target;
        switch (equation.getType()) {
            case MIXING_ENERGY:
                target = equation.getElementNum() == AhuEquationSystemCreator.OUTDOOR_MIXING_BOX_NUM
                        ? outdoorFlow * SPECIFIC_HEAT * inputs.getOutdoorTemperature()
                        : 0;
                break;

            case MIXING_MOISTURE:
                target = equation.getElementNum() == AhuEquationSystemCreator.OUTDOOR_MIXING_BOX_NUM
                        ? outdoorFlow * LATENT_HEAT * network.getOutdoorHumidityRatio()
                        : 0;
                break;

            case COIL_SATURATION:
                CoolingCoil coil = network.getCoolingCoil();
                target = coil.getSaturationSlope() * coil.getSaturationTemperature() - coil.getSaturationHumidityRatio();
                break;

            case COIL_MIN_TEMPERATURE:
                target = network.getCoolingCoil().getMinOutletTemperature();
                break;

            case BUILDING_SENSIBLE:
                target = (inputs.getBuildingConductance() + inputs.getInfiltrationMassFlow() * SPECIFIC_HEAT) * inputs.getOutdoorTemperature()
                        + inputs.getAuxiliarySensibleLoad();
                break;

            case BUILDING_LATENT:
                target = inputs.getInfiltrationMassFlow() * LATENT_HEAT * network.getOutdoorHumidityRatio()
                        + inputs.getAuxiliaryLatentLoad();
                break;

            case TEMPERATURE_CONTROL:
                target = inputs.getZoneTemperatureSetpoint();
                break;

            case HUMIDITY_CONTROL:
                target = network.getParameters().isHumidityControlled() ? network.getZoneHumidityRatioSetpoint() : 0;
                break;

            case COIL_SENSIBLE_HEAT,
                 COIL_LATENT_HEAT,
                 COIL_TOTAL_HEAT,
                 COIL_DRY,
                 COIL_IDLE,
                 HEATING_COIL_ENERGY,
                 HEATING_COIL_MOISTURE,
                 ZONE_SENSIBLE,
                 ZONE_LATENT:
                target = 0;
                break;

            default:
                throw new IllegalStateException("Unknown equation type: " + equation.getType());
        }
        targets[equation.getColumn()] = target;
    }

    public static double[] createArray(EquationSystem<AhuVariableType, AhuEquationType> equationSystem, AhuNetwork network) {
        Objects.requireNonNull(network);
        return TargetVector.createArray(equationSystem, (equation, targets) -> init(equation, network, targets));
    }
}
