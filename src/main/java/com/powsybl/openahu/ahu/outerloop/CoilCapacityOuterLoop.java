/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu.outerloop;

import com.powsybl.openahu.network.AhuNetwork;
import com.powsybl.openahu.network.CoilHumidityMode;
import com.powsybl.openahu.network.CoilTemperatureMode;
import com.powsybl.openahu.network.CoolingCoil;
import com.powsybl.openahu.network.StatePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Switches the coil from controlled to capacity limited when the temperature controller would need an outlet colder
 * than the coil minimum outlet temperature, and back to controlled when the zone ends up colder than its set point.
 * <p>
 * A cooling coil cannot heat: when the controller would need an outlet warmer than the inlet, the coil is switched
 * off, and back to controlled when the zone ends up warmer than its set point.
 * <p>
 * Switching back is limited to a maximum count to prevent oscillations.
 *
 * @author Open AHU developers
 */
public class CoilCapacityOuterLoop implements AhuOuterLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(CoilCapacityOuterLoop.class);

    public static final String NAME = "CoilCapacity";

    public static final int MAX_CONTROLLER_SWITCH_DEFAULT_VALUE = 2;

    private static final double TEMPERATURE_EPS = 1e-6;

    private final int maxControllerSwitch;

    public CoilCapacityOuterLoop() {
        this(MAX_CONTROLLER_SWITCH_DEFAULT_VALUE);
    }

    public CoilCapacityOuterLoop(int maxControllerSwitch) {
        if (maxControllerSwitch < 0) {
            throw new IllegalArgumentException("Invalid max controller switch count: " + maxControllerSwitch);
        }
        this.maxControllerSwitch = maxControllerSwitch;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public OuterLoopResult check(AhuOuterLoopContext context) {
        AhuNetwork network = context.getNetwork();
        CoolingCoil coil = network.getCoolingCoil();
        switch (coil.getTemperatureMode()) {
            case CONTROLLED:
                double outletTemperature = network.getTemperature(StatePoint.COIL_OUTLET);
                if (outletTemperature < coil.getMinOutletTemperature() - TEMPERATURE_EPS) {
                    LOGGER.warn("Coil outlet temperature {} °C below coil minimum {} °C: coil is capacity limited",
                            outletTemperature, coil.getMinOutletTemperature());
                    coil.setTemperatureMode(CoilTemperatureMode.CAPACITY_LIMITED);
                    return new OuterLoopResult(this, OuterLoopStatus.UNSTABLE, "Controlled to capacity limited");
                }
                double inletTemperature = network.getTemperature(StatePoint.MIXED);
                if (outletTemperature > inletTemperature + TEMPERATURE_EPS) {
                    LOGGER.debug("Coil outlet temperature {} °C above inlet temperature {} °C: coil is switched off",
                            outletTemperature, inletTemperature);
                    coil.setHumidityMode(CoilHumidityMode.DRY);
                    coil.setTemperatureMode(CoilTemperatureMode.SWITCHED_OFF);
                    return new OuterLoopResult(this, OuterLoopStatus.UNSTABLE, "Controlled to switched off");
                }
                break;

            case CAPACITY_LIMITED:
                double zoneTemperature = network.getTemperature(StatePoint.ZONE);
                double setpoint = network.getInputs().getZoneTemperatureSetpoint();
                if (zoneTemperature < setpoint - TEMPERATURE_EPS) {
                    if (coil.getControllerSwitchCount() < maxControllerSwitch) {
                        LOGGER.debug("Zone over-cooled ({} °C < {} °C): temperature controller is enabled again",
                                zoneTemperature, setpoint);
                        coil.setTemperatureMode(CoilTemperatureMode.CONTROLLED);
                        coil.incrementControllerSwitchCount();
                        return new OuterLoopResult(this, OuterLoopStatus.UNSTABLE, "Capacity limited to controlled");
                    }
                    LOGGER.warn("Zone over-cooled ({} °C < {} °C) but temperature controller switched back {} times already",
                            zoneTemperature, setpoint, coil.getControllerSwitchCount());
                }
                break;

            case SWITCHED_OFF:
                double warmZoneTemperature = network.getTemperature(StatePoint.ZONE);
                double warmSetpoint = network.getInputs().getZoneTemperatureSetpoint();
                if (warmZoneTemperature > warmSetpoint + TEMPERATURE_EPS) {
                    if (coil.getControllerSwitchCount() < maxControllerSwitch) {
                        LOGGER.debug("Zone too warm ({} °C > {} °C): coil is switched on again", warmZoneTemperature, warmSetpoint);
                        coil.setTemperatureMode(CoilTemperatureMode.CONTROLLED);
                        coil.incrementControllerSwitchCount();
                        return new OuterLoopResult(this, OuterLoopStatus.UNSTABLE, "Switched off to controlled");
                    }
                    LOGGER.warn("Zone too warm ({} °C > {} °C) but coil switched back {} times already",
                            warmZoneTemperature, warmSetpoint, coil.getControllerSwitchCount());
                }
                break;

            case IDLE:
                break;

            default:
                throw new IllegalStateException("Unknown coil temperature mode: " + coil.getTemperatureMode());
        }
        return new OuterLoopResult(this, OuterLoopStatus.STABLE);
    }
}
