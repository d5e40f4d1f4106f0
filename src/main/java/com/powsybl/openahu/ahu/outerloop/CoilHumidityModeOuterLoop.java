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
 * A saturated outlet cannot be wetter than the coil inlet: the coil is then dry. A dry coil whose outlet is colder
 * than the inlet dew point condenses: the coil is then wet.
 *
 * @author Open AHU developers
 */
public class CoilHumidityModeOuterLoop implements AhuOuterLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(CoilHumidityModeOuterLoop.class);

    public static final String NAME = "CoilHumidityMode";

    private static final double HUMIDITY_RATIO_EPS = 1e-9;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public OuterLoopResult check(AhuOuterLoopContext context) {
        AhuNetwork network = context.getNetwork();
        CoolingCoil coil = network.getCoolingCoil();
        if (coil.isIdle() || coil.getTemperatureMode() == CoilTemperatureMode.SWITCHED_OFF) {
            return new OuterLoopResult(this, OuterLoopStatus.STABLE);
        }
        double outletTemperature = network.getTemperature(StatePoint.COIL_OUTLET);
        if (coil.getTemperatureMode() == CoilTemperatureMode.CONTROLLED && outletTemperature < coil.getMinOutletTemperature()) {
            // not a physical state, the capacity outer loop has to run first
            return new OuterLoopResult(this, OuterLoopStatus.STABLE);
        }
        double inletHumidityRatio = network.getHumidityRatio(StatePoint.MIXED);
        double outletHumidityRatio = network.getHumidityRatio(StatePoint.COIL_OUTLET);
        if (coil.getHumidityMode() == CoilHumidityMode.WET) {
            if (outletHumidityRatio > inletHumidityRatio + HUMIDITY_RATIO_EPS) {
                LOGGER.debug("Saturated coil outlet {} wetter than inlet {}: switch coil to dry", outletHumidityRatio, inletHumidityRatio);
                coil.setHumidityMode(CoilHumidityMode.DRY);
                return new OuterLoopResult(this, OuterLoopStatus.UNSTABLE, "Wet to dry");
            }
        } else {
            double saturationHumidityRatio = network.getPsychrometricProperties().saturationHumidityRatio(outletTemperature);
            if (saturationHumidityRatio < inletHumidityRatio - HUMIDITY_RATIO_EPS) {
                LOGGER.debug("Dry coil outlet at {} °C below inlet dew point: switch coil to wet", outletTemperature);
                coil.setHumidityMode(CoilHumidityMode.WET);
                coil.setSaturationTemperature(outletTemperature);
                return new OuterLoopResult(this, OuterLoopStatus.UNSTABLE, "Dry to wet");
            }
        }
        return new OuterLoopResult(this, OuterLoopStatus.STABLE);
    }
}
