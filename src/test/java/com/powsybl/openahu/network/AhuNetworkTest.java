/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.network;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openahu.psychro.DefaultPsychrometricProperties;
import com.powsybl.openahu.psychro.PsychrometricProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open AHU developers
 */
class AhuNetworkTest {

    private final PsychrometricProperties psychro = new DefaultPsychrometricProperties();

    @Test
    void testCreate() {
        AhuNetwork network = new AhuNetwork(AhuParameters.createDefault(), AhuInputs.createDefault(), psychro, 5);
        assertEquals(32, network.getTemperature(StatePoint.OUTDOOR), 0);
        assertEquals(0.0149467, network.getOutdoorHumidityRatio(), 1e-7);
        assertEquals(network.getOutdoorHumidityRatio(), network.getHumidityRatio(StatePoint.OUTDOOR), 0);
        assertEquals(0.0111859, network.getZoneHumidityRatioSetpoint(), 1e-7);
        for (StatePoint point : StatePoint.values()) {
            assertEquals(point != StatePoint.OUTDOOR, point.isUnknown());
            if (point.isUnknown()) {
                assertTrue(Double.isNaN(network.getTemperature(point)));
            }
        }
        assertTrue(Double.isNaN(network.getCoilTotalHeat()));

        CoolingCoil coil = network.getCoolingCoil();
        assertFalse(coil.isIdle());
        assertEquals(CoilHumidityMode.WET, coil.getHumidityMode());
        assertEquals(CoilTemperatureMode.CONTROLLED, coil.getTemperatureMode());
        assertEquals(5, coil.getSaturationTemperature(), 0);
        assertEquals(psychro.saturationHumidityRatio(5), coil.getSaturationHumidityRatio(), 0);
    }

    @Test
    void testOutdoorIsFixed() {
        AhuNetwork network = new AhuNetwork(AhuParameters.createDefault(), AhuInputs.createDefault(), psychro, 5);
        network.setTemperature(StatePoint.SUPPLY, 16);
        assertEquals(16, network.getTemperature(StatePoint.SUPPLY), 0);
        assertThrows(IllegalArgumentException.class, () -> network.setTemperature(StatePoint.OUTDOOR, 30));
        assertThrows(IllegalArgumentException.class, () -> network.setHumidityRatio(StatePoint.OUTDOOR, 0.01));
    }

    @Test
    void testIdleCoil() {
        AhuNetwork network = new AhuNetwork(AhuParameters.createDefault().withBypassFraction(1), AhuInputs.createDefault(), psychro, 5);
        CoolingCoil coil = network.getCoolingCoil();
        assertTrue(coil.isIdle());
        assertEquals(CoilHumidityMode.DRY, coil.getHumidityMode());
        assertEquals(CoilTemperatureMode.IDLE, coil.getTemperatureMode());
        assertThrows(PowsyblException.class, () -> coil.setHumidityMode(CoilHumidityMode.WET));
        assertThrows(PowsyblException.class, () -> coil.setTemperatureMode(CoilTemperatureMode.CONTROLLED));
    }

    @Test
    void testActiveCoilModes() {
        CoolingCoil coil = new CoolingCoil(psychro, 0, false, 10);
        assertThrows(PowsyblException.class, () -> coil.setTemperatureMode(CoilTemperatureMode.IDLE));
        coil.setTemperatureMode(CoilTemperatureMode.CAPACITY_LIMITED);
        coil.setHumidityMode(CoilHumidityMode.DRY);
        assertEquals(CoilTemperatureMode.CAPACITY_LIMITED, coil.getTemperatureMode());
        assertEquals(CoilHumidityMode.DRY, coil.getHumidityMode());
        coil.incrementControllerSwitchCount();
        assertEquals(1, coil.getControllerSwitchCount());
        coil.setSaturationTemperature(12);
        assertEquals(psychro.saturationHumidityRatioDerivative(12), coil.getSaturationSlope(), 0);
    }
}
