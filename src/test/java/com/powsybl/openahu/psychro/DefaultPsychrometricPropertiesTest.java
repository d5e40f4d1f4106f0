/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.psychro;

import com.powsybl.openahu.InvalidParameterException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open AHU developers
 */
class DefaultPsychrometricPropertiesTest {

    private final DefaultPsychrometricProperties psychro = new DefaultPsychrometricProperties();

    @Test
    void testSaturationPressure() {
        assertEquals(2.98335, psychro.saturationPressure(24), 1e-5);
        assertThrows(InvalidParameterException.class, () -> psychro.saturationPressure(-235));
        assertThrows(InvalidParameterException.class, () -> psychro.saturationPressure(Double.NaN));
    }

    @Test
    void testHumidityRatio() {
        assertEquals(0.0149467, psychro.humidityRatio(32, 0.5), 1e-7);
        assertEquals(0.0111859, psychro.humidityRatio(24, 0.6), 1e-7);
        assertEquals(0.0076191, psychro.saturationHumidityRatio(10), 1e-7);
        assertEquals(0, psychro.humidityRatio(30, 0), 0);
        assertThrows(InvalidParameterException.class, () -> psychro.humidityRatio(24, 1.1));
        assertThrows(InvalidParameterException.class, () -> psychro.humidityRatio(24, -0.1));
        // boiling point exceeded
        assertThrows(InvalidParameterException.class, () -> psychro.saturationHumidityRatio(101));
    }

    @Test
    void testRelativeHumidity() {
        double w = psychro.humidityRatio(24, 0.6);
        assertEquals(0.6, psychro.relativeHumidity(24, w), 1e-12);
        assertEquals(0, psychro.relativeHumidity(24, 0), 0);
        assertThrows(InvalidParameterException.class, () -> psychro.relativeHumidity(24, -1e-3));
    }

    @Test
    void testSaturationHumidityRatioDerivative() {
        double h = 1e-4;
        for (double t : new double[] {0, 10, 25, 40}) {
            double numerical = (psychro.saturationHumidityRatio(t + h) - psychro.saturationHumidityRatio(t - h)) / (2 * h);
            assertEquals(numerical, psychro.saturationHumidityRatioDerivative(t), 1e-9);
        }
    }

    @Test
    void testEnthalpy() {
        assertEquals(24000 + 2496e3 * 0.01, psychro.enthalpy(24, 0.01), 1e-9);
    }

    @Test
    void testPressure() {
        assertEquals(AirProperties.ATMOSPHERIC_PRESSURE, psychro.getPressure(), 0);
        DefaultPsychrometricProperties altitude = new DefaultPsychrometricProperties(90);
        assertTrue(altitude.humidityRatio(24, 0.6) > psychro.humidityRatio(24, 0.6));
        assertThrows(InvalidParameterException.class, () -> new DefaultPsychrometricProperties(0));
    }
}
