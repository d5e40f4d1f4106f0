/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.network;

import com.powsybl.openahu.InvalidParameterException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open AHU developers
 */
class AhuParametersTest {

    @Test
    void testDefault() {
        AhuParameters parameters = AhuParameters.createDefault();
        assertEquals(3.5, parameters.getSupplyMassFlow(), 0);
        assertEquals(1, parameters.getOutdoorMassFlow(), 0);
        assertEquals(0.1, parameters.getBypassFraction(), 0);
        assertEquals(1e10, parameters.getTemperatureControllerGain(), 0);
        assertEquals(0, parameters.getHumidityControllerGain(), 0);
        assertEquals(0, parameters.getCoilMinOutletTemperature(), 0);
        assertFalse(parameters.isHumidityControlled());
    }

    @Test
    void testWith() {
        AhuParameters parameters = AhuParameters.createDefault();
        AhuParameters other = parameters.withBypassFraction(0.5).withHumidityControllerGain(1e8);
        assertNotSame(parameters, other);
        assertEquals(0.1, parameters.getBypassFraction(), 0);
        assertEquals(0.5, other.getBypassFraction(), 0);
        assertTrue(other.isHumidityControlled());
        assertEquals(parameters, other.withBypassFraction(0.1).withHumidityControllerGain(0));
        assertEquals(parameters.hashCode(), other.withBypassFraction(0.1).withHumidityControllerGain(0).hashCode());
        assertEquals(Double.POSITIVE_INFINITY, parameters.withTemperatureControllerGain(Double.POSITIVE_INFINITY).getTemperatureControllerGain());
    }

    @Test
    void testValidation() {
        AhuParameters parameters = AhuParameters.createDefault();
        assertThrows(InvalidParameterException.class, () -> parameters.withBypassFraction(-0.01));
        assertThrows(InvalidParameterException.class, () -> parameters.withBypassFraction(1.01));
        assertThrows(InvalidParameterException.class, () -> parameters.withBypassFraction(Double.NaN));
        assertThrows(InvalidParameterException.class, () -> parameters.withOutdoorMassFlow(-1));
        assertThrows(InvalidParameterException.class, () -> parameters.withSupplyMassFlow(0));
        assertThrows(InvalidParameterException.class, () -> parameters.withSupplyMassFlow(0.5));
        assertThrows(InvalidParameterException.class, () -> parameters.withTemperatureControllerGain(0));
        assertThrows(InvalidParameterException.class, () -> parameters.withTemperatureControllerGain(-1e10));
        assertThrows(InvalidParameterException.class, () -> parameters.withHumidityControllerGain(-1));
        assertThrows(InvalidParameterException.class, () -> parameters.withCoilMinOutletTemperature(60));
        InvalidParameterException e = assertThrows(InvalidParameterException.class, () -> new AhuParameters(3.5, 4, 0.1, 1e10, 0));
        assertEquals("Supply mass flow 3.5 is lower than outdoor mass flow 4.0", e.getMessage());
    }
}
