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
class AhuInputsTest {

    @Test
    void testDefault() {
        AhuInputs inputs = AhuInputs.createDefault();
        assertEquals(32, inputs.getOutdoorTemperature(), 0);
        assertEquals(0.5, inputs.getOutdoorRelativeHumidity(), 0);
        assertEquals(24, inputs.getZoneTemperatureSetpoint(), 0);
        assertEquals(0.6, inputs.getZoneRelativeHumiditySetpoint(), 0);
        assertEquals(0.7, inputs.getInfiltrationMassFlow(), 0);
        assertEquals(675, inputs.getBuildingConductance(), 0);
        assertEquals(17000, inputs.getAuxiliarySensibleLoad(), 0);
        assertEquals(2000, inputs.getAuxiliaryLatentLoad(), 0);
    }

    @Test
    void testBuilder() {
        AhuInputs inputs = AhuInputs.builder()
                .setOutdoorTemperature(35)
                .setAuxiliaryLatentLoad(0)
                .build();
        assertEquals(35, inputs.getOutdoorTemperature(), 0);
        assertEquals(0, inputs.getAuxiliaryLatentLoad(), 0);
        assertEquals(AhuInputs.DEFAULT_BUILDING_CONDUCTANCE, inputs.getBuildingConductance(), 0);

        AhuInputs copy = inputs.toBuilder().build();
        assertEquals(inputs, copy);
        assertEquals(inputs.hashCode(), copy.hashCode());
        assertEquals(AhuInputs.createDefault(), inputs.withOutdoorTemperature(32).toBuilder().setAuxiliaryLatentLoad(2000).build());
    }

    @Test
    void testValidation() {
        AhuInputs inputs = AhuInputs.createDefault();
        assertThrows(InvalidParameterException.class, () -> inputs.withOutdoorRelativeHumidity(1.5));
        assertThrows(InvalidParameterException.class, () -> inputs.withZoneRelativeHumiditySetpoint(-0.1));
        assertThrows(InvalidParameterException.class, () -> inputs.withOutdoorTemperature(Double.NaN));
        assertThrows(InvalidParameterException.class, () -> inputs.withAuxiliarySensibleLoad(Double.POSITIVE_INFINITY));
        AhuInputs.Builder builder = inputs.toBuilder().setInfiltrationMassFlow(-0.1);
        assertThrows(InvalidParameterException.class, builder::build);
        assertThrows(InvalidParameterException.class, () -> inputs.toBuilder().setBuildingConductance(-1).build());
    }
}
