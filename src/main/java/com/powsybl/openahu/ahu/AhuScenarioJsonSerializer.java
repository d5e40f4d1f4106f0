/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * @author Open AHU developers
 */
public class AhuScenarioJsonSerializer extends StdSerializer<AhuScenario> {

    public AhuScenarioJsonSerializer() {
        super(AhuScenario.class);
    }

    @Override
    public void serialize(AhuScenario scenario, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        AhuScenario.writeJson(jsonGenerator, scenario);
    }
}
