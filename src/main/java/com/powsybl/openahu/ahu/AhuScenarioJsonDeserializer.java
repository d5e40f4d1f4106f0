/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * @author Open AHU developers
 */
public class AhuScenarioJsonDeserializer extends StdDeserializer<AhuScenario> {

    public AhuScenarioJsonDeserializer() {
        super(AhuScenario.class);
    }

    @Override
    public AhuScenario deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        return AhuScenario.parseJson(jsonParser);
    }
}
