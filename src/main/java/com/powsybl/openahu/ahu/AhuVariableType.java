/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu;

import com.powsybl.openahu.equations.Quantity;
import com.powsybl.openahu.network.ElementType;

/**
 * @author Open AHU developers
 */
public enum AhuVariableType implements Quantity {
    TEMPERATURE("θ", ElementType.STATE_POINT), // dry bulb temperature (°C)
    HUMIDITY_RATIO("w", ElementType.STATE_POINT), // kg water / kg dry air
    COIL_TOTAL_HEAT("Qt", ElementType.COOLING_COIL), // W, negative when cooling
    COIL_SENSIBLE_HEAT("Qs", ElementType.COOLING_COIL),
    COIL_LATENT_HEAT("Ql", ElementType.COOLING_COIL),
    HEATING_COIL_HEAT("QsHC", ElementType.HEATING_COIL),
    ZONE_SENSIBLE_LOAD("QsTZ", ElementType.THERMAL_ZONE),
    ZONE_LATENT_LOAD("QlTZ", ElementType.THERMAL_ZONE);

    private final String symbol;

    private final ElementType elementType;

    AhuVariableType(String symbol, ElementType elementType) {
        this.symbol = symbol;
        this.elementType = elementType;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }

    @Override
    public ElementType getElementType() {
        return elementType;
    }
}
