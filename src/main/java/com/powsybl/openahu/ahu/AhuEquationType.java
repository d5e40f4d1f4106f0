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
public enum AhuEquationType implements Quantity {
    MIXING_ENERGY("mx_energy", ElementType.MIXING_BOX),
    MIXING_MOISTURE("mx_moisture", ElementType.MIXING_BOX),
    COIL_SENSIBLE_HEAT("cc_sensible", ElementType.COOLING_COIL),
    COIL_LATENT_HEAT("cc_latent", ElementType.COOLING_COIL),
    COIL_TOTAL_HEAT("cc_total", ElementType.COOLING_COIL), // total = sensible + latent
    COIL_SATURATION("cc_saturation", ElementType.COOLING_COIL), // wet coil, linearized saturation curve
    COIL_DRY("cc_dry", ElementType.COOLING_COIL), // no condensation
    COIL_IDLE("cc_idle", ElementType.COOLING_COIL), // idle or switched off, outlet temperature = inlet temperature
    COIL_MIN_TEMPERATURE("cc_min_θ", ElementType.COOLING_COIL), // capacity limit
    HEATING_COIL_ENERGY("hc_energy", ElementType.HEATING_COIL),
    HEATING_COIL_MOISTURE("hc_moisture", ElementType.HEATING_COIL),
    ZONE_SENSIBLE("tz_sensible", ElementType.THERMAL_ZONE),
    ZONE_LATENT("tz_latent", ElementType.THERMAL_ZONE),
    BUILDING_SENSIBLE("bl_sensible", ElementType.BUILDING),
    BUILDING_LATENT("bl_latent", ElementType.BUILDING),
    TEMPERATURE_CONTROL("k_θ", ElementType.CONTROLLER),
    HUMIDITY_CONTROL("k_w", ElementType.CONTROLLER);

    private final String symbol;

    private final ElementType elementType;

    AhuEquationType(String symbol, ElementType elementType) {
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
