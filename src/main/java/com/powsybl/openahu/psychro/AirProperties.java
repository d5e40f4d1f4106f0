/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.psychro;

/**
 * @author Open AHU developers
 */
public final class AirProperties {

    /**
     * Dry air specific heat in J/(kg.K).
     */
    public static final double SPECIFIC_HEAT = 1e3;

    /**
     * Latent heat of vaporization of water in J/kg.
     */
    public static final double LATENT_HEAT = 2496e3;

    /**
     * Standard atmospheric pressure in kPa.
     */
    public static final double ATMOSPHERIC_PRESSURE = 101.325;

    /**
     * Ratio of the molar masses of water vapor and dry air.
     */
    public static final double MOLAR_MASS_RATIO = 0.622;

    private AirProperties() {
    }
}
