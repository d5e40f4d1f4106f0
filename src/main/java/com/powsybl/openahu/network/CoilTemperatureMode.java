/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.network;

/**
 * @author Open AHU developers
 */
public enum CoilTemperatureMode {
    /**
     * Coil duty is driven by the zone temperature controller.
     */
    CONTROLLED,
    /**
     * Coil outlet is held at its minimum temperature, the zone temperature floats.
     */
    CAPACITY_LIMITED,
    /**
     * Coil switched off because the temperature controller would need it to heat the air: outlet equals inlet and the
     * zone temperature floats. The coil is dry.
     */
    SWITCHED_OFF,
    /**
     * No air goes through the coil.
     */
    IDLE
}
