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
public enum ElementType {
    STATE_POINT,
    MIXING_BOX,
    COOLING_COIL,
    HEATING_COIL,
    THERMAL_ZONE,
    BUILDING,
    CONTROLLER
}
