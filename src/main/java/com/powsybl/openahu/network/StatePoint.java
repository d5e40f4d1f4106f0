/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.network;

/**
 * Positions of the air state along the unit: outdoor, after the outdoor/recycle mixing box, at the cooling coil
 * outlet, after the bypass mixing box, at the supply after the reheating coil and in the zone (also the return air).
 *
 * @author Open AHU developers
 */
public enum StatePoint {
    OUTDOOR(0, "o"),
    MIXED(1, "M"),
    COIL_OUTLET(2, "s"),
    BYPASS_MIXED(3, "C"),
    SUPPLY(4, "S"),
    ZONE(5, "I");

    private final int num;

    private final String label;

    StatePoint(int num, String label) {
        this.num = num;
        this.label = label;
    }

    public int getNum() {
        return num;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Outdoor state is an input, all the other points are unknowns of the equation system.
     */
    public boolean isUnknown() {
        return this != OUTDOOR;
    }
}
