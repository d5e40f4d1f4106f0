/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.equations;

import com.powsybl.openahu.network.ElementType;

/**
 * @author Open AHU developers
 */
enum SimpleEquationType implements Quantity {
    BALANCE("b"),
    CONTROL("ctl");

    private final String symbol;

    SimpleEquationType(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }

    @Override
    public ElementType getElementType() {
        return ElementType.MIXING_BOX;
    }
}
