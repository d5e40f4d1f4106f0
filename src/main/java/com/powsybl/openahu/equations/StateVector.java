/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.equations;

import java.util.Objects;

/**
 * @author Open AHU developers
 */
public class StateVector {

    private double[] array;

    public StateVector() {
        this(null);
    }

    public StateVector(double[] array) {
        this.array = array;
    }

    public void set(double[] array) {
        this.array = Objects.requireNonNull(array);
    }

    public double[] get() {
        return array;
    }

    public double get(int variableNum) {
        return array[variableNum];
    }
}
