/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu.outerloop;

import com.powsybl.openahu.network.AhuNetwork;

import java.util.Objects;

/**
 * @author Open AHU developers
 */
public class AhuOuterLoopContext {

    private final AhuNetwork network;

    private int iteration = 0;

    public AhuOuterLoopContext(AhuNetwork network) {
        this.network = Objects.requireNonNull(network);
    }

    public AhuNetwork getNetwork() {
        return network;
    }

    public int getIteration() {
        return iteration;
    }

    public void setIteration(int iteration) {
        this.iteration = iteration;
    }
}
