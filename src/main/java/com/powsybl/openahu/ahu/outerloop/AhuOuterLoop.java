/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu.outerloop;

/**
 * A check run on a solved state that may change the coil operating modes. When a check returns
 * {@link OuterLoopStatus#UNSTABLE}, the equation system is updated and solved again.
 *
 * @author Open AHU developers
 */
public interface AhuOuterLoop {

    String getName();

    default void initialize(AhuOuterLoopContext context) {
    }

    OuterLoopResult check(AhuOuterLoopContext context);
}
