/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu.outerloop;

/**
 * @author Open AHU developers
 */
public record OuterLoopResult(String outerLoopName, OuterLoopStatus status, String statusText) {

    public OuterLoopResult(AhuOuterLoop outerLoop, OuterLoopStatus status) {
        this(outerLoop, status, status.name());
    }

    public OuterLoopResult(AhuOuterLoop outerLoop, OuterLoopStatus status, String statusText) {
        this(outerLoop.getName(), status, statusText);
    }
}
