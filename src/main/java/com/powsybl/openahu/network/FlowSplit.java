/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.network;

import java.util.Objects;

/**
 * Partition of the supply dry air mass flow between the mixing nodes, in kg/s.
 *
 * @author Open AHU developers
 */
public final class FlowSplit {

    private final double supplyFlow;

    private final double outdoorFlow;

    private final double bypassFlow;

    private FlowSplit(double supplyFlow, double outdoorFlow, double bypassFlow) {
        this.supplyFlow = supplyFlow;
        this.outdoorFlow = outdoorFlow;
        this.bypassFlow = bypassFlow;
    }

    public static FlowSplit of(AhuParameters parameters) {
        Objects.requireNonNull(parameters);
        return new FlowSplit(parameters.getSupplyMassFlow(),
                             parameters.getOutdoorMassFlow(),
                             parameters.getBypassFraction() * parameters.getSupplyMassFlow());
    }

    public double getSupplyFlow() {
        return supplyFlow;
    }

    public double getOutdoorFlow() {
        return outdoorFlow;
    }

    public double getRecycledFlow() {
        return supplyFlow - outdoorFlow;
    }

    public double getBypassFlow() {
        return bypassFlow;
    }

    public double getTreatedFlow() {
        return supplyFlow - bypassFlow;
    }

    @Override
    public String toString() {
        return "FlowSplit(supply=" + supplyFlow
                + ", outdoor=" + outdoorFlow
                + ", recycled=" + getRecycledFlow()
                + ", bypass=" + bypassFlow
                + ", treated=" + getTreatedFlow()
                + ")";
    }
}
