/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.inverse;

import com.powsybl.openahu.ahu.AhuSolverResult;
import com.powsybl.openahu.network.StatePoint;

import java.util.function.ToDoubleFunction;

/**
 * Solved quantity the root finder drives to a target value.
 *
 * @author Open AHU developers
 */
public enum ControlledOutput {
    SUPPLY_TEMPERATURE(result -> result.getState(StatePoint.SUPPLY).temperature(), false),
    ZONE_TEMPERATURE(result -> result.getState(StatePoint.ZONE).temperature(), false),
    ZONE_HUMIDITY_RATIO(result -> result.getState(StatePoint.ZONE).humidityRatio(), true),
    ZONE_RELATIVE_HUMIDITY(result -> result.getState(StatePoint.ZONE).relativeHumidity(), true),
    COIL_TOTAL_HEAT(AhuSolverResult::getCoilTotalHeat, false);

    private final ToDoubleFunction<AhuSolverResult> extractor;

    private final boolean humidity;

    ControlledOutput(ToDoubleFunction<AhuSolverResult> extractor, boolean humidity) {
        this.extractor = extractor;
        this.humidity = humidity;
    }

    public double getValue(AhuSolverResult result) {
        return extractor.applyAsDouble(result);
    }

    /**
     * Humidity targets are reached by the design parameter alone, the humidity controller is switched off.
     */
    public boolean isHumidity() {
        return humidity;
    }
}
