/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu;

/**
 * Moist air state at a state point. Relative humidity is derived from the two others.
 *
 * @author Open AHU developers
 */
public record AirState(double temperature, double humidityRatio, double relativeHumidity) {
}
