/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.psychro;

/**
 * Moist air property provider. Temperatures are in °C, relative humidities in [0, 1] and humidity ratios in kg of
 * water vapor per kg of dry air. Implementations are stateless and thread safe.
 *
 * @author Open AHU developers
 */
public interface PsychrometricProperties {

    double humidityRatio(double temperature, double relativeHumidity);

    default double saturationHumidityRatio(double temperature) {
        return humidityRatio(temperature, 1);
    }

    /**
     * Derivative of the saturation humidity ratio with respect to temperature, in kg/(kg.K).
     */
    double saturationHumidityRatioDerivative(double temperature);

    double relativeHumidity(double temperature, double humidityRatio);

    /**
     * Specific enthalpy in J per kg of dry air, with 0 °C dry air and liquid water as reference.
     */
    default double enthalpy(double temperature, double humidityRatio) {
        return AirProperties.SPECIFIC_HEAT * temperature + AirProperties.LATENT_HEAT * humidityRatio;
    }
}
