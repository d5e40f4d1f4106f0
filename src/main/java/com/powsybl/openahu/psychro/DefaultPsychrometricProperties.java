/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.psychro;

import com.powsybl.openahu.InvalidParameterException;
import net.jafama.FastMath;

/**
 * Ideal gas moist air with the saturation pressure correlation
 * {@code ps = exp(16.6536 - 4030.183 / (T + 235))} kPa, valid between 0 and 100 °C.
 *
 * @author Open AHU developers
 */
public class DefaultPsychrometricProperties implements PsychrometricProperties {

    private static final double A = 16.6536;

    private static final double B = 4030.183;

    private static final double C = 235;

    private final double pressure;

    public DefaultPsychrometricProperties() {
        this(AirProperties.ATMOSPHERIC_PRESSURE);
    }

    public DefaultPsychrometricProperties(double pressure) {
        if (pressure <= 0 || !Double.isFinite(pressure)) {
            throw new InvalidParameterException("Invalid atmospheric pressure: " + pressure);
        }
        this.pressure = pressure;
    }

    public double getPressure() {
        return pressure;
    }

    /**
     * Saturation vapor pressure in kPa.
     */
    public double saturationPressure(double temperature) {
        if (!Double.isFinite(temperature) || temperature <= -C) {
            throw new InvalidParameterException("Temperature out of range: " + temperature);
        }
        return FastMath.exp(A - B / (temperature + C));
    }

    private double checkedSaturationPressure(double temperature) {
        double ps = saturationPressure(temperature);
        if (ps >= pressure) {
            throw new InvalidParameterException("Saturation pressure at " + temperature + " °C exceeds atmospheric pressure");
        }
        return ps;
    }

    @Override
    public double humidityRatio(double temperature, double relativeHumidity) {
        if (relativeHumidity < 0 || relativeHumidity > 1 || Double.isNaN(relativeHumidity)) {
            throw new InvalidParameterException("Relative humidity out of [0, 1]: " + relativeHumidity);
        }
        double pv = relativeHumidity * checkedSaturationPressure(temperature);
        return AirProperties.MOLAR_MASS_RATIO * pv / (pressure - pv);
    }

    @Override
    public double saturationHumidityRatioDerivative(double temperature) {
        double ps = checkedSaturationPressure(temperature);
        double dps = ps * B / ((temperature + C) * (temperature + C));
        return AirProperties.MOLAR_MASS_RATIO * pressure * dps / ((pressure - ps) * (pressure - ps));
    }

    @Override
    public double relativeHumidity(double temperature, double humidityRatio) {
        if (humidityRatio < 0 || Double.isNaN(humidityRatio)) {
            throw new InvalidParameterException("Negative humidity ratio: " + humidityRatio);
        }
        double pv = pressure * humidityRatio / (AirProperties.MOLAR_MASS_RATIO + humidityRatio);
        return pv / saturationPressure(temperature);
    }
}
