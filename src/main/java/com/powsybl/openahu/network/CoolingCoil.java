/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.network;

import com.powsybl.commons.PowsyblException;
import com.powsybl.openahu.psychro.PsychrometricProperties;

import java.util.Objects;

/**
 * Operating state of the cooling coil during a solve: humidity and temperature modes and the point around which the
 * saturation curve is linearized.
 *
 * @author Open AHU developers
 */
public class CoolingCoil {

    private final PsychrometricProperties psychrometricProperties;

    private final double minOutletTemperature;

    private final boolean idle;

    private CoilHumidityMode humidityMode;

    private CoilTemperatureMode temperatureMode;

    private double saturationTemperature;

    private double saturationSlope;

    private double saturationHumidityRatio;

    private int controllerSwitchCount = 0;

    public CoolingCoil(PsychrometricProperties psychrometricProperties, double minOutletTemperature, boolean idle,
                       double saturationTemperature) {
        this.psychrometricProperties = Objects.requireNonNull(psychrometricProperties);
        this.minOutletTemperature = minOutletTemperature;
        this.idle = idle;
        humidityMode = idle ? CoilHumidityMode.DRY : CoilHumidityMode.WET;
        temperatureMode = idle ? CoilTemperatureMode.IDLE : CoilTemperatureMode.CONTROLLED;
        setSaturationTemperature(saturationTemperature);
    }

    public boolean isIdle() {
        return idle;
    }

    public double getMinOutletTemperature() {
        return minOutletTemperature;
    }

    public CoilHumidityMode getHumidityMode() {
        return humidityMode;
    }

    public void setHumidityMode(CoilHumidityMode humidityMode) {
        Objects.requireNonNull(humidityMode);
        if (idle && humidityMode != CoilHumidityMode.DRY) {
            throw new PowsyblException("An idle coil is always dry");
        }
        if (temperatureMode == CoilTemperatureMode.SWITCHED_OFF && humidityMode != CoilHumidityMode.DRY) {
            throw new PowsyblException("A switched off coil is always dry");
        }
        this.humidityMode = humidityMode;
    }

    public CoilTemperatureMode getTemperatureMode() {
        return temperatureMode;
    }

    public void setTemperatureMode(CoilTemperatureMode temperatureMode) {
        Objects.requireNonNull(temperatureMode);
        if (idle != (temperatureMode == CoilTemperatureMode.IDLE)) {
            throw new PowsyblException("Temperature mode " + temperatureMode + " is not allowed for "
                    + (idle ? "an idle" : "an active") + " coil");
        }
        this.temperatureMode = temperatureMode;
    }

    public int getControllerSwitchCount() {
        return controllerSwitchCount;
    }

    public void incrementControllerSwitchCount() {
        controllerSwitchCount++;
    }

    public double getSaturationTemperature() {
        return saturationTemperature;
    }

    /**
     * Move the linearization point of the saturation curve.
     */
    public void setSaturationTemperature(double saturationTemperature) {
        this.saturationTemperature = saturationTemperature;
        saturationHumidityRatio = psychrometricProperties.saturationHumidityRatio(saturationTemperature);
        saturationSlope = psychrometricProperties.saturationHumidityRatioDerivative(saturationTemperature);
    }

    /**
     * Slope of the saturation curve at the linearization point, kg/(kg.K).
     */
    public double getSaturationSlope() {
        return saturationSlope;
    }

    public double getSaturationHumidityRatio() {
        return saturationHumidityRatio;
    }
}
