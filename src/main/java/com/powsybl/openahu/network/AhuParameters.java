/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.network;

import com.powsybl.openahu.InvalidParameterException;

import java.util.Objects;

/**
 * Design parameters of the unit. Immutable, a modified copy is obtained with the {@code with} methods.
 *
 * @author Open AHU developers
 */
public final class AhuParameters {

    public static final double DEFAULT_SUPPLY_MASS_FLOW = 3.5;
    public static final double DEFAULT_OUTDOOR_MASS_FLOW = 1;
    public static final double DEFAULT_BYPASS_FRACTION = 0.1;
    public static final double DEFAULT_TEMPERATURE_CONTROLLER_GAIN = 1e10;
    public static final double DEFAULT_HUMIDITY_CONTROLLER_GAIN = 0;
    public static final double DEFAULT_COIL_MIN_OUTLET_TEMPERATURE = 0;

    public static final double MIN_COIL_OUTLET_TEMPERATURE = -50;
    public static final double MAX_COIL_OUTLET_TEMPERATURE = 50;

    private final double supplyMassFlow;

    private final double outdoorMassFlow;

    private final double bypassFraction;

    private final double temperatureControllerGain;

    private final double humidityControllerGain;

    private final double coilMinOutletTemperature;

    /**
     * @param supplyMassFlow supply dry air mass flow m (kg/s)
     * @param outdoorMassFlow outdoor air mass flow mo (kg/s)
     * @param bypassFraction share β of the supply flow bypassing the cooling coil
     * @param temperatureControllerGain zone temperature controller gain Kθ (W/K), may be infinite
     * @param humidityControllerGain zone humidity controller gain Kw (W/(kg/kg)), 0 disables humidity control
     * @param coilMinOutletTemperature lowest outlet temperature the cooling coil can reach (°C)
     */
    public AhuParameters(double supplyMassFlow, double outdoorMassFlow, double bypassFraction,
                         double temperatureControllerGain, double humidityControllerGain, double coilMinOutletTemperature) {
        this.supplyMassFlow = supplyMassFlow;
        this.outdoorMassFlow = outdoorMassFlow;
        this.bypassFraction = bypassFraction;
        this.temperatureControllerGain = temperatureControllerGain;
        this.humidityControllerGain = humidityControllerGain;
        this.coilMinOutletTemperature = coilMinOutletTemperature;
        validate();
    }

    public AhuParameters(double supplyMassFlow, double outdoorMassFlow, double bypassFraction,
                         double temperatureControllerGain, double humidityControllerGain) {
        this(supplyMassFlow, outdoorMassFlow, bypassFraction, temperatureControllerGain, humidityControllerGain,
                DEFAULT_COIL_MIN_OUTLET_TEMPERATURE);
    }

    public static AhuParameters createDefault() {
        return new AhuParameters(DEFAULT_SUPPLY_MASS_FLOW, DEFAULT_OUTDOOR_MASS_FLOW, DEFAULT_BYPASS_FRACTION,
                DEFAULT_TEMPERATURE_CONTROLLER_GAIN, DEFAULT_HUMIDITY_CONTROLLER_GAIN, DEFAULT_COIL_MIN_OUTLET_TEMPERATURE);
    }

    private static void checkFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidParameterException("Parameter " + name + " is not finite: " + value);
        }
    }

    private void validate() {
        checkFinite("supplyMassFlow", supplyMassFlow);
        checkFinite("outdoorMassFlow", outdoorMassFlow);
        checkFinite("bypassFraction", bypassFraction);
        checkFinite("coilMinOutletTemperature", coilMinOutletTemperature);
        if (outdoorMassFlow < 0) {
            throw new InvalidParameterException("Outdoor mass flow is negative: " + outdoorMassFlow);
        }
        if (supplyMassFlow <= 0) {
            throw new InvalidParameterException("Supply mass flow has to be strictly positive: " + supplyMassFlow);
        }
        if (supplyMassFlow < outdoorMassFlow) {
            throw new InvalidParameterException("Supply mass flow " + supplyMassFlow
                    + " is lower than outdoor mass flow " + outdoorMassFlow);
        }
        if (bypassFraction < 0 || bypassFraction > 1) {
            throw new InvalidParameterException("Bypass fraction out of [0, 1]: " + bypassFraction);
        }
        if (Double.isNaN(temperatureControllerGain) || temperatureControllerGain <= 0) {
            throw new InvalidParameterException("Temperature controller gain has to be strictly positive: " + temperatureControllerGain);
        }
        if (Double.isNaN(humidityControllerGain) || humidityControllerGain < 0) {
            throw new InvalidParameterException("Humidity controller gain is negative: " + humidityControllerGain);
        }
        if (coilMinOutletTemperature < MIN_COIL_OUTLET_TEMPERATURE || coilMinOutletTemperature > MAX_COIL_OUTLET_TEMPERATURE) {
            throw new InvalidParameterException("Coil min outlet temperature out of [" + MIN_COIL_OUTLET_TEMPERATURE + ", "
                    + MAX_COIL_OUTLET_TEMPERATURE + "]: " + coilMinOutletTemperature);
        }
    }

    public double getSupplyMassFlow() {
        return supplyMassFlow;
    }

    public double getOutdoorMassFlow() {
        return outdoorMassFlow;
    }

    public double getBypassFraction() {
        return bypassFraction;
    }

    public double getTemperatureControllerGain() {
        return temperatureControllerGain;
    }

    public double getHumidityControllerGain() {
        return humidityControllerGain;
    }

    public boolean isHumidityControlled() {
        return humidityControllerGain > 0;
    }

    public double getCoilMinOutletTemperature() {
        return coilMinOutletTemperature;
    }

    public AhuParameters withSupplyMassFlow(double supplyMassFlow) {
        return new AhuParameters(supplyMassFlow, outdoorMassFlow, bypassFraction, temperatureControllerGain, humidityControllerGain, coilMinOutletTemperature);
    }

    public AhuParameters withOutdoorMassFlow(double outdoorMassFlow) {
        return new AhuParameters(supplyMassFlow, outdoorMassFlow, bypassFraction, temperatureControllerGain, humidityControllerGain, coilMinOutletTemperature);
    }

    public AhuParameters withBypassFraction(double bypassFraction) {
        return new AhuParameters(supplyMassFlow, outdoorMassFlow, bypassFraction, temperatureControllerGain, humidityControllerGain, coilMinOutletTemperature);
    }

    public AhuParameters withTemperatureControllerGain(double temperatureControllerGain) {
        return new AhuParameters(supplyMassFlow, outdoorMassFlow, bypassFraction, temperatureControllerGain, humidityControllerGain, coilMinOutletTemperature);
    }

    public AhuParameters withHumidityControllerGain(double humidityControllerGain) {
        return new AhuParameters(supplyMassFlow, outdoorMassFlow, bypassFraction, temperatureControllerGain, humidityControllerGain, coilMinOutletTemperature);
    }

    public AhuParameters withCoilMinOutletTemperature(double coilMinOutletTemperature) {
        return new AhuParameters(supplyMassFlow, outdoorMassFlow, bypassFraction, temperatureControllerGain, humidityControllerGain, coilMinOutletTemperature);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AhuParameters other)) {
            return false;
        }
        return Double.compare(supplyMassFlow, other.supplyMassFlow) == 0
                && Double.compare(outdoorMassFlow, other.outdoorMassFlow) == 0
                && Double.compare(bypassFraction, other.bypassFraction) == 0
                && Double.compare(temperatureControllerGain, other.temperatureControllerGain) == 0
                && Double.compare(humidityControllerGain, other.humidityControllerGain) == 0
                && Double.compare(coilMinOutletTemperature, other.coilMinOutletTemperature) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(supplyMassFlow, outdoorMassFlow, bypassFraction, temperatureControllerGain, humidityControllerGain, coilMinOutletTemperature);
    }

    @Override
    public String toString() {
        return "AhuParameters(" +
                "supplyMassFlow=" + supplyMassFlow +
                ", outdoorMassFlow=" + outdoorMassFlow +
                ", bypassFraction=" + bypassFraction +
                ", temperatureControllerGain=" + temperatureControllerGain +
                ", humidityControllerGain=" + humidityControllerGain +
                ", coilMinOutletTemperature=" + coilMinOutletTemperature +
                ')';
    }
}
