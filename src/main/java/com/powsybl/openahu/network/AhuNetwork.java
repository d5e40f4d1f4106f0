/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.network;

import com.powsybl.openahu.psychro.PsychrometricProperties;

import java.util.Arrays;
import java.util.Objects;

/**
 * Air handling unit circuit: outdoor air and recycled zone air are mixed (mixing box 1), part of the mix goes through
 * the cooling coil while the rest bypasses it, both streams are mixed again (mixing box 2), reheated and supplied to
 * the thermal zone, whose air is partly recycled.
 * <p>
 * The network also holds the state computed by the last linear solve.
 *
 * @author Open AHU developers
 */
public class AhuNetwork {

    private final AhuParameters parameters;

    private final AhuInputs inputs;

    private final PsychrometricProperties psychrometricProperties;

    private final FlowSplit flowSplit;

    private final CoolingCoil coolingCoil;

    private final double outdoorHumidityRatio;

    private final double zoneHumidityRatioSetpoint;

    private final double[] temperatures = new double[StatePoint.values().length];

    private final double[] humidityRatios = new double[StatePoint.values().length];

    private double coilTotalHeat = Double.NaN;

    private double coilSensibleHeat = Double.NaN;

    private double coilLatentHeat = Double.NaN;

    private double heatingCoilHeat = Double.NaN;

    private double zoneSensibleLoad = Double.NaN;

    private double zoneLatentLoad = Double.NaN;

    public AhuNetwork(AhuParameters parameters, AhuInputs inputs, PsychrometricProperties psychrometricProperties,
                      double saturationTemperatureInitialGuess) {
        this.parameters = Objects.requireNonNull(parameters);
        this.inputs = Objects.requireNonNull(inputs);
        this.psychrometricProperties = Objects.requireNonNull(psychrometricProperties);
        flowSplit = FlowSplit.of(parameters);
        coolingCoil = new CoolingCoil(psychrometricProperties, parameters.getCoilMinOutletTemperature(),
                                      flowSplit.getTreatedFlow() <= 0, saturationTemperatureInitialGuess);
        outdoorHumidityRatio = psychrometricProperties.humidityRatio(inputs.getOutdoorTemperature(), inputs.getOutdoorRelativeHumidity());
        zoneHumidityRatioSetpoint = psychrometricProperties.humidityRatio(inputs.getZoneTemperatureSetpoint(), inputs.getZoneRelativeHumiditySetpoint());
        Arrays.fill(temperatures, Double.NaN);
        Arrays.fill(humidityRatios, Double.NaN);
        temperatures[StatePoint.OUTDOOR.getNum()] = inputs.getOutdoorTemperature();
        humidityRatios[StatePoint.OUTDOOR.getNum()] = outdoorHumidityRatio;
    }

    public AhuParameters getParameters() {
        return parameters;
    }

    public AhuInputs getInputs() {
        return inputs;
    }

    public PsychrometricProperties getPsychrometricProperties() {
        return psychrometricProperties;
    }

    public FlowSplit getFlowSplit() {
        return flowSplit;
    }

    public CoolingCoil getCoolingCoil() {
        return coolingCoil;
    }

    public double getOutdoorHumidityRatio() {
        return outdoorHumidityRatio;
    }

    public double getZoneHumidityRatioSetpoint() {
        return zoneHumidityRatioSetpoint;
    }

    private static void checkUnknown(StatePoint point) {
        if (!Objects.requireNonNull(point).isUnknown()) {
            throw new IllegalArgumentException("State point " + point + " is an input");
        }
    }

    public double getTemperature(StatePoint point) {
        return temperatures[point.getNum()];
    }

    public void setTemperature(StatePoint point, double temperature) {
        checkUnknown(point);
        temperatures[point.getNum()] = temperature;
    }

    public double getHumidityRatio(StatePoint point) {
        return humidityRatios[point.getNum()];
    }

    public void setHumidityRatio(StatePoint point, double humidityRatio) {
        checkUnknown(point);
        humidityRatios[point.getNum()] = humidityRatio;
    }

    public double getCoilTotalHeat() {
        return coilTotalHeat;
    }

    public void setCoilTotalHeat(double coilTotalHeat) {
        this.coilTotalHeat = coilTotalHeat;
    }

    public double getCoilSensibleHeat() {
        return coilSensibleHeat;
    }

    public void setCoilSensibleHeat(double coilSensibleHeat) {
        this.coilSensibleHeat = coilSensibleHeat;
    }

    public double getCoilLatentHeat() {
        return coilLatentHeat;
    }

    public void setCoilLatentHeat(double coilLatentHeat) {
        this.coilLatentHeat = coilLatentHeat;
    }

    public double getHeatingCoilHeat() {
        return heatingCoilHeat;
    }

    public void setHeatingCoilHeat(double heatingCoilHeat) {
        this.heatingCoilHeat = heatingCoilHeat;
    }

    public double getZoneSensibleLoad() {
        return zoneSensibleLoad;
    }

    public void setZoneSensibleLoad(double zoneSensibleLoad) {
        this.zoneSensibleLoad = zoneSensibleLoad;
    }

    public double getZoneLatentLoad() {
        return zoneLatentLoad;
    }

    public void setZoneLatentLoad(double zoneLatentLoad) {
        this.zoneLatentLoad = zoneLatentLoad;
    }

    @Override
    public String toString() {
        return "AhuNetwork(" + parameters + ", " + flowSplit + ")";
    }
}
