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
 * Boundary conditions of one solve: outdoor air, zone set points and building loads.
 *
 * @author Open AHU developers
 */
public final class AhuInputs {

    public static final double DEFAULT_OUTDOOR_TEMPERATURE = 32;
    public static final double DEFAULT_OUTDOOR_RELATIVE_HUMIDITY = 0.5;
    public static final double DEFAULT_ZONE_TEMPERATURE_SETPOINT = 24;
    public static final double DEFAULT_ZONE_RELATIVE_HUMIDITY_SETPOINT = 0.6;
    public static final double DEFAULT_INFILTRATION_MASS_FLOW = 0.7;
    public static final double DEFAULT_BUILDING_CONDUCTANCE = 675;
    public static final double DEFAULT_AUXILIARY_SENSIBLE_LOAD = 17000;
    public static final double DEFAULT_AUXILIARY_LATENT_LOAD = 2000;

    private final double outdoorTemperature;

    private final double outdoorRelativeHumidity;

    private final double zoneTemperatureSetpoint;

    private final double zoneRelativeHumiditySetpoint;

    private final double infiltrationMassFlow;

    private final double buildingConductance;

    private final double auxiliarySensibleLoad;

    private final double auxiliaryLatentLoad;

    private AhuInputs(Builder builder) {
        this.outdoorTemperature = builder.outdoorTemperature;
        this.outdoorRelativeHumidity = builder.outdoorRelativeHumidity;
        this.zoneTemperatureSetpoint = builder.zoneTemperatureSetpoint;
        this.zoneRelativeHumiditySetpoint = builder.zoneRelativeHumiditySetpoint;
        this.infiltrationMassFlow = builder.infiltrationMassFlow;
        this.buildingConductance = builder.buildingConductance;
        this.auxiliarySensibleLoad = builder.auxiliarySensibleLoad;
        this.auxiliaryLatentLoad = builder.auxiliaryLatentLoad;
        validate();
    }

    public static AhuInputs createDefault() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .setOutdoorTemperature(outdoorTemperature)
                .setOutdoorRelativeHumidity(outdoorRelativeHumidity)
                .setZoneTemperatureSetpoint(zoneTemperatureSetpoint)
                .setZoneRelativeHumiditySetpoint(zoneRelativeHumiditySetpoint)
                .setInfiltrationMassFlow(infiltrationMassFlow)
                .setBuildingConductance(buildingConductance)
                .setAuxiliarySensibleLoad(auxiliarySensibleLoad)
                .setAuxiliaryLatentLoad(auxiliaryLatentLoad);
    }

    private static void checkFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidParameterException("Input " + name + " is not finite: " + value);
        }
    }

    private static void checkRelativeHumidity(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new InvalidParameterException("Input " + name + " out of [0, 1]: " + value);
        }
    }

    private void validate() {
        checkFinite("outdoorTemperature", outdoorTemperature);
        checkFinite("zoneTemperatureSetpoint", zoneTemperatureSetpoint);
        checkFinite("infiltrationMassFlow", infiltrationMassFlow);
        checkFinite("buildingConductance", buildingConductance);
        checkFinite("auxiliarySensibleLoad", auxiliarySensibleLoad);
        checkFinite("auxiliaryLatentLoad", auxiliaryLatentLoad);
        checkRelativeHumidity("outdoorRelativeHumidity", outdoorRelativeHumidity);
        checkRelativeHumidity("zoneRelativeHumiditySetpoint", zoneRelativeHumiditySetpoint);
        if (infiltrationMassFlow < 0) {
            throw new InvalidParameterException("Infiltration mass flow is negative: " + infiltrationMassFlow);
        }
        if (buildingConductance < 0) {
            throw new InvalidParameterException("Building conductance is negative: " + buildingConductance);
        }
    }

    public double getOutdoorTemperature() {
        return outdoorTemperature;
    }

    public double getOutdoorRelativeHumidity() {
        return outdoorRelativeHumidity;
    }

    public double getZoneTemperatureSetpoint() {
        return zoneTemperatureSetpoint;
    }

    public double getZoneRelativeHumiditySetpoint() {
        return zoneRelativeHumiditySetpoint;
    }

    public double getInfiltrationMassFlow() {
        return infiltrationMassFlow;
    }

    public double getBuildingConductance() {
        return buildingConductance;
    }

    public double getAuxiliarySensibleLoad() {
        return auxiliarySensibleLoad;
    }

    public double getAuxiliaryLatentLoad() {
        return auxiliaryLatentLoad;
    }

    public AhuInputs withOutdoorTemperature(double outdoorTemperature) {
        return toBuilder().setOutdoorTemperature(outdoorTemperature).build();
    }

    public AhuInputs withOutdoorRelativeHumidity(double outdoorRelativeHumidity) {
        return toBuilder().setOutdoorRelativeHumidity(outdoorRelativeHumidity).build();
    }

    public AhuInputs withZoneTemperatureSetpoint(double zoneTemperatureSetpoint) {
        return toBuilder().setZoneTemperatureSetpoint(zoneTemperatureSetpoint).build();
    }

    public AhuInputs withZoneRelativeHumiditySetpoint(double zoneRelativeHumiditySetpoint) {
        return toBuilder().setZoneRelativeHumiditySetpoint(zoneRelativeHumiditySetpoint).build();
    }

    public AhuInputs withAuxiliarySensibleLoad(double auxiliarySensibleLoad) {
        return toBuilder().setAuxiliarySensibleLoad(auxiliarySensibleLoad).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AhuInputs other)) {
            return false;
        }
        return Double.compare(outdoorTemperature, other.outdoorTemperature) == 0
                && Double.compare(outdoorRelativeHumidity, other.outdoorRelativeHumidity) == 0
                && Double.compare(zoneTemperatureSetpoint, other.zoneTemperatureSetpoint) == 0
                && Double.compare(zoneRelativeHumiditySetpoint, other.zoneRelativeHumiditySetpoint) == 0
                && Double.compare(infiltrationMassFlow, other.infiltrationMassFlow) == 0
                && Double.compare(buildingConductance, other.buildingConductance) == 0
                && Double.compare(auxiliarySensibleLoad, other.auxiliarySensibleLoad) == 0
                && Double.compare(auxiliaryLatentLoad, other.auxiliaryLatentLoad) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(outdoorTemperature, outdoorRelativeHumidity, zoneTemperatureSetpoint, zoneRelativeHumiditySetpoint,
                infiltrationMassFlow, buildingConductance, auxiliarySensibleLoad, auxiliaryLatentLoad);
    }

    @Override
    public String toString() {
        return "AhuInputs(" +
                "outdoorTemperature=" + outdoorTemperature +
                ", outdoorRelativeHumidity=" + outdoorRelativeHumidity +
                ", zoneTemperatureSetpoint=" + zoneTemperatureSetpoint +
                ", zoneRelativeHumiditySetpoint=" + zoneRelativeHumiditySetpoint +
                ", infiltrationMassFlow=" + infiltrationMassFlow +
                ", buildingConductance=" + buildingConductance +
                ", auxiliarySensibleLoad=" + auxiliarySensibleLoad +
                ", auxiliaryLatentLoad=" + auxiliaryLatentLoad +
                ')';
    }

    public static final class Builder {

        private double outdoorTemperature = DEFAULT_OUTDOOR_TEMPERATURE;
        private double outdoorRelativeHumidity = DEFAULT_OUTDOOR_RELATIVE_HUMIDITY;
        private double zoneTemperatureSetpoint = DEFAULT_ZONE_TEMPERATURE_SETPOINT;
        private double zoneRelativeHumiditySetpoint = DEFAULT_ZONE_RELATIVE_HUMIDITY_SETPOINT;
        private double infiltrationMassFlow = DEFAULT_INFILTRATION_MASS_FLOW;
        private double buildingConductance = DEFAULT_BUILDING_CONDUCTANCE;
        private double auxiliarySensibleLoad = DEFAULT_AUXILIARY_SENSIBLE_LOAD;
        private double auxiliaryLatentLoad = DEFAULT_AUXILIARY_LATENT_LOAD;

        private Builder() {
        }

        public Builder setOutdoorTemperature(double outdoorTemperature) {
            this.outdoorTemperature = outdoorTemperature;
            return this;
        }

        public Builder setOutdoorRelativeHumidity(double outdoorRelativeHumidity) {
            this.outdoorRelativeHumidity = outdoorRelativeHumidity;
            return this;
        }

        public Builder setZoneTemperatureSetpoint(double zoneTemperatureSetpoint) {
            this.zoneTemperatureSetpoint = zoneTemperatureSetpoint;
            return this;
        }

        public Builder setZoneRelativeHumiditySetpoint(double zoneRelativeHumiditySetpoint) {
            this.zoneRelativeHumiditySetpoint = zoneRelativeHumiditySetpoint;
            return this;
        }

        public Builder setInfiltrationMassFlow(double infiltrationMassFlow) {
            this.infiltrationMassFlow = infiltrationMassFlow;
            return this;
        }

        public Builder setBuildingConductance(double buildingConductance) {
            this.buildingConductance = buildingConductance;
            return this;
        }

        public Builder setAuxiliarySensibleLoad(double auxiliarySensibleLoad) {
            this.auxiliarySensibleLoad = auxiliarySensibleLoad;
            return this;
        }

        public Builder setAuxiliaryLatentLoad(double auxiliaryLatentLoad) {
            this.auxiliaryLatentLoad = auxiliaryLatentLoad;
            return this;
        }

        public AhuInputs build() {
            return new AhuInputs(this);
        }
    }
}
