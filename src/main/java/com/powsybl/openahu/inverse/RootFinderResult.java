/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.inverse;

import com.powsybl.openahu.AhuException;
import com.powsybl.openahu.ahu.AhuSolverResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a parametric root finding. Only a {@link RootFinderStatus#CONVERGED} result is authoritative, the other
 * ones carry the best trial found so that the caller can see how far the target is from what is achievable.
 *
 * @author Open AHU developers
 */
public final class RootFinderResult {

    private final RootFinderStatus status;

    private final DesignParameter designParameter;

    private final ControlledOutput controlledOutput;

    private final double target;

    private final double parameterValue;

    private final double outputValue;

    private final AhuSolverResult solverResult;

    private final double lowerBoundOutput;

    private final double upperBoundOutput;

    private final double minAchievableOutput;

    private final double maxAchievableOutput;

    private final int evaluationCount;

    private final int crossingCount;

    private RootFinderResult(Builder builder) {
        this.status = Objects.requireNonNull(builder.status);
        this.designParameter = Objects.requireNonNull(builder.designParameter);
        this.controlledOutput = Objects.requireNonNull(builder.controlledOutput);
        this.target = builder.target;
        this.parameterValue = builder.parameterValue;
        this.outputValue = builder.outputValue;
        this.solverResult = builder.solverResult;
        this.lowerBoundOutput = builder.lowerBoundOutput;
        this.upperBoundOutput = builder.upperBoundOutput;
        this.minAchievableOutput = builder.minAchievableOutput;
        this.maxAchievableOutput = builder.maxAchievableOutput;
        this.evaluationCount = builder.evaluationCount;
        this.crossingCount = builder.crossingCount;
    }

    static Builder builder() {
        return new Builder();
    }

    public RootFinderStatus getStatus() {
        return status;
    }

    public boolean isAuthoritative() {
        return status == RootFinderStatus.CONVERGED;
    }

    public DesignParameter getDesignParameter() {
        return designParameter;
    }

    /**
     * Output the search was run on, target and outputs of this result are expressed in its unit. A zone relative
     * humidity request is searched as {@link ControlledOutput#ZONE_HUMIDITY_RATIO} (kg/kg).
     */
    public ControlledOutput getControlledOutput() {
        return controlledOutput;
    }

    /**
     * Target of the search, in the unit of {@link #getControlledOutput()}.
     */
    public double getTarget() {
        return target;
    }

    /**
     * Parameter value of the converged solution, or of the best trial when not converged.
     */
    public double getParameterValue() {
        return parameterValue;
    }

    public double getConvergedParameterValue() {
        if (!isAuthoritative()) {
            throw new AhuException("Root finder did not converge (" + status + "), best trial "
                    + designParameter + "=" + parameterValue + " is not authoritative");
        }
        return parameterValue;
    }

    public double getOutputValue() {
        return outputValue;
    }

    public Optional<AhuSolverResult> getSolverResult() {
        return Optional.ofNullable(solverResult);
    }

    public double getLowerBoundOutput() {
        return lowerBoundOutput;
    }

    public double getUpperBoundOutput() {
        return upperBoundOutput;
    }

    /**
     * Smallest output evaluated over the scanned bracket.
     */
    public double getMinAchievableOutput() {
        return minAchievableOutput;
    }

    public double getMaxAchievableOutput() {
        return maxAchievableOutput;
    }

    /**
     * Number of direct solves run by the search.
     */
    public int getEvaluationCount() {
        return evaluationCount;
    }

    /**
     * Number of scanned sub-intervals in which the output crosses the target, a scan point exactly on the target
     * counting as one.
     */
    public int getCrossingCount() {
        return crossingCount;
    }

    /**
     * False when the target is crossed more than once over the bracket: the converged value is then the root
     * nearest to the design parameter value of the input parameters, other roots exist.
     */
    public boolean isUniqueRoot() {
        return crossingCount == 1;
    }

    @Override
    public String toString() {
        return "RootFinderResult(" +
                "status=" + status +
                ", " + designParameter + "=" + parameterValue +
                ", " + controlledOutput + "=" + outputValue +
                ", target=" + target +
                ", achievableRange=[" + minAchievableOutput + ", " + maxAchievableOutput + "]" +
                ", evaluationCount=" + evaluationCount +
                ", crossingCount=" + crossingCount +
                ')';
    }

    static final class Builder {

        private RootFinderStatus status;
        private DesignParameter designParameter;
        private ControlledOutput controlledOutput;
        private double target = Double.NaN;
        private double parameterValue = Double.NaN;
        private double outputValue = Double.NaN;
        private AhuSolverResult solverResult;
        private double lowerBoundOutput = Double.NaN;
        private double upperBoundOutput = Double.NaN;
        private double minAchievableOutput = Double.NaN;
        private double maxAchievableOutput = Double.NaN;
        private int evaluationCount;
        private int crossingCount;

        private Builder() {
        }

        Builder setStatus(RootFinderStatus status) {
            this.status = status;
            return this;
        }

        Builder setDesignParameter(DesignParameter designParameter) {
            this.designParameter = designParameter;
            return this;
        }

        Builder setControlledOutput(ControlledOutput controlledOutput) {
            this.controlledOutput = controlledOutput;
            return this;
        }

        Builder setTarget(double target) {
            this.target = target;
            return this;
        }

        Builder setTrial(double parameterValue, double outputValue, AhuSolverResult solverResult) {
            this.parameterValue = parameterValue;
            this.outputValue = outputValue;
            this.solverResult = solverResult;
            return this;
        }

        Builder setBoundaryOutputs(double lowerBoundOutput, double upperBoundOutput) {
            this.lowerBoundOutput = lowerBoundOutput;
            this.upperBoundOutput = upperBoundOutput;
            return this;
        }

        Builder setAchievableRange(double minAchievableOutput, double maxAchievableOutput) {
            this.minAchievableOutput = minAchievableOutput;
            this.maxAchievableOutput = maxAchievableOutput;
            return this;
        }

        Builder setEvaluationCount(int evaluationCount) {
            this.evaluationCount = evaluationCount;
            return this;
        }

        Builder setCrossingCount(int crossingCount) {
            this.crossingCount = crossingCount;
            return this;
        }

        RootFinderResult build() {
            return new RootFinderResult(this);
        }
    }
}
