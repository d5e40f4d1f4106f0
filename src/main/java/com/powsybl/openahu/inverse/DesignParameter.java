/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.inverse;

import com.powsybl.openahu.network.AhuParameters;

/**
 * Design parameter searched by the root finder, all the others being fixed.
 *
 * @author Open AHU developers
 */
public enum DesignParameter {
    BYPASS_FRACTION {
        @Override
        public double getValue(AhuParameters parameters) {
            return parameters.getBypassFraction();
        }

        @Override
        public AhuParameters apply(AhuParameters parameters, double value) {
            return parameters.withBypassFraction(value);
        }

        @Override
        public double getLowerBound(AhuParameters parameters, RootFinderParameters rootFinderParameters) {
            return 0;
        }

        @Override
        public double getUpperBound(AhuParameters parameters, RootFinderParameters rootFinderParameters) {
            return 1;
        }
    },
    SUPPLY_MASS_FLOW {
        @Override
        public double getValue(AhuParameters parameters) {
            return parameters.getSupplyMassFlow();
        }

        @Override
        public AhuParameters apply(AhuParameters parameters, double value) {
            return parameters.withSupplyMassFlow(value);
        }

        @Override
        public double getLowerBound(AhuParameters parameters, RootFinderParameters rootFinderParameters) {
            // supply flow cannot be lower than outdoor flow
            return parameters.getOutdoorMassFlow() + rootFinderParameters.getAbsoluteTolerance();
        }

        @Override
        public double getUpperBound(AhuParameters parameters, RootFinderParameters rootFinderParameters) {
            return rootFinderParameters.getMaxSupplyMassFlow();
        }
    };

    public abstract double getValue(AhuParameters parameters);

    public abstract AhuParameters apply(AhuParameters parameters, double value);

    public abstract double getLowerBound(AhuParameters parameters, RootFinderParameters rootFinderParameters);

    public abstract double getUpperBound(AhuParameters parameters, RootFinderParameters rootFinderParameters);
}
