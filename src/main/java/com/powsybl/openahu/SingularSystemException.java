/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu;

/**
 * Thrown when the assembled linear system is singular or when its estimated condition number exceeds the configured
 * threshold.
 *
 * @author Open AHU developers
 */
public class SingularSystemException extends AhuException {

    private final double conditionNumber;

    private final double maxConditionNumber;

    public SingularSystemException(String message, double conditionNumber, double maxConditionNumber) {
        super(message);
        this.conditionNumber = conditionNumber;
        this.maxConditionNumber = maxConditionNumber;
    }

    public SingularSystemException(String message, double maxConditionNumber, Throwable cause) {
        super(message, cause);
        this.conditionNumber = Double.POSITIVE_INFINITY;
        this.maxConditionNumber = maxConditionNumber;
    }

    /**
     * Estimated 1-norm condition number of the equilibrated matrix, infinite for an exactly singular matrix.
     */
    public double getConditionNumber() {
        return conditionNumber;
    }

    public double getMaxConditionNumber() {
        return maxConditionNumber;
    }
}
