/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu;

/**
 * Thrown when a parameter or an input is outside of its physical domain. Raised before any equation is assembled.
 *
 * @author Open AHU developers
 */
public class InvalidParameterException extends AhuException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
