/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu;

import com.powsybl.commons.PowsyblException;

/**
 * Base class of the air handling unit solver exceptions.
 *
 * @author Open AHU developers
 */
public class AhuException extends PowsyblException {

    public AhuException(String message) {
        super(message);
    }

    public AhuException(String message, Throwable cause) {
        super(message, cause);
    }
}
