/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.equations;

import java.util.List;
import java.util.Objects;

/**
 * Right hand side of the linear system, one value per active equation in column order.
 *
 * @author Open AHU developers
 */
public final class TargetVector {

    @FunctionalInterface
    public interface Initializer<V extends Enum<V> & Quantity, E extends Enum<E> & Quantity> {

        void initialize(Equation<V, E> equation, double[] targets);
    }

    private TargetVector() {
    }

    public static <V extends Enum<V> & Quantity, E extends Enum<E> & Quantity> double[] createArray(EquationSystem<V, E> equationSystem, Initializer<V, E> initializer) {
        Objects.requireNonNull(equationSystem);
        Objects.requireNonNull(initializer);
        List<Equation<V, E>> sortedEquationsToSolve = equationSystem.getIndex().getSortedEquationsToSolve();
        double[] array = new double[sortedEquationsToSolve.size()];
        for (Equation<V, E> equation : sortedEquationsToSolve) {
            initializer.initialize(equation, array);
        }
        return array;
    }
}
