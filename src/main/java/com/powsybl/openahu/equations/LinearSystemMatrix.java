/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.equations;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.PowsyblException;
import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.math.matrix.LUDecomposition;
import com.powsybl.math.matrix.Matrix;
import com.powsybl.math.matrix.MatrixException;
import com.powsybl.math.matrix.MatrixFactory;
import com.powsybl.openahu.SingularSystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.powsybl.openahu.util.Markers.PERFORMANCE_MARKER;

/**
 * Coefficient matrix of the active equations of an equation system.
 * <p>
 * Rows and columns are equilibrated before the LU decomposition so that the condition number compared to the
 * threshold does not depend on the units of the equations (W, kg/s...) and of the variables. As in a Jacobian matrix,
 * the matrix is stored transposed: a matrix row is a variable and a matrix column is an equation.
 *
 * @author Open AHU developers
 */
public class LinearSystemMatrix<V extends Enum<V> & Quantity, E extends Enum<E> & Quantity>
        implements EquationSystemListener<V, E>, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LinearSystemMatrix.class);

    private final EquationSystem<V, E> equationSystem;

    private final MatrixFactory matrixFactory;

    private final double maxConditionNumber;

    private double[] equationScales;

    private double[] variableScales;

    private Matrix matrix;

    private LUDecomposition lu;

    private double conditionNumber = Double.NaN;

    private boolean valid = false;

    public LinearSystemMatrix(EquationSystem<V, E> equationSystem, MatrixFactory matrixFactory, double maxConditionNumber) {
        this.equationSystem = Objects.requireNonNull(equationSystem);
        this.matrixFactory = Objects.requireNonNull(matrixFactory);
        if (maxConditionNumber <= 1 || Double.isNaN(maxConditionNumber)) {
            throw new PowsyblException("Invalid max condition number: " + maxConditionNumber);
        }
        this.maxConditionNumber = maxConditionNumber;
        equationSystem.addListener(this);
    }

    @Override
    public void onEquationChange(Equation<V, E> equation, EquationEventType eventType) {
        invalidate();
    }

    @Override
    public void onEquationTermChange(EquationTerm<V, E> term, EquationEventType eventType) {
        invalidate();
    }

    /**
     * To be called when a coefficient supplier of a term has changed.
     */
    public void invalidate() {
        valid = false;
    }

    private double[][] buildCoefficients(List<Equation<V, E>> equations, int variableCount) {
        double[][] coefficients = new double[equations.size()][variableCount];
        for (Equation<V, E> equation : equations) {
            int column = equation.getColumn();
            equation.der((variable, value) -> coefficients[column][variable.getRow()] += value);
        }
        return coefficients;
    }

    private void equilibrate(double[][] coefficients, List<Equation<V, E>> equations, List<Variable<V>> variables) {
        int n = coefficients.length;
        equationScales = new double[n];
        variableScales = new double[n];
        for (int j = 0; j < n; j++) {
            double max = 0;
            for (int i = 0; i < n; i++) {
                max = Math.max(max, Math.abs(coefficients[j][i]));
            }
            if (max == 0 || !Double.isFinite(max)) {
                throw new SingularSystemException("Equation " + equations.get(j) + " has no finite non zero coefficient",
                        Double.POSITIVE_INFINITY, maxConditionNumber);
            }
            equationScales[j] = 1 / max;
        }
        for (int i = 0; i < n; i++) {
            double max = 0;
            for (int j = 0; j < n; j++) {
                max = Math.max(max, Math.abs(coefficients[j][i] * equationScales[j]));
            }
            if (max == 0) {
                throw new SingularSystemException("Variable " + variables.get(i) + " has no non zero coefficient",
                        Double.POSITIVE_INFINITY, maxConditionNumber);
            }
            variableScales[i] = 1 / max;
        }
        for (int j = 0; j < n; j++) {
            for (int i = 0; i < n; i++) {
                coefficients[j][i] *= equationScales[j] * variableScales[i];
            }
        }
    }

    private static double norm1(double[][] coefficients) {
        // matrix 1-norm: max over variables of the sum over equations
        int n = coefficients.length;
        double norm = 0;
        for (int i = 0; i < n; i++) {
            double sum = 0;
            for (int j = 0; j < n; j++) {
                sum += Math.abs(coefficients[j][i]);
            }
            norm = Math.max(norm, sum);
        }
        return norm;
    }

    private double estimateConditionNumber(double[][] coefficients) {
        int n = coefficients.length;
        DenseMatrix inverse = new DenseMatrix(n, n);
        for (int i = 0; i < n; i++) {
            inverse.set(i, i, 1);
        }
        lu.solveTransposed(inverse);
        double inverseNorm = 0;
        for (int c = 0; c < n; c++) {
            double sum = 0;
            for (int r = 0; r < n; r++) {
                sum += Math.abs(inverse.get(r, c));
            }
            inverseNorm = Math.max(inverseNorm, sum);
        }
        double cond = norm1(coefficients) * inverseNorm;
        return Double.isNaN(cond) ? Double.POSITIVE_INFINITY : cond;
    }

    private void clearLu() {
        if (lu != null) {
            lu.close();
        }
        lu = null;
    }

    private void update() {
        if (valid) {
            return;
        }

        Stopwatch stopwatch = Stopwatch.createStarted();

        clearLu();
        List<Equation<V, E>> equations = equationSystem.getIndex().getSortedEquationsToSolve();
        List<Variable<V>> variables = equationSystem.getIndex().getSortedVariablesToFind();
        int columnCount = equations.size();
        int rowCount = variables.size();
        if (rowCount != columnCount) {
            throw new PowsyblException("Expected to have same number of equations (" + columnCount
                    + ") and variables (" + rowCount + ")");
        }

        double[][] coefficients = buildCoefficients(equations, rowCount);
        equilibrate(coefficients, equations, variables);

        int nonZeroCount = 0;
        for (double[] equationCoefficients : coefficients) {
            for (double value : equationCoefficients) {
                if (value != 0) {
                    nonZeroCount++;
                }
            }
        }
        matrix = matrixFactory.create(rowCount, columnCount, nonZeroCount);
        for (int j = 0; j < columnCount; j++) {
            for (int i = 0; i < rowCount; i++) {
                if (coefficients[j][i] != 0) {
                    matrix.add(i, j, coefficients[j][i]);
                }
            }
        }

        LOGGER.debug(PERFORMANCE_MARKER, "Linear system matrix built in {} us", stopwatch.elapsed(TimeUnit.MICROSECONDS));
        stopwatch.reset().start();

        try {
            lu = matrix.decomposeLU();
            conditionNumber = estimateConditionNumber(coefficients);
        } catch (MatrixException e) {
            clearLu();
            throw new SingularSystemException("LU decomposition failed: " + e.getMessage(), maxConditionNumber, e);
        } catch (RuntimeException e) {
            // dense decomposition reports a zero pivot as a plain runtime exception at solve time
            clearLu();
            throw new SingularSystemException("Linear system is singular: " + e.getMessage(), maxConditionNumber, e);
        }

        LOGGER.debug(PERFORMANCE_MARKER, "LU decomposition done in {} us", stopwatch.elapsed(TimeUnit.MICROSECONDS));
        LOGGER.debug("Linear system of size {} has an equilibrated condition number of {}", rowCount, conditionNumber);

        if (conditionNumber > maxConditionNumber) {
            clearLu();
            throw new SingularSystemException("Linear system is ill-conditioned: condition number " + conditionNumber
                    + " is greater than " + maxConditionNumber, conditionNumber, maxConditionNumber);
        }

        valid = true;
    }

    public double getConditionNumber() {
        update();
        return conditionNumber;
    }

    /**
     * Solve the system for the given right hand side indexed by equation column.
     *
     * @return the solution indexed by variable row
     */
    public double[] solve(double[] targets) {
        Objects.requireNonNull(targets);
        update();
        if (targets.length != equationScales.length) {
            throw new PowsyblException("Target vector size " + targets.length + " differs from system size " + equationScales.length);
        }
        double[] x = new double[targets.length];
        for (int j = 0; j < targets.length; j++) {
            x[j] = targets[j] * equationScales[j];
        }
        lu.solveTransposed(x);
        for (int i = 0; i < x.length; i++) {
            x[i] *= variableScales[i];
            if (!Double.isFinite(x[i])) {
                throw new SingularSystemException("Non finite solution for variable " + equationSystem.getIndex().getSortedVariablesToFind().get(i),
                        conditionNumber, maxConditionNumber);
            }
        }
        return x;
    }

    @Override
    public void close() {
        equationSystem.removeListener(this);
        matrix = null;
        clearLu();
    }
}
