/*******************************************************************************
 * Robust PCA - subspace estimation by Grassmann median
 * Copyright (C) 2016 - 2026, <CIRAD> <IRD>
 *
 * This program is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Affero General Public License, version 3 as published by
 * the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
 * FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * See <http://www.gnu.org/licenses/agpl.html> for details about GNU General
 * Public License V3.
 *******************************************************************************/
package fr.cirad.tools.rpca;

import static fr.cirad.tools.rpca.SyntheticSubspaceData.dot;
import static fr.cirad.tools.rpca.SyntheticSubspaceData.unit;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import fr.cirad.tools.rpca.GrassmannMedianCalculator.BasisResult;
import fr.cirad.tools.rpca.GrassmannMedianCalculator.DirectionEstimate;

public class GrassmannMedianCalculatorTest {

    private static final double TOLERANCE = 1e-6;

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 4, 6})
    public void testBasisShapeAndOrthonormality(int numComponents) {
        double[][] data = SyntheticSubspaceData.anisotropic(new Random(11), 300, 10, 6, 4, 2, 1, 0.5);

        BasisResult result = new GrassmannMedianCalculator(42).computeBasis(data, numComponents);

        assertEquals(6, result.getVectors().numRows);
        assertEquals(numComponents, result.getVectors().numCols);
        assertEquals(numComponents, result.getNumComponents());
        for (int i = 0; i < numComponents; i++) {
            double[] vi = result.getVector(i);
            assertEquals(1.0, Math.sqrt(dot(vi, vi)), TOLERANCE, "column " + i + " is not unit norm");
            for (int j = 0; j < i; j++)
                assertEquals(0.0, dot(vi, result.getVector(j)), TOLERANCE, "columns " + j + " and " + i + " are not orthogonal");
        }
    }

    @Test
    public void testDefaultsToSingleComponent() {
        double[][] data = SyntheticSubspaceData.anisotropic(new Random(3), 50, 3, 1, 1);

        BasisResult result = new GrassmannMedianCalculator(1).computeBasis(data);

        assertEquals(3, result.getVectors().numRows);
        assertEquals(1, result.getVectors().numCols);
        assertEquals(3, result.toArray().length);
        assertEquals(1, result.toArray()[0].length);
    }

    @Test
    public void testRecoversDominantDirection() {
        double[] v = unit(1, -2, 0.5, 1);
        double[][] data = SyntheticSubspaceData.alongDirection(new Random(5), 200, v, 0.05);

        BasisResult result = new GrassmannMedianCalculator(9).computeBasis(data);

        assertTrue(Math.abs(dot(result.getVector(0), v)) > 0.999);
    }

    @Test
    public void testSignInvariance() {
        double[][] data = SyntheticSubspaceData.anisotropic(new Random(21), 120, 5, 3, 2, 1);
        double[][] negated = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            negated[i] = new double[data[i].length];
            for (int j = 0; j < data[i].length; j++)
                negated[i][j] = -data[i][j];
        }

        BasisResult original = new GrassmannMedianCalculator(17).computeBasis(data, 3);
        BasisResult flipped = new GrassmannMedianCalculator(17).computeBasis(negated, 3);

        for (int k = 0; k < 3; k++) {
            double[] a = original.getVector(k);
            double[] b = flipped.getVector(k);
            double sign = Math.signum(dot(a, b));
            for (int d = 0; d < a.length; d++)
                assertEquals(a[d], sign * b[d], 1e-9);
        }
    }

    @Test
    public void testRobustToOutliers() {
        double[] v = unit(1, 2, -1, 0.5, 0);
        double[] outlierDirection = {0, 0, 0, 0, 1};
        double[][] inliers = SyntheticSubspaceData.alongDirection(new Random(1), 100, v, 1e-5);
        double[][] data = SyntheticSubspaceData.withOutliers(inliers, 10, outlierDirection, 50);

        BasisResult robust = new GrassmannMedianCalculator(2).computeBasis(data);
        double[] ordinary = new StandardPCACalculator().performPCA(data).getEigenVector(0);

        assertTrue(Math.abs(dot(robust.getVector(0), v)) > 0.999, "robust basis should follow the inliers");
        assertTrue(Math.abs(dot(ordinary, v)) < 0.5, "ordinary PCA should be pulled toward the outliers");
        assertTrue(Math.abs(dot(ordinary, outlierDirection)) > 0.9);
    }

    @Test
    public void testConvergesBeforeIterationCap() {
        double[] v = unit(1, -2, 0.5, 1);
        double[][] data = SyntheticSubspaceData.alongDirection(new Random(8), 200, v, 0.05);
        GrassmannMedianCalculator calculator = new GrassmannMedianCalculator(4);
        DMatrixRMaj x = new DMatrixRMaj(data);

        DirectionEstimate estimate = calculator.grassmannMedian(x, calculator.initialDirection(x));

        assertTrue(estimate.isConverged());
        assertTrue(estimate.getIterations() < data.length);
        DMatrixRMaj once = calculator.grassmannMedianStep(x, estimate.getDirection());
        for (int d = 0; d < once.numRows; d++)
            assertEquals(estimate.getDirection().get(d, 0), once.get(d, 0), GrassmannMedianCalculator.EPSILON);
    }

    @Test
    public void testBasisResultReportsConvergence() {
        double[][] data = SyntheticSubspaceData.anisotropic(new Random(13), 150, 6, 3, 1);

        BasisResult result = new GrassmannMedianCalculator(13).computeBasis(data, 2);

        assertEquals(2, result.getIterations().length);
        for (int k = 0; k < 2; k++) {
            assertTrue(result.getIterations()[k] >= 1);
            assertTrue(result.getIterations()[k] <= data.length);
        }
        assertEquals(2, result.getConverged().length);
    }

    @Test
    public void testFirstComponentIndependentOfRequestedCount() {
        double[][] data = SyntheticSubspaceData.anisotropic(new Random(19), 150, 8, 5, 3, 1, 0.5);

        BasisResult single = new GrassmannMedianCalculator(7).computeBasis(data, 1);
        BasisResult three = new GrassmannMedianCalculator(7).computeBasis(data, 3);

        assertArrayEquals(single.getVector(0), three.getVector(0), 0.0);
    }

    @Test
    public void testParallelMediansMatchSequential() {
        double[][] data = SyntheticSubspaceData.anisotropic(new Random(23), 200, 7, 5, 3, 2, 1, 1, 0.5, 0.25);

        BasisResult sequential = new GrassmannMedianCalculator(new Random(31), false).computeBasis(data, 3);
        BasisResult parallel = new GrassmannMedianCalculator(new Random(31), true).computeBasis(data, 3);

        assertArrayEquals(sequential.getVectors().data, parallel.getVectors().data, 0.0);
    }

    @Test
    public void testInputIsNotModified() {
        double[][] data = SyntheticSubspaceData.anisotropic(new Random(29), 40, 4, 2, 1);
        double[][] copy = new double[data.length][];
        for (int i = 0; i < data.length; i++)
            copy[i] = data[i].clone();

        new GrassmannMedianCalculator(3).computeBasis(data, 3);

        for (int i = 0; i < data.length; i++)
            assertArrayEquals(copy[i], data[i], 0.0);
    }

    @Test
    public void testAllZeroDataIsDegenerate() {
        double[][] data = new double[10][3];

        DegenerateSubspaceException e = assertThrows(DegenerateSubspaceException.class,
                () -> new GrassmannMedianCalculator(1).computeBasis(data, 2));
        assertTrue(e.getMessage().contains("degenerate subspace"));
        assertTrue(e.getMessage().contains("component 1"));
    }

    @Test
    public void testMissingData() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new GrassmannMedianCalculator(1).computeBasis(null));
        assertTrue(e.getMessage().contains("not enough input arguments"));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 4, 10})
    public void testInvalidDimensionality(int numComponents) {
        double[][] data = SyntheticSubspaceData.anisotropic(new Random(2), 20, 3, 2, 1);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new GrassmannMedianCalculator(1).computeBasis(data, numComponents));
        assertTrue(e.getMessage().contains("Invalid dimensionality"));
    }

    @Test
    public void testMalformedInput() {
        GrassmannMedianCalculator calculator = new GrassmannMedianCalculator(1);

        assertThrows(IllegalArgumentException.class, () -> calculator.computeBasis(new double[0][0]));
        assertThrows(IllegalArgumentException.class, () -> calculator.computeBasis(new double[][] {{1, 2}, {3}}));
        assertThrows(IllegalArgumentException.class, () -> calculator.computeBasis(new double[][] {{1, 2}, {3, Double.NaN}}));
        assertThrows(IllegalArgumentException.class, () -> calculator.computeBasis(new double[][] {{1, Double.POSITIVE_INFINITY}}));
        assertThrows(IllegalArgumentException.class, () -> new GrassmannMedianCalculator(null));
    }

    @Test
    public void testInfiniteValuesMessage() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new GrassmannMedianCalculator(1).computeBasis(new double[][] {{1, Double.NEGATIVE_INFINITY}, {2, 3}}));
        assertTrue(e.getMessage().contains("imputeMissingValues"));
        assertTrue(e.getMessage().contains("infinite values have to be removed"));
    }

    @ParameterizedTest
    @ValueSource(doubles = {1e160, 1e150, 1e-170, 1e-300})
    public void testExtremeScales(double scale) {
        double[][] data = SyntheticSubspaceData.anisotropic(new Random(53), 200, 4, 3, 2, 1);
        double[][] scaled = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            scaled[i] = new double[data[i].length];
            for (int j = 0; j < data[i].length; j++)
                scaled[i][j] = data[i][j] * scale;
        }

        BasisResult reference = new GrassmannMedianCalculator(9).computeBasis(data, 2);
        BasisResult result = new GrassmannMedianCalculator(9).computeBasis(scaled, 2);

        for (int k = 0; k < 2; k++) {
            double[] v = result.getVector(k);
            for (double value : v)
                assertTrue(Double.isFinite(value));
            assertEquals(1.0, Math.abs(dot(v, reference.getVector(k))), 1e-6, "component " + k + " at scale " + scale);
        }
    }

    @Test
    public void testWrongDirectionShape() {
        GrassmannMedianCalculator calculator = new GrassmannMedianCalculator(1);
        DMatrixRMaj x = new DMatrixRMaj(SyntheticSubspaceData.anisotropic(new Random(4), 10, 3, 2, 1, 0.5));

        assertThrows(IllegalArgumentException.class, () -> calculator.grassmannMedianStep(x, new DMatrixRMaj(3, 1, true, 1, 0, 0)));
        assertThrows(IllegalArgumentException.class, () -> calculator.grassmannMedianStep(x, new DMatrixRMaj(1, 4, true, 1, 0, 0, 0)));
        assertThrows(IllegalArgumentException.class, () -> calculator.grassmannMedianStep(x, null));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> calculator.grassmannMedian(x, new DMatrixRMaj(5, 1)));
        assertTrue(e.getMessage().contains("4×1"));
    }

    @Test
    public void testZeroProjectionsAreExcludedFromMedian() {
        DMatrixRMaj x = new DMatrixRMaj(new double[][] {{1, 0}, {2, 1}, {0, 5}, {0, 7}});
        DMatrixRMaj mu = new DMatrixRMaj(new double[][] {{1}, {0}});

        DMatrixRMaj next = new GrassmannMedianCalculator(1).grassmannMedianStep(x, mu);

        // signs are (1, 1, 0, 0): medians are 0.5 and 0
        assertEquals(1.0, next.get(0, 0), 0.0);
        assertEquals(0.0, next.get(1, 0), 0.0);
    }

    @Test
    public void testSingleObservation() {
        BasisResult result = new GrassmannMedianCalculator(5).computeBasis(new double[][] {{3, 4}});

        double[] v = result.getVector(0);
        assertEquals(0.6, Math.abs(v[0]), TOLERANCE);
        assertEquals(0.8, Math.abs(v[1]), TOLERANCE);
    }

    @Test
    public void testDeflateRemovesProjection() {
        double[][] data = SyntheticSubspaceData.anisotropic(new Random(37), 30, 3, 2, 1);
        DMatrixRMaj x = new DMatrixRMaj(data);
        double[] u = unit(1, 1, -1);
        DMatrixRMaj mu = new DMatrixRMaj(3, 1, true, u);

        new GrassmannMedianCalculator(1).deflate(x, mu);

        for (int i = 0; i < x.numRows; i++) {
            double projection = x.get(i, 0) * u[0] + x.get(i, 1) * u[1] + x.get(i, 2) * u[2];
            assertEquals(0.0, projection, 1e-12);
            double original = dot(data[i], u);
            for (int d = 0; d < 3; d++)
                assertEquals(data[i][d] - original * u[d], x.get(i, d), 1e-12);
        }
    }

    @Test
    public void testReorthonormalize() {
        DMatrixRMaj basis = new DMatrixRMaj(new double[][] {{1, 0, 0}, {0, 1, 0}, {0, 0, 0}, {0, 0, 0}});
        DMatrixRMaj mu = new DMatrixRMaj(4, 1, true, unit(1, 1, 1, 1));
        GrassmannMedianCalculator calculator = new GrassmannMedianCalculator(1);

        DMatrixRMaj r = calculator.reorthonormalize(basis, 2, mu);

        double h = Math.sqrt(0.5);
        assertArrayEquals(new double[] {0, 0, h, h}, r.data, 1e-12);
        assertArrayEquals(mu.data, calculator.reorthonormalize(basis, 0, mu).data, 1e-12);
        assertThrows(DegenerateSubspaceException.class,
                () -> calculator.reorthonormalize(basis, 2, new DMatrixRMaj(4, 1, true, 0.6, 0.8, 0, 0)));
        assertThrows(IllegalArgumentException.class, () -> calculator.reorthonormalize(basis, 4, mu));
    }

    @Test
    public void testTransformData() {
        double[][] data = SyntheticSubspaceData.anisotropic(new Random(41), 25, 4, 2, 1);
        GrassmannMedianCalculator calculator = new GrassmannMedianCalculator(6);
        BasisResult result = calculator.computeBasis(data, 2);

        double[][] scores = calculator.transformData(data, result.getVectors());

        assertEquals(25, scores.length);
        assertEquals(2, scores[0].length);
        for (int i = 0; i < data.length; i++)
            for (int k = 0; k < 2; k++)
                assertEquals(dot(data[i], result.getVector(k)), scores[i][k], 1e-9);
        assertThrows(IllegalArgumentException.class, () -> calculator.transformData(new double[][] {{1, 2}}, result.getVectors()));
    }
}
