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

import java.util.Random;
import java.util.stream.IntStream;

import org.apache.log4j.Logger;
import org.ejml.data.FMatrixRMaj;
import org.ejml.dense.row.CommonOps_FDRM;
import org.ejml.dense.row.NormOps_FDRM;

/**
 * Single precision Grassmann median: same procedure as {@link GrassmannMedianCalculator},
 * with every intermediate value held in floats. Convenient for large genotype-like
 * matrices where halving memory matters more than the last digits.
 */
public class FloatGrassmannMedianCalculator {

    static private final Logger LOG = Logger.getLogger(FloatGrassmannMedianCalculator.class);

    public static final float EPSILON = (float) GrassmannMedianCalculator.EPSILON;

    public static final int INIT_ITERATIONS = GrassmannMedianCalculator.INIT_ITERATIONS;

    private final Random rng;

    private final boolean parallel;

    public FloatGrassmannMedianCalculator() {
        this(new Random());
    }

    public FloatGrassmannMedianCalculator(long seed) {
        this(new Random(seed));
    }

    public FloatGrassmannMedianCalculator(Random rng) {
        this(rng, false);
    }

    public FloatGrassmannMedianCalculator(Random rng, boolean parallel) {
        if (rng == null)
            throw new IllegalArgumentException("A random source is required");
        this.rng = rng;
        this.parallel = parallel;
    }

    public FloatBasisResult computeBasis(float[][] data) {
        return computeBasis(data, 1);
    }

    public FloatBasisResult computeBasis(float[][] data, int numComponents) {
        FMatrixRMaj x = toWorkingMatrix(data, numComponents);
        int sampleSize = x.numCols;

        LOG.info("Computing Grassmann median basis using floats: " + x.numRows + " × " + sampleSize + ", k=" + numComponents);

        FMatrixRMaj vectors = new FMatrixRMaj(sampleSize, numComponents);
        int[] iterations = new int[numComponents];
        boolean[] converged = new boolean[numComponents];

        for (int k = 0; k < numComponents; k++) {
            try {
                FloatDirectionEstimate estimate = grassmannMedian(x, initialDirection(x));
                FMatrixRMaj mu = estimate.getDirection();
                if (k > 0)
                    mu = reorthonormalize(vectors, k, mu);
                CommonOps_FDRM.insert(mu, vectors, 0, k);
                if (k < numComponents - 1)
                    deflate(x, mu);

                iterations[k] = estimate.getIterations();
                converged[k] = estimate.isConverged();
                LOG.debug("Component " + (k + 1) + "/" + numComponents + ": " + estimate.getIterations() + " iteration(s), "
                        + (estimate.isConverged() ? "converged" : "iteration cap reached"));
            }
            catch (DegenerateSubspaceException dse) {
                throw new DegenerateSubspaceException("Unable to extract component " + (k + 1) + " of " + numComponents + ": " + dse.getMessage(), dse);
            }
        }
        return new FloatBasisResult(vectors, iterations, converged);
    }

    public FMatrixRMaj initialDirection(FMatrixRMaj x) {
        FMatrixRMaj mu = new FMatrixRMaj(x.numCols, 1);
        for (int i = 0; i < mu.data.length; i++)
            mu.data[i] = rng.nextFloat() - 0.5f;
        normalize(mu, "random initialization");

        FMatrixRMaj dots = new FMatrixRMaj(x.numRows, 1);
        for (int iter = 0; iter < INIT_ITERATIONS; iter++) {
            CommonOps_FDRM.mult(x, mu, dots);
            normalize(dots, "power iteration");
            CommonOps_FDRM.multTransA(x, dots, mu);
            normalize(mu, "power iteration");
        }
        return mu;
    }

    public FloatDirectionEstimate grassmannMedian(FMatrixRMaj x, FMatrixRMaj start) {
        checkDirection(x, start);
        int maxIterations = x.numRows;
        FMatrixRMaj mu = start.copy();
        for (int iter = 1; iter <= maxIterations; iter++) {
            FMatrixRMaj next = grassmannMedianStep(x, mu);
            float change = 0;
            for (int i = 0; i < next.data.length; i++)
                change = Math.max(change, Math.abs(next.data[i] - mu.data[i]));
            mu = next;
            if (change < EPSILON)
                return new FloatDirectionEstimate(mu, iter, true);
        }
        return new FloatDirectionEstimate(mu, maxIterations, false);
    }

    public FMatrixRMaj grassmannMedianStep(FMatrixRMaj x, FMatrixRMaj mu) {
        checkDirection(x, mu);
        int numSamples = x.numRows, sampleSize = x.numCols;

        FMatrixRMaj dots = new FMatrixRMaj(numSamples, 1);
        CommonOps_FDRM.mult(x, mu, dots);
        float[] signs = new float[numSamples];
        for (int i = 0; i < numSamples; i++)
            signs[i] = Math.signum(dots.data[i]);

        FMatrixRMaj next = new FMatrixRMaj(sampleSize, 1);
        if (parallel)
            IntStream.range(0, sampleSize).parallel().forEach(d -> next.data[d] = ElementwiseMedian.signedColumnMedian(x.data, sampleSize, signs, d, new float[numSamples]));
        else {
            float[] columnBuf = new float[numSamples];
            for (int d = 0; d < sampleSize; d++)
                next.data[d] = ElementwiseMedian.signedColumnMedian(x.data, sampleSize, signs, d, columnBuf);
        }
        normalize(next, "Grassmann median update");
        return next;
    }

    public FMatrixRMaj reorthonormalize(FMatrixRMaj basis, int numPrevious, FMatrixRMaj mu) {
        if (numPrevious < 0 || numPrevious > basis.numCols)
            throw new IllegalArgumentException("Invalid number of previous basis vectors: " + numPrevious);

        FMatrixRMaj r = mu.copy();
        if (numPrevious > 0) {
            FMatrixRMaj q = CommonOps_FDRM.extract(basis, 0, basis.numRows, 0, numPrevious);
            FMatrixRMaj coefficients = new FMatrixRMaj(numPrevious, 1);
            float previousNorm = NormOps_FDRM.normF(r);
            for (int pass = 0; pass < GrassmannMedianCalculator.MAX_REORTH_PASSES; pass++) {
                CommonOps_FDRM.multTransA(q, r, coefficients);
                CommonOps_FDRM.multAdd(-1f, q, coefficients, r);
                float norm = NormOps_FDRM.normF(r);
                if (norm >= GrassmannMedianCalculator.REORTH_ALPHA * previousNorm)
                    break;
                previousNorm = norm;
            }
        }
        normalize(r, "reorthonormalization");
        return r;
    }

    /**
     * In-place deflation of x along the unit vector mu.
     */
    public void deflate(FMatrixRMaj x, FMatrixRMaj mu) {
        FMatrixRMaj dots = new FMatrixRMaj(x.numRows, 1);
        CommonOps_FDRM.mult(x, mu, dots);
        CommonOps_FDRM.multAddTransB(-1f, dots, mu, x);
    }

    public float[][] transformData(float[][] data, FMatrixRMaj basis) {
        if (data == null || basis == null)
            throw new IllegalArgumentException("Both data and basis are required");
        if (data.length > 0 && data[0].length != basis.numRows)
            throw new IllegalArgumentException("Data has " + data[0].length + " columns but basis vectors have " + basis.numRows + " coordinates");

        FMatrixRMaj dataMatrix = new FMatrixRMaj(data);
        FMatrixRMaj scores = new FMatrixRMaj(dataMatrix.numRows, basis.numCols);
        CommonOps_FDRM.mult(dataMatrix, basis, scores);

        float[][] result = new float[scores.numRows][scores.numCols];
        for (int i = 0; i < scores.numRows; i++)
            for (int j = 0; j < scores.numCols; j++)
                result[i][j] = scores.get(i, j);
        return result;
    }

    private static FMatrixRMaj toWorkingMatrix(float[][] data, int numComponents) {
        if (data == null)
            throw new IllegalArgumentException("Grassmann median: not enough input arguments, a data matrix is required");
        if (data.length == 0 || data[0] == null || data[0].length == 0)
            throw new IllegalArgumentException("Data matrix must contain at least one observation and one feature");
        int sampleSize = data[0].length;
        for (int i = 1; i < data.length; i++)
            if (data[i] == null || data[i].length != sampleSize)
                throw new IllegalArgumentException("Invalid row length at observation #" + i + ". Expected " + sampleSize + ", but " + (data[i] == null ? 0 : data[i].length) + " appeared.");
        if (numComponents <= 0 || numComponents > sampleSize)
            throw new IllegalArgumentException("Invalid dimensionality: cannot extract " + numComponents + " basis vector(s) from " + sampleSize + "-dimensional data");
        if (DataPreprocessor.hasInvalidValues(data)) {
            LOG.warn("Matrix contains NaN or Infinite values.");
            throw new IllegalArgumentException("Data matrix contains NaN or Infinite values: NaN can be filled with DataPreprocessor.imputeMissingValues, infinite values have to be removed or clipped");
        }
        FMatrixRMaj x = new FMatrixRMaj(data);
        // directions are scale-invariant, bring the largest entry to 1 so products neither overflow nor underflow
        float maxAbs = CommonOps_FDRM.elementMaxAbs(x);
        if (maxAbs > 0)
            CommonOps_FDRM.divide(x, maxAbs);
        return x;
    }

    private static void checkDirection(FMatrixRMaj x, FMatrixRMaj mu) {
        if (mu == null || mu.numRows != x.numCols || mu.numCols != 1)
            throw new IllegalArgumentException("Expected a " + x.numCols + "×1 direction, but " + (mu == null ? "none" : mu.numRows + "×" + mu.numCols) + " appeared.");
    }

    private static void normalize(FMatrixRMaj v, String phase) {
        float norm = NormOps_FDRM.normF(v);
        if (norm == 0 || Float.isNaN(norm) || Float.isInfinite(norm))
            throw new DegenerateSubspaceException("degenerate subspace, candidate direction has norm " + norm + " after " + phase);
        CommonOps_FDRM.divide(v, norm);
    }

    public static class FloatDirectionEstimate {
        public final FMatrixRMaj direction;
        public final int iterations;
        public final boolean converged;

        public FloatDirectionEstimate(FMatrixRMaj direction, int iterations, boolean converged) {
            this.direction = direction;
            this.iterations = iterations;
            this.converged = converged;
        }

        public FMatrixRMaj getDirection() {
            return direction;
        }

        public int getIterations() {
            return iterations;
        }

        public boolean isConverged() {
            return converged;
        }
    }

    public static class FloatBasisResult {
        public final FMatrixRMaj vectors;
        public final int[] iterations;
        public final boolean[] converged;

        public FloatBasisResult(FMatrixRMaj vectors, int[] iterations, boolean[] converged) {
            this.vectors = vectors;
            this.iterations = iterations;
            this.converged = converged;
        }

        public FMatrixRMaj getVectors() {
            return vectors;
        }

        public int getNumComponents() {
            return vectors.numCols;
        }

        public float[] getVector(int which) {
            if (which < 0 || which >= vectors.numCols)
                throw new IllegalArgumentException("Invalid component: " + which);
            float[] v = new float[vectors.numRows];
            for (int i = 0; i < v.length; i++)
                v[i] = vectors.get(i, which);
            return v;
        }

        public int[] getIterations() {
            return iterations;
        }

        public boolean[] getConverged() {
            return converged;
        }
    }
}
