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
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * Robust estimate of the dominant subspace of a set of observations, computed one
 * basis vector at a time by Grassmann median: a fixed-point iteration where each
 * observation is re-signed according to its projection on the current direction,
 * and the direction is replaced by the element-wise median of the re-signed data.
 *
 * <p>
 * Reference: "Grassmann Averages for Scalable Robust PCA", S. Hauberg, A. Feragen
 * and M.J. Black, CVPR 2014.
 * </p>
 *
 * <p>
 * Runs entirely in double precision, see {@link FloatGrassmannMedianCalculator}
 * for the single precision counterpart. Instances are not thread-safe since every
 * call consumes the random source.
 * </p>
 */
public class GrassmannMedianCalculator {

    static private final Logger LOG = Logger.getLogger(GrassmannMedianCalculator.class);

    /** Convergence threshold on the largest per-coordinate change between two iterates. */
    public static final double EPSILON = 1e-5;

    /** Number of mean-based power iterations applied to the random starting direction. */
    public static final int INIT_ITERATIONS = 3;

    /** Maximum number of Gram-Schmidt passes during reorthonormalization. */
    public static final int MAX_REORTH_PASSES = 4;

    /** A Gram-Schmidt pass is repeated while it shrinks the vector below this fraction of its previous norm. */
    public static final double REORTH_ALPHA = 0.5;

    private final Random rng;

    private final boolean parallel;

    public GrassmannMedianCalculator() {
        this(new Random());
    }

    public GrassmannMedianCalculator(long seed) {
        this(new Random(seed));
    }

    public GrassmannMedianCalculator(Random rng) {
        this(rng, false);
    }

    /**
     * @param rng       random source for initial directions
     * @param parallel  whether per-coordinate medians are computed in parallel (results are identical)
     */
    public GrassmannMedianCalculator(Random rng, boolean parallel) {
        if (rng == null)
            throw new IllegalArgumentException("A random source is required");
        this.rng = rng;
        this.parallel = parallel;
    }

    public BasisResult computeBasis(double[][] data) {
        return computeBasis(data, 1);
    }

    /**
     * Computes a D×K matrix of orthonormal basis vectors spanning the robust average
     * K-dimensional subspace of the data. Columns are stored in extraction order.
     *
     * @param data           N×D observations, left untouched
     * @param numComponents  K, between 1 and D
     * @throws IllegalArgumentException    if data is missing or malformed, or K is out of range
     * @throws DegenerateSubspaceException if a direction cannot be normalized
     */
    public BasisResult computeBasis(double[][] data, int numComponents) {
        DMatrixRMaj x = toWorkingMatrix(data, numComponents);
        int numSamples = x.numRows, sampleSize = x.numCols;

        LOG.info("Computing Grassmann median basis using doubles: " + numSamples + " × " + sampleSize + ", k=" + numComponents);

        DMatrixRMaj vectors = new DMatrixRMaj(sampleSize, numComponents);
        int[] iterations = new int[numComponents];
        boolean[] converged = new boolean[numComponents];

        for (int k = 0; k < numComponents; k++) {
            try {
                DirectionEstimate estimate = grassmannMedian(x, initialDirection(x));
                DMatrixRMaj mu = estimate.getDirection();
                if (k > 0)
                    mu = reorthonormalize(vectors, k, mu);
                CommonOps_DDRM.insert(mu, vectors, 0, k);

                // the working copy only needs deflating if another component follows
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
        return new BasisResult(vectors, iterations, converged);
    }

    /**
     * Draws a random unit vector and refines it with {@link #INIT_ITERATIONS} ordinary
     * (mean-based) power iterations on the data.
     */
    public DMatrixRMaj initialDirection(DMatrixRMaj x) {
        DMatrixRMaj mu = new DMatrixRMaj(x.numCols, 1);
        for (int i = 0; i < mu.data.length; i++)
            mu.data[i] = rng.nextDouble() - 0.5;
        normalize(mu, "random initialization");

        DMatrixRMaj dots = new DMatrixRMaj(x.numRows, 1);
        for (int iter = 0; iter < INIT_ITERATIONS; iter++) {
            CommonOps_DDRM.mult(x, mu, dots);
            normalize(dots, "power iteration");
            CommonOps_DDRM.multTransA(x, dots, mu);
            normalize(mu, "power iteration");
        }
        return mu;
    }

    /**
     * Runs the Grassmann median iteration from a unit-norm starting direction, at
     * most N times (N being the number of observations), stopping as soon as no
     * coordinate moves by {@link #EPSILON} or more.
     */
    public DirectionEstimate grassmannMedian(DMatrixRMaj x, DMatrixRMaj start) {
        checkDirection(x, start);
        int maxIterations = x.numRows;
        DMatrixRMaj mu = start.copy();
        for (int iter = 1; iter <= maxIterations; iter++) {
            DMatrixRMaj next = grassmannMedianStep(x, mu);
            double change = maxAbsDifference(next, mu);
            mu = next;
            if (change < EPSILON)
                return new DirectionEstimate(mu, iter, true);
        }
        return new DirectionEstimate(mu, maxIterations, false);
    }

    /**
     * One Grassmann median update: sign(X·mu) re-signs the observations (zero stays
     * zero), then each coordinate of the new direction is the median of that
     * coordinate over the re-signed observations. The result is normalized.
     */
    public DMatrixRMaj grassmannMedianStep(DMatrixRMaj x, DMatrixRMaj mu) {
        checkDirection(x, mu);
        int numSamples = x.numRows, sampleSize = x.numCols;

        DMatrixRMaj dots = new DMatrixRMaj(numSamples, 1);
        CommonOps_DDRM.mult(x, mu, dots);
        double[] signs = new double[numSamples];
        for (int i = 0; i < numSamples; i++)
            signs[i] = Math.signum(dots.data[i]);

        DMatrixRMaj next = new DMatrixRMaj(sampleSize, 1);
        if (parallel)
            IntStream.range(0, sampleSize).parallel().forEach(d -> next.data[d] = ElementwiseMedian.signedColumnMedian(x.data, sampleSize, signs, d, new double[numSamples]));
        else {
            double[] columnBuf = new double[numSamples];
            for (int d = 0; d < sampleSize; d++)
                next.data[d] = ElementwiseMedian.signedColumnMedian(x.data, sampleSize, signs, d, columnBuf);
        }
        normalize(next, "Grassmann median update");
        return next;
    }

    /**
     * Removes from mu its components along the first <code>numPrevious</code> columns
     * of the basis, then normalizes it. Returns a new vector.
     */
    public DMatrixRMaj reorthonormalize(DMatrixRMaj basis, int numPrevious, DMatrixRMaj mu) {
        if (numPrevious < 0 || numPrevious > basis.numCols)
            throw new IllegalArgumentException("Invalid number of previous basis vectors: " + numPrevious);

        DMatrixRMaj r = mu.copy();
        if (numPrevious > 0) {
            DMatrixRMaj q = CommonOps_DDRM.extract(basis, 0, basis.numRows, 0, numPrevious);
            DMatrixRMaj coefficients = new DMatrixRMaj(numPrevious, 1);
            double previousNorm = NormOps_DDRM.normF(r);
            for (int pass = 0; pass < MAX_REORTH_PASSES; pass++) {
                CommonOps_DDRM.multTransA(q, r, coefficients);
                CommonOps_DDRM.multAdd(-1, q, coefficients, r);
                double norm = NormOps_DDRM.normF(r);
                if (norm >= REORTH_ALPHA * previousNorm)
                    break;
                previousNorm = norm;
            }
        }
        normalize(r, "reorthonormalization");
        return r;
    }

    /**
     * Subtracts from every observation (row of x) its projection on the unit vector
     * mu. x is modified in place.
     */
    public void deflate(DMatrixRMaj x, DMatrixRMaj mu) {
        DMatrixRMaj dots = new DMatrixRMaj(x.numRows, 1);
        CommonOps_DDRM.mult(x, mu, dots);
        CommonOps_DDRM.multAddTransB(-1, dots, mu, x);
    }

    /**
     * Projects observations onto a basis, returning the N×K scores.
     */
    public double[][] transformData(double[][] data, DMatrixRMaj basis) {
        if (data == null || basis == null)
            throw new IllegalArgumentException("Both data and basis are required");
        if (data.length > 0 && data[0].length != basis.numRows)
            throw new IllegalArgumentException("Data has " + data[0].length + " columns but basis vectors have " + basis.numRows + " coordinates");

        DMatrixRMaj dataMatrix = new DMatrixRMaj(data);
        DMatrixRMaj scores = new DMatrixRMaj(dataMatrix.numRows, basis.numCols);
        CommonOps_DDRM.mult(dataMatrix, basis, scores);

        double[][] result = new double[scores.numRows][scores.numCols];
        for (int i = 0; i < scores.numRows; i++)
            for (int j = 0; j < scores.numCols; j++)
                result[i][j] = scores.get(i, j);
        return result;
    }

    private static DMatrixRMaj toWorkingMatrix(double[][] data, int numComponents) {
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
        DMatrixRMaj x = new DMatrixRMaj(data);
        // directions are scale-invariant, bring the largest entry to 1 so products neither overflow nor underflow
        double maxAbs = CommonOps_DDRM.elementMaxAbs(x);
        if (maxAbs > 0)
            CommonOps_DDRM.divide(x, maxAbs);
        return x;
    }

    private static void checkDirection(DMatrixRMaj x, DMatrixRMaj mu) {
        if (mu == null || mu.numRows != x.numCols || mu.numCols != 1)
            throw new IllegalArgumentException("Expected a " + x.numCols + "×1 direction, but " + (mu == null ? "none" : mu.numRows + "×" + mu.numCols) + " appeared.");
    }

    private static void normalize(DMatrixRMaj v, String phase) {
        double norm = NormOps_DDRM.normF(v);
        if (norm == 0 || Double.isNaN(norm) || Double.isInfinite(norm))
            throw new DegenerateSubspaceException("degenerate subspace, candidate direction has norm " + norm + " after " + phase);
        CommonOps_DDRM.divide(v, norm);
    }

    private static double maxAbsDifference(DMatrixRMaj a, DMatrixRMaj b) {
        double max = 0;
        for (int i = 0; i < a.data.length; i++)
            max = Math.max(max, Math.abs(a.data[i] - b.data[i]));
        return max;
    }

    /**
     * A single direction returned by the Grassmann median loop.
     */
    public static class DirectionEstimate {
        public final DMatrixRMaj direction;
        public final int iterations;
        public final boolean converged;

        public DirectionEstimate(DMatrixRMaj direction, int iterations, boolean converged) {
            this.direction = direction;
            this.iterations = iterations;
            this.converged = converged;
        }

        public DMatrixRMaj getDirection() {
            return direction;
        }

        public int getIterations() {
            return iterations;
        }

        public boolean isConverged() {
            return converged;
        }
    }

    public static class BasisResult {
        public final DMatrixRMaj vectors;
        public final int[] iterations;
        public final boolean[] converged;

        public BasisResult(DMatrixRMaj vectors, int[] iterations, boolean[] converged) {
            this.vectors = vectors;
            this.iterations = iterations;
            this.converged = converged;
        }

        /** D×K matrix, one basis vector per column. */
        public DMatrixRMaj getVectors() {
            return vectors;
        }

        public int getNumComponents() {
            return vectors.numCols;
        }

        public double[] getVector(int which) {
            if (which < 0 || which >= vectors.numCols)
                throw new IllegalArgumentException("Invalid component: " + which);
            double[] v = new double[vectors.numRows];
            for (int i = 0; i < v.length; i++)
                v[i] = vectors.get(i, which);
            return v;
        }

        /** Number of Grassmann median iterations spent on each component. */
        public int[] getIterations() {
            return iterations;
        }

        public boolean[] getConverged() {
            return converged;
        }

        public double[][] toArray() {
            double[][] result = new double[vectors.numRows][vectors.numCols];
            for (int i = 0; i < vectors.numRows; i++)
                for (int j = 0; j < vectors.numCols; j++)
                    result[i][j] = vectors.get(i, j);
            return result;
        }
    }
}
