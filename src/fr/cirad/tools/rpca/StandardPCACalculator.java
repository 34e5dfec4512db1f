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

import org.apache.log4j.Logger;

import cern.colt.matrix.tdouble.DoubleMatrix2D;
import cern.colt.matrix.tdouble.algo.decomposition.DenseDoubleSingularValueDecomposition;
import cern.colt.matrix.tdouble.impl.DenseColumnDoubleMatrix2D;
import cern.colt.matrix.tdouble.impl.DenseDoubleMatrix2D;

/**
 * Ordinary (mean-based) PCA computed by singular value decomposition, used as the
 * non-robust reference a Grassmann median basis is compared against. Like
 * {@link GrassmannMedianCalculator}, the data is used as given: center it
 * beforehand (see {@link DataPreprocessor}) if needed.
 */
public class StandardPCACalculator {

    static private final Logger LOG = Logger.getLogger(StandardPCACalculator.class);

    public PCAResult performPCA(double[][] data) {
        if (data == null || data.length == 0 || data[0].length == 0)
            throw new IllegalArgumentException("Data matrix must contain at least one observation and one feature");
        if (DataPreprocessor.hasInvalidValues(data)) {
            LOG.warn("Matrix contains NaN or Infinite values.");
            throw new IllegalArgumentException("Data matrix contains NaN or Infinite values, impute them first");
        }

        LOG.debug("Performing in-memory reference PCA using doubles: " + data.length + " × " + data[0].length);
        int numSamples = data.length;

        DenseColumnDoubleMatrix2D dataMatrix = new DenseColumnDoubleMatrix2D(data);
        DenseDoubleSingularValueDecomposition svd = new DenseDoubleSingularValueDecomposition(dataMatrix, true, false);
        double[] singularValues = svd.getSingularValues();
        DoubleMatrix2D eigenVectors = svd.getV();

        // Calculate eigenvalues from singular values
        double[] eigenValues = new double[singularValues.length];
        for (int i = 0; i < singularValues.length; i++)
            eigenValues[i] = (singularValues[i] * singularValues[i]) / Math.max(1, numSamples - 1);

        return new PCAResult(eigenVectors, eigenValues, singularValues);
    }

    /**
     * Projects observations onto the leading eigenvectors (all of them when
     * numEigenvectors is null).
     */
    public double[][] transformData(double[][] data, DoubleMatrix2D pcaMatrix, Integer numEigenvectors) {
        DoubleMatrix2D dataMatrix = new DenseDoubleMatrix2D(data);
        DoubleMatrix2D t = numEigenvectors == null ? pcaMatrix : pcaMatrix.viewPart(0, 0, data[0].length, numEigenvectors);
        DoubleMatrix2D transformedData = dataMatrix.zMult(t, null);
        return transformedData.toArray();
    }

    public static class PCAResult {
        private final DoubleMatrix2D eigenVectors;
        private final double[] eigenValues;
        private final double[] singularValues;

        public PCAResult(DoubleMatrix2D eigenVectors, double[] eigenValues, double[] singularValues) {
            this.eigenVectors = eigenVectors;
            this.eigenValues = eigenValues;
            this.singularValues = singularValues;
        }

        /** D×r matrix, one eigenvector per column, by decreasing eigenvalue. */
        public DoubleMatrix2D getEigenVectors() {
            return eigenVectors;
        }

        public double[] getEigenVector(int which) {
            return eigenVectors.viewColumn(which).toArray();
        }

        public double[] getEigenValues() {
            return eigenValues;
        }

        public double[] getSingularValues() {
            return singularValues;
        }
    }
}
