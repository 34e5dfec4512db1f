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

/**
 * Preparation of an N×D observation matrix before a basis is estimated: missing
 * value imputation, centering and scaling. None of these methods modify their
 * input, a new array is always returned.
 */
public final class DataPreprocessor {

    static private final Logger LOG = Logger.getLogger(DataPreprocessor.class);

    private DataPreprocessor() {}

    public static boolean hasInvalidValues(double[][] data) {
        for (double[] row : data)
            for (double val : row)
                if (Double.isNaN(val) || Double.isInfinite(val))
                    return true;
        return false;
    }

    public static boolean hasInvalidValues(float[][] data) {
        for (float[] row : data)
            for (float val : row)
                if (Float.isNaN(val) || Float.isInfinite(val))
                    return true;
        return false;
    }

    /**
     * Replaces NaN values with the mean of the non-missing values of their column.
     * A column with no value at all is filled with zeros.
     */
    public static double[][] imputeMissingValues(double[][] data) {
        int numRows = data.length;
        int numCols = numRows == 0 ? 0 : data[0].length;

        double[] means = new double[numCols];
        int[] counts = new int[numCols];
        for (double[] row : data)
            for (int col = 0; col < numCols; col++)
                if (!Double.isNaN(row[col])) {
                    means[col] += row[col];
                    counts[col]++;
                }

        int nEmptyColumns = 0;
        for (int col = 0; col < numCols; col++) {
            if (counts[col] == 0)
                nEmptyColumns++;
            means[col] = counts[col] > 0 ? means[col] / counts[col] : 0d;
        }
        if (nEmptyColumns > 0)
            LOG.warn(nEmptyColumns + " column(s) contain no value at all and were filled with zeros");

        double[][] imputedData = new double[numRows][];
        for (int row = 0; row < numRows; row++) {
            imputedData[row] = new double[numCols];
            for (int col = 0; col < numCols; col++)
                imputedData[row][col] = Double.isNaN(data[row][col]) ? means[col] : data[row][col];
        }
        return imputedData;
    }

    public static float[][] imputeMissingValues(float[][] data) {
        int numRows = data.length;
        int numCols = numRows == 0 ? 0 : data[0].length;

        float[] means = new float[numCols];
        int[] counts = new int[numCols];
        for (float[] row : data)
            for (int col = 0; col < numCols; col++)
                if (!Float.isNaN(row[col])) {
                    means[col] += row[col];
                    counts[col]++;
                }
        int nEmptyColumns = 0;
        for (int col = 0; col < numCols; col++) {
            if (counts[col] == 0)
                nEmptyColumns++;
            means[col] = counts[col] > 0 ? means[col] / counts[col] : 0f;
        }
        if (nEmptyColumns > 0)
            LOG.warn(nEmptyColumns + " column(s) contain no value at all and were filled with zeros");

        float[][] imputedData = new float[numRows][];
        for (int row = 0; row < numRows; row++) {
            imputedData[row] = new float[numCols];
            for (int col = 0; col < numCols; col++)
                imputedData[row][col] = Float.isNaN(data[row][col]) ? means[col] : data[row][col];
        }
        return imputedData;
    }

    /**
     * Centers every column on its mean and scales it to unit standard deviation. A
     * constant column is only centered.
     */
    public static double[][] centerAndScaleData(double[][] data) {
        int numRows = data.length;
        int numCols = numRows == 0 ? 0 : data[0].length;

        double[] means = new double[numCols];
        double[] stdDevs = new double[numCols];

        for (int col = 0; col < numCols; col++) {
            double sum = 0;
            for (int row = 0; row < numRows; row++)
                sum += data[row][col];
            means[col] = sum / numRows;
        }

        for (int col = 0; col < numCols; col++) {
            double sum = 0;
            for (int row = 0; row < numRows; row++)
                sum += Math.pow(data[row][col] - means[col], 2);
            stdDevs[col] = sum == 0 || numRows < 2 ? 1d : Math.sqrt(sum / (numRows - 1));
        }

        double[][] centeredData = new double[numRows][];
        for (int row = 0; row < numRows; row++) {
            centeredData[row] = new double[numCols];
            for (int col = 0; col < numCols; col++)
                centeredData[row][col] = (data[row][col] - means[col]) / stdDevs[col];
        }
        return centeredData;
    }

    public static float[][] centerAndScaleData(float[][] data) {
        int numRows = data.length;
        int numCols = numRows == 0 ? 0 : data[0].length;

        float[] means = new float[numCols];
        float[] stdDevs = new float[numCols];

        for (int col = 0; col < numCols; col++) {
            float sum = 0;
            for (int row = 0; row < numRows; row++)
                sum += data[row][col];
            means[col] = sum / numRows;
        }

        for (int col = 0; col < numCols; col++) {
            float sum = 0;
            for (int row = 0; row < numRows; row++)
                sum += Math.pow(data[row][col] - means[col], 2);
            stdDevs[col] = sum == 0 || numRows < 2 ? 1f : (float) Math.sqrt(sum / (numRows - 1));
        }

        float[][] centeredData = new float[numRows][];
        for (int row = 0; row < numRows; row++) {
            centeredData[row] = new float[numCols];
            for (int col = 0; col < numCols; col++)
                centeredData[row][col] = (data[row][col] - means[col]) / stdDevs[col];
        }
        return centeredData;
    }

    /**
     * Subtracts from every column its median, the outlier-resistant counterpart of
     * mean centering.
     */
    public static double[][] centerByMedian(double[][] data) {
        int numRows = data.length;
        int numCols = numRows == 0 ? 0 : data[0].length;

        double[] medians = new double[numCols];
        double[] columnBuf = new double[numRows];
        for (int col = 0; col < numCols; col++) {
            for (int row = 0; row < numRows; row++)
                columnBuf[row] = data[row][col];
            medians[col] = ElementwiseMedian.median(columnBuf, numRows);
        }

        double[][] centeredData = new double[numRows][];
        for (int row = 0; row < numRows; row++) {
            centeredData[row] = new double[numCols];
            for (int col = 0; col < numCols; col++)
                centeredData[row][col] = data[row][col] - medians[col];
        }
        return centeredData;
    }

    public static float[][] centerByMedian(float[][] data) {
        int numRows = data.length;
        int numCols = numRows == 0 ? 0 : data[0].length;

        float[] medians = new float[numCols];
        float[] columnBuf = new float[numRows];
        for (int col = 0; col < numCols; col++) {
            for (int row = 0; row < numRows; row++)
                columnBuf[row] = data[row][col];
            medians[col] = ElementwiseMedian.median(columnBuf, numRows);
        }

        float[][] centeredData = new float[numRows][];
        for (int row = 0; row < numRows; row++) {
            centeredData[row] = new float[numCols];
            for (int col = 0; col < numCols; col++)
                centeredData[row][col] = data[row][col] - medians[col];
        }
        return centeredData;
    }
}
