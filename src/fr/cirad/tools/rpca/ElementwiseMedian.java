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

import java.util.Arrays;

/**
 * Median helpers used by the Grassmann median update. Even-sized sets yield the
 * mean of the two central order statistics.
 */
final class ElementwiseMedian {

    private ElementwiseMedian() {}

    /**
     * Median of the first <code>length</code> values. The array is sorted in place.
     */
    static double median(double[] values, int length) {
        if (length <= 0)
            throw new IllegalArgumentException("Cannot compute the median of an empty set");
        Arrays.sort(values, 0, length);
        int mid = length / 2;
        if (length % 2 == 1)
            return values[mid];
        return (values[mid - 1] + values[mid]) / 2d;
    }

    static float median(float[] values, int length) {
        if (length <= 0)
            throw new IllegalArgumentException("Cannot compute the median of an empty set");
        Arrays.sort(values, 0, length);
        int mid = length / 2;
        if (length % 2 == 1)
            return values[mid];
        return (values[mid - 1] + values[mid]) / 2f;
    }

    /**
     * Median over rows of column <code>col</code> of a row-major N×D array, each row
     * weighted by its sign. <code>buffer</code> must hold at least N values.
     */
    static double signedColumnMedian(double[] rowMajor, int numCols, double[] signs, int col, double[] buffer) {
        int numRows = signs.length;
        for (int row = 0; row < numRows; row++)
            buffer[row] = signs[row] * rowMajor[row * numCols + col];
        return median(buffer, numRows);
    }

    static float signedColumnMedian(float[] rowMajor, int numCols, float[] signs, int col, float[] buffer) {
        int numRows = signs.length;
        for (int row = 0; row < numRows; row++)
            buffer[row] = signs[row] * rowMajor[row * numCols + col];
        return median(buffer, numRows);
    }
}
