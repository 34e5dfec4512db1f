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

/**
 * Thrown when a candidate direction cannot be renormalized because its norm is
 * zero or not finite, which happens on degenerate input (e.g. all-zero data, or a
 * residual with nothing left to explain).
 */
public class DegenerateSubspaceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DegenerateSubspaceException(String message) {
        super(message);
    }

    public DegenerateSubspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
