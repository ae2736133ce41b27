/*
 * Copyright (c) 2026.  Brockmann Consult GmbH (info@brockmann-consult.de)
 *
 * This program is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License as published by the Free
 * Software Foundation; either version 3 of the License, or (at your option)
 * any later version.
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for
 * more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, see http://www.gnu.org/licenses/
 *
 */

package org.esa.idepix.core;

/**
 * Thrown if an IdePix processing step cannot be carried out, e.g. because of malformed input
 * or unreadable auxiliary data.
 */
public class IdepixException extends RuntimeException {

    public IdepixException(String message) {
        super(message);
    }

    public IdepixException(String message, Throwable cause) {
        super(message, cause);
    }

    public IdepixException(Throwable cause) {
        super(cause);
    }
}
