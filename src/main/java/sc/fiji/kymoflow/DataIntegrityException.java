/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package sc.fiji.kymoflow;

/**
 * Thrown when a persisted cell cannot be read as the value its consumer
 * requires, e.g., a sentinel token where a number is expected.
 */
public class DataIntegrityException extends KymoFlowException {

	private static final long serialVersionUID = 1L;
	private final int row;

	/**
	 * @param row     the 1-based data row holding the offending cell
	 * @param message the problem description
	 */
	public DataIntegrityException(final int row, final String message) {
		super("Row " + row + ": " + message);
		this.row = row;
	}

	/** @return the 1-based data row holding the offending cell */
	public int getRow() {
		return row;
	}

}
