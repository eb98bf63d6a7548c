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

package sc.fiji.kymoflow.analysis;

import java.util.Arrays;

/**
 * A dense (interval x segment) matrix of doubles, used for kymograph angles and
 * fit-goodness scores. Rows are intervals in ascending id, columns segments in
 * ascending id. Cells are inserted by key, so the final layout does not depend
 * on insertion order. Unset cells hold {@code NaN}. Thread-safe.
 */
public class ValueMatrix {

	private final String name;
	private final double[][] cells;

	/**
	 * @param name      a descriptive name, e.g., "Angle"
	 * @param nIntervals the number of rows
	 * @param nSegments  the number of columns
	 */
	public ValueMatrix(final String name, final int nIntervals, final int nSegments) {
		if (nIntervals < 0 || nSegments < 0) throw new IllegalArgumentException("Negative dimensions");
		this.name = name;
		cells = new double[nIntervals][nSegments];
		for (final double[] row : cells)
			Arrays.fill(row, Double.NaN);
	}

	public String getName() {
		return name;
	}

	public int getRowCount() {
		return cells.length;
	}

	public int getColumnCount() {
		return (cells.length == 0) ? 0 : cells[0].length;
	}

	/**
	 * @param intervalId the 1-based interval id (row)
	 * @param segmentId  the 1-based segment id (column)
	 * @param value      the cell value
	 */
	public synchronized void put(final int intervalId, final int segmentId, final double value) {
		checkKey(intervalId, segmentId);
		cells[intervalId - 1][segmentId - 1] = value;
	}

	public synchronized double get(final int intervalId, final int segmentId) {
		checkKey(intervalId, segmentId);
		return cells[intervalId - 1][segmentId - 1];
	}

	/** @return a copy of the (1-based) row of an interval */
	public synchronized double[] getRow(final int intervalId) {
		if (intervalId < 1 || intervalId > getRowCount())
			throw new IndexOutOfBoundsException("Interval " + intervalId + " not in 1-" + getRowCount());
		return cells[intervalId - 1].clone();
	}

	private void checkKey(final int intervalId, final int segmentId) {
		if (intervalId < 1 || intervalId > getRowCount())
			throw new IndexOutOfBoundsException("Interval " + intervalId + " not in 1-" + getRowCount());
		if (segmentId < 1 || segmentId > getColumnCount())
			throw new IndexOutOfBoundsException("Segment " + segmentId + " not in 1-" + getColumnCount());
	}

	@Override
	public synchronized boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof ValueMatrix)) return false;
		return Arrays.deepEquals(cells, ((ValueMatrix) o).cells);
	}

	@Override
	public synchronized int hashCode() {
		return Arrays.deepHashCode(cells);
	}

	@Override
	public String toString() {
		return name + " [" + getRowCount() + "x" + getColumnCount() + "]";
	}

}
