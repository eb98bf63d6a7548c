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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import sc.fiji.kymoflow.DataIntegrityException;

/**
 * The (interval x segment) matrix of {@link VelocityEntry velocity entries}.
 * Rows are intervals in ascending id, columns segments in ascending id. Cells
 * are inserted by (interval, segment) key, so that parallel analyses assemble
 * the same matrix regardless of completion order. Thread-safe.
 */
public class VelocityMatrix {

	private final VelocityEntry[][] cells;
	private final int nSegments;

	public VelocityMatrix(final int nIntervals, final int nSegments) {
		if (nIntervals < 0 || nSegments < 0) throw new IllegalArgumentException("Negative dimensions");
		this.nSegments = nSegments;
		cells = new VelocityEntry[nIntervals][nSegments];
	}

	/**
	 * Assembles a matrix from ordered rows, e.g., as read from disk.
	 *
	 * @param rows the rows, one per interval. All rows must have the same length
	 * @return the matrix
	 */
	public static VelocityMatrix of(final List<List<VelocityEntry>> rows) {
		final int nSegments = (rows.isEmpty()) ? 0 : rows.get(0).size();
		final VelocityMatrix matrix = new VelocityMatrix(rows.size(), nSegments);
		for (int i = 0; i < rows.size(); i++) {
			final List<VelocityEntry> row = rows.get(i);
			if (row.size() != nSegments)
				throw new IllegalArgumentException("Row " + (i + 1) + " has " + row.size() + " cells, expected "
						+ nSegments);
			for (int j = 0; j < nSegments; j++)
				matrix.put(i + 1, j + 1, row.get(j));
		}
		return matrix;
	}

	public int getRowCount() {
		return cells.length;
	}

	public int getColumnCount() {
		return nSegments;
	}

	public synchronized void put(final int intervalId, final int segmentId, final VelocityEntry entry) {
		if (entry == null) throw new IllegalArgumentException("Entry cannot be null");
		checkKey(intervalId, segmentId);
		cells[intervalId - 1][segmentId - 1] = entry;
	}

	/**
	 * @return the entry at (interval, segment), or null if it was never set
	 */
	public synchronized VelocityEntry get(final int intervalId, final int segmentId) {
		checkKey(intervalId, segmentId);
		return cells[intervalId - 1][segmentId - 1];
	}

	/** @return a copy of the row of an interval */
	public synchronized List<VelocityEntry> getRow(final int intervalId) {
		checkRow(intervalId);
		return new ArrayList<>(Arrays.asList(cells[intervalId - 1]));
	}

	/** @return a copy of the column of a segment, in interval order */
	public synchronized List<VelocityEntry> getColumn(final int segmentId) {
		checkColumn(segmentId);
		final List<VelocityEntry> column = new ArrayList<>(cells.length);
		for (final VelocityEntry[] row : cells)
			column.add(row[segmentId - 1]);
		return column;
	}

	/** @return true if every cell has been set */
	public synchronized boolean isComplete() {
		for (final VelocityEntry[] row : cells)
			for (final VelocityEntry e : row)
				if (e == null) return false;
		return true;
	}

	/**
	 * Retrieves the numeric velocities of a row, for consumers that cannot
	 * handle sentinels.
	 *
	 * @param intervalId the interval (row)
	 * @return the velocities (µm/s)
	 * @throws DataIntegrityException if the row holds a sentinel or unset cell
	 */
	public synchronized double[] getNumericRow(final int intervalId) {
		final List<VelocityEntry> row = getRow(intervalId);
		final double[] values = new double[row.size()];
		for (int j = 0; j < values.length; j++) {
			final VelocityEntry e = row.get(j);
			if (e == null || !e.isNumeric())
				throw new DataIntegrityException(intervalId, "segment " + (j + 1) + " holds "
						+ ((e == null) ? "no value" : "sentinel '" + e.toToken() + "'") + " where a number is required");
			values[j] = e.getValue();
		}
		return values;
	}

	/** @return the number of cells of the given kind */
	public synchronized int count(final VelocityEntry.Kind kind) {
		int count = 0;
		for (final VelocityEntry[] row : cells)
			for (final VelocityEntry e : row)
				if (e != null && e.getKind() == kind) count++;
		return count;
	}

	private void checkKey(final int intervalId, final int segmentId) {
		checkRow(intervalId);
		checkColumn(segmentId);
	}

	private void checkRow(final int intervalId) {
		if (intervalId < 1 || intervalId > cells.length)
			throw new IndexOutOfBoundsException("Interval " + intervalId + " not in 1-" + cells.length);
	}

	private void checkColumn(final int segmentId) {
		if (segmentId < 1 || segmentId > nSegments)
			throw new IndexOutOfBoundsException("Segment " + segmentId + " not in 1-" + nSegments);
	}

	@Override
	public synchronized boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof VelocityMatrix)) return false;
		final VelocityMatrix other = (VelocityMatrix) o;
		return nSegments == other.nSegments && Arrays.deepEquals(cells, other.cells);
	}

	@Override
	public synchronized int hashCode() {
		return Arrays.deepHashCode(cells);
	}

	@Override
	public String toString() {
		return "VelocityMatrix [" + getRowCount() + "x" + getColumnCount() + "]";
	}

}
