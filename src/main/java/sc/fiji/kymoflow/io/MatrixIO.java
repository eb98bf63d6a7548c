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

package sc.fiji.kymoflow.io;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import sc.fiji.kymoflow.DataIntegrityException;
import sc.fiji.kymoflow.IntervalCatalog;
import sc.fiji.kymoflow.KymoFlowUtils;
import sc.fiji.kymoflow.RangeException;
import sc.fiji.kymoflow.Segment;
import sc.fiji.kymoflow.SegmentCatalog;
import sc.fiji.kymoflow.analysis.ComputationAnomaly;
import sc.fiji.kymoflow.analysis.FlowAnalysisResult;
import sc.fiji.kymoflow.analysis.ValueMatrix;
import sc.fiji.kymoflow.analysis.VelocityEntry;
import sc.fiji.kymoflow.analysis.VelocityMatrix;

/**
 * Reads and writes analysis matrices as delimited text.
 * <p>
 * Matrix files start with a comment row ({@code //}) naming each segment
 * column, followed by one comma-separated row per interval (ascending). Cells
 * hold two-decimal numbers, the sentinel tokens {@code short}/{@code out}
 * (velocity matrices), or {@code NaN} (undefined angles and fits). Existing
 * files are always backed up before being overwritten.
 * </p>
 */
public class MatrixIO {

	public static final String VELOCITY_FILE = "velocity.csv";
	public static final String ANGLE_FILE = "angle.csv";
	public static final String FIT_FILE = "fit.csv";
	public static final String SUMMARY_FILE = "segment_summary.csv";
	public static final String ANOMALIES_FILE = "anomalies.csv";

	private static final String COMMENT = "//";
	private static final char SEP = ',';

	private MatrixIO() {}

	/**
	 * Writes all the tables of an analysis (velocity, angle, fit, summary and
	 * anomalies) into a directory.
	 *
	 * @param result the analysis result
	 * @param dir    the output directory (created if needed)
	 * @throws IOException if a file could not be written
	 */
	public static void saveAll(final FlowAnalysisResult result, final File dir) throws IOException {
		final List<String> names = result.getSegments().getNames();
		saveVelocities(result.getVelocities(), names, new File(dir, VELOCITY_FILE));
		saveValues(result.getAngles(), names, new File(dir, ANGLE_FILE));
		saveValues(result.getFits(), names, new File(dir, FIT_FILE));
		saveSummary(result.getVelocities(), result.getSegments(), new File(dir, SUMMARY_FILE));
		saveAnomalies(result.getAnomalies(), new File(dir, ANOMALIES_FILE));
	}

	public static void saveVelocities(final VelocityMatrix matrix, final List<String> segmentNames, final File file)
			throws IOException {
		checkHeader(matrix.getColumnCount(), segmentNames);
		if (!matrix.isComplete()) throw new IllegalStateException("Velocity matrix has empty cells");
		try (PrintWriter pw = openWriter(file)) {
			printHeader(pw, segmentNames);
			for (int i = 1; i <= matrix.getRowCount(); i++) {
				final List<VelocityEntry> row = matrix.getRow(i);
				for (int j = 0; j < row.size(); j++) {
					if (j > 0) pw.print(SEP);
					pw.print(row.get(j).toToken());
				}
				pw.println();
			}
			KymoFlowUtils.checkError(pw, file);
		}
	}

	public static void saveValues(final ValueMatrix matrix, final List<String> segmentNames, final File file)
			throws IOException {
		checkHeader(matrix.getColumnCount(), segmentNames);
		try (PrintWriter pw = openWriter(file)) {
			printHeader(pw, segmentNames);
			for (int i = 1; i <= matrix.getRowCount(); i++) {
				final double[] row = matrix.getRow(i);
				for (int j = 0; j < row.length; j++) {
					if (j > 0) pw.print(SEP);
					pw.print(KymoFlowUtils.formatDouble(row[j], 2));
				}
				pw.println();
			}
			KymoFlowUtils.checkError(pw, file);
		}
	}

	/**
	 * Writes per-segment statistics of the numeric velocities of a matrix: count,
	 * mean, SD, min and max (µm/s), plus the number of sentinel cells.
	 */
	public static void saveSummary(final VelocityMatrix matrix, final SegmentCatalog segments, final File file)
			throws IOException {
		try (PrintWriter pw = openWriter(file)) {
			pw.println("Segment,Length (um),N,Mean (um/s),SD (um/s),Min (um/s),Max (um/s),Short,Out");
			for (final Segment segment : segments) {
				final SummaryStatistics stats = new SummaryStatistics();
				int nShort = 0;
				int nOut = 0;
				for (final VelocityEntry e : matrix.getColumn(segment.getId())) {
					if (e == null) continue;
					switch (e.getKind()) {
					case NUMERIC:
						stats.addValue(e.getValue());
						break;
					case TOO_SHORT:
						nShort++;
						break;
					default:
						nOut++;
					}
				}
				KymoFlowUtils.csvQuoteAndPrint(pw, segment.getName());
				pw.print(SEP);
				pw.print(KymoFlowUtils.formatDouble(segment.getLength(), 2));
				pw.print(SEP);
				pw.print(stats.getN());
				pw.print(SEP);
				pw.print(KymoFlowUtils.formatDouble(stats.getMean(), 2));
				pw.print(SEP);
				pw.print(KymoFlowUtils.formatDouble(stats.getStandardDeviation(), 2));
				pw.print(SEP);
				pw.print(KymoFlowUtils.formatDouble(stats.getMin(), 2));
				pw.print(SEP);
				pw.print(KymoFlowUtils.formatDouble(stats.getMax(), 2));
				pw.print(SEP);
				pw.print(nShort);
				pw.print(SEP);
				pw.println(nOut);
			}
			KymoFlowUtils.checkError(pw, file);
		}
	}

	public static void saveAnomalies(final List<ComputationAnomaly> anomalies, final File file) throws IOException {
		try (PrintWriter pw = openWriter(file)) {
			pw.println("Segment,Interval,Raw angle (rad)");
			for (final ComputationAnomaly a : anomalies) {
				pw.print(a.getSegmentId());
				pw.print(SEP);
				pw.print(a.getIntervalId());
				pw.print(SEP);
				pw.println(a.getRawAngle());
			}
			KymoFlowUtils.checkError(pw, file);
		}
	}

	/**
	 * Reads a velocity matrix, checking it against the catalogs it is supposed to
	 * describe.
	 *
	 * @param file      the velocity file
	 * @param segments  the segments (columns)
	 * @param intervals the intervals (rows)
	 * @return the matrix
	 * @throws RangeException         if the number of rows differs from the
	 *                                number of intervals, or a row does not hold
	 *                                one cell per segment
	 * @throws DataIntegrityException if a cell is neither a number nor a sentinel
	 * @throws IOException            if the file could not be read
	 */
	public static VelocityMatrix loadVelocities(final File file, final SegmentCatalog segments,
			final IntervalCatalog intervals) throws IOException {
		final List<String[]> rows = readRows(file);
		if (rows.size() != intervals.size())
			throw new RangeException(file.getName() + " holds " + rows.size() + " row(s) but " + intervals.size()
					+ " interval(s) are defined");
		final List<List<VelocityEntry>> entries = new ArrayList<>(rows.size());
		for (int i = 0; i < rows.size(); i++) {
			final String[] cells = checkColumns(rows.get(i), i + 1, segments.size(), file);
			final List<VelocityEntry> row = new ArrayList<>(cells.length);
			for (final String cell : cells) {
				try {
					row.add(VelocityEntry.fromToken(cell));
				} catch (final NumberFormatException e) {
					throw new DataIntegrityException(i + 1, "invalid velocity '" + cell + "' in " + file.getName());
				}
			}
			entries.add(row);
		}
		return VelocityMatrix.of(entries);
	}

	/**
	 * Reads a purely numeric matrix (e.g., angles or fits).
	 *
	 * @param file      the matrix file
	 * @param name      the name of the returned matrix
	 * @param nSegments the expected number of columns
	 * @return the matrix
	 * @throws RangeException         if a row does not hold {@code nSegments}
	 *                                cells
	 * @throws DataIntegrityException if a cell holds a sentinel or is not a
	 *                                number
	 * @throws IOException            if the file could not be read
	 */
	public static ValueMatrix loadValues(final File file, final String name, final int nSegments) throws IOException {
		final List<String[]> rows = readRows(file);
		final ValueMatrix matrix = new ValueMatrix(name, rows.size(), nSegments);
		for (int i = 0; i < rows.size(); i++) {
			final String[] cells = checkColumns(rows.get(i), i + 1, nSegments, file);
			for (int j = 0; j < cells.length; j++) {
				final String cell = cells[j].trim();
				if (isSentinel(cell))
					throw new DataIntegrityException(i + 1, "sentinel '" + cell + "' found in numeric column "
							+ (j + 1) + " of " + file.getName());
				try {
					matrix.put(i + 1, j + 1, Double.parseDouble(cell));
				} catch (final NumberFormatException e) {
					throw new DataIntegrityException(i + 1, "invalid number '" + cell + "' in " + file.getName());
				}
			}
		}
		return matrix;
	}

	private static boolean isSentinel(final String token) {
		return VelocityEntry.Kind.TOO_SHORT.getToken().equalsIgnoreCase(token)
				|| VelocityEntry.Kind.OUT_OF_RANGE.getToken().equalsIgnoreCase(token);
	}

	private static String[] checkColumns(final String[] cells, final int row, final int expected, final File file) {
		if (cells.length != expected)
			throw new RangeException("Row " + row + " of " + file.getName() + " holds " + cells.length
					+ " cell(s) but " + expected + " segment(s) are defined");
		return cells;
	}

	static List<String[]> readRows(final File file) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
			return readRows(reader);
		}
	}

	static List<String[]> readRows(final Reader reader) throws IOException {
		final BufferedReader br = (reader instanceof BufferedReader) ? (BufferedReader) reader
				: new BufferedReader(reader);
		final List<String[]> rows = new ArrayList<>();
		String line;
		while ((line = br.readLine()) != null) {
			final String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith(COMMENT)) continue;
			rows.add(StringUtils.splitPreserveAllTokens(trimmed, SEP));
		}
		return rows;
	}

	private static void checkHeader(final int nColumns, final List<String> segmentNames) {
		if (segmentNames.size() != nColumns)
			throw new IllegalArgumentException(segmentNames.size() + " segment names given for " + nColumns
					+ " columns");
	}

	private static void printHeader(final PrintWriter pw, final List<String> segmentNames) {
		pw.print(COMMENT);
		pw.print(' ');
		for (int j = 0; j < segmentNames.size(); j++) {
			if (j > 0) pw.print(SEP);
			KymoFlowUtils.csvQuoteAndPrint(pw, segmentNames.get(j));
		}
		pw.println();
	}

	private static PrintWriter openWriter(final File file) throws IOException {
		KymoFlowUtils.prepareForWriting(file);
		final BufferedWriter bw = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8);
		return new PrintWriter(bw);
	}

}
