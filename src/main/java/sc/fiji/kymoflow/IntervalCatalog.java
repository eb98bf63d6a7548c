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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * The ordered set of non-overlapping frame ranges analyzed in a run. Gaps
 * between intervals (e.g., motion-corrupted spans) are allowed.
 * <p>
 * Persisted as plain text, one {@code startFrame,endFrame} pair per line.
 * Lines starting with {@code //} are comments and blank lines are ignored.
 * </p>
 */
public class IntervalCatalog implements Iterable<Interval> {

	public static final String COMMENT = "//";

	private final List<Interval> intervals;

	/**
	 * @param intervals the intervals, ordered by ascending id (ids 1..n). Ranges
	 *                  must be ascending and must not overlap
	 */
	public IntervalCatalog(final List<Interval> intervals) {
		if (intervals == null) throw new IllegalArgumentException("Intervals cannot be null");
		for (int i = 0; i < intervals.size(); i++) {
			final Interval current = intervals.get(i);
			if (current.getId() != i + 1)
				throw new IllegalArgumentException("Interval ids must be consecutive starting at 1: found #"
						+ current.getId() + " at position " + (i + 1));
			if (i > 0 && current.getStart() <= intervals.get(i - 1).getEnd())
				throw new IllegalArgumentException(current + " overlaps or precedes " + intervals.get(i - 1));
		}
		this.intervals = Collections.unmodifiableList(new ArrayList<>(intervals));
	}

	/**
	 * Assembles a catalog from (start, end) pairs, assigning ids in list order.
	 *
	 * @param ranges the {start, end} frame pairs
	 * @return the catalog
	 */
	public static IntervalCatalog of(final int[]... ranges) {
		final List<Interval> list = new ArrayList<>(ranges.length);
		for (int i = 0; i < ranges.length; i++) {
			list.add(new Interval(i + 1, ranges[i][0], ranges[i][1]));
		}
		return new IntervalCatalog(list);
	}

	public static IntervalCatalog load(final File file) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
			return parse(reader);
		}
	}

	public static IntervalCatalog parse(final String text) {
		try {
			return parse(new StringReader(text));
		} catch (final IOException e) {
			throw new IllegalStateException(e); // cannot happen with a StringReader
		}
	}

	/**
	 * Parses the interval text format.
	 *
	 * @throws IllegalArgumentException if a line is malformed or intervals
	 *                                  overlap
	 */
	public static IntervalCatalog parse(final Reader reader) throws IOException {
		final BufferedReader br = (reader instanceof BufferedReader) ? (BufferedReader) reader
				: new BufferedReader(reader);
		final List<Interval> list = new ArrayList<>();
		String line;
		int lineNumber = 0;
		while ((line = br.readLine()) != null) {
			lineNumber++;
			final String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith(COMMENT)) continue;
			final String[] fields = StringUtils.splitPreserveAllTokens(trimmed, ',');
			if (fields.length != 2)
				throw new IllegalArgumentException("Line " + lineNumber + ": expected 'startFrame,endFrame' but got '"
						+ trimmed + "'");
			try {
				list.add(new Interval(list.size() + 1, Integer.parseInt(fields[0].trim()),
						Integer.parseInt(fields[1].trim())));
			} catch (final NumberFormatException e) {
				throw new IllegalArgumentException("Line " + lineNumber + ": invalid frame number in '" + trimmed + "'");
			}
		}
		return new IntervalCatalog(list);
	}

	/**
	 * Writes this catalog in the interval text format. An existing file is backed
	 * up first.
	 */
	public void save(final File file) throws IOException {
		KymoFlowUtils.prepareForWriting(file);
		try (BufferedWriter bw = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8);
				PrintWriter pw = new PrintWriter(bw)) {
			pw.print(toText());
		}
	}

	public String toText() {
		final StringBuilder sb = new StringBuilder();
		sb.append(COMMENT).append(" startFrame,endFrame\n");
		intervals.forEach(iv -> sb.append(iv.getStart()).append(',').append(iv.getEnd()).append('\n'));
		return sb.toString();
	}

	/**
	 * Ensures every interval lies within the frames of a video.
	 *
	 * @param frameCount the number of frames available
	 * @throws RangeException if an interval exceeds {@code frameCount}
	 */
	public void validateAgainst(final int frameCount) {
		for (final Interval iv : intervals) {
			if (!iv.fitsWithin(frameCount))
				throw new RangeException(iv + " exceeds the " + frameCount + " frames available in the video");
		}
	}

	public int size() {
		return intervals.size();
	}

	public boolean isEmpty() {
		return intervals.isEmpty();
	}

	/**
	 * @param id the 1-based interval id
	 * @return the interval
	 */
	public Interval get(final int id) {
		if (id < 1 || id > intervals.size())
			throw new IndexOutOfBoundsException("No interval #" + id);
		return intervals.get(id - 1);
	}

	public List<Interval> list() {
		return intervals;
	}

	@Override
	public Iterator<Interval> iterator() {
		return intervals.iterator();
	}

}
