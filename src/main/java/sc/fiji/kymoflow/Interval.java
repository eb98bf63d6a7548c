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
 * A span of video frames selected for analysis. Frames are 1-based and both
 * bounds are inclusive.
 */
public class Interval {

	private final int id;
	private final int start;
	private final int end;

	/**
	 * @param id    the 1-based ordinal of this interval in its catalog
	 * @param start the first frame (inclusive, 1-based)
	 * @param end   the last frame (inclusive)
	 */
	public Interval(final int id, final int start, final int end) {
		if (id < 1) throw new IllegalArgumentException("Interval id must be >= 1");
		if (start < 1) throw new IllegalArgumentException("Interval " + id + ": first frame must be >= 1");
		if (end < start)
			throw new IllegalArgumentException("Interval " + id + ": end frame (" + end + ") precedes start frame ("
					+ start + ")");
		this.id = id;
		this.start = start;
		this.end = end;
	}

	public int getId() {
		return id;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	/** @return the number of frames in this interval (end - start + 1) */
	public int getFrameCount() {
		return end - start + 1;
	}

	/**
	 * @param frameCount the number of frames available in a video
	 * @return true if this interval lies entirely within {@code [1, frameCount]}
	 */
	public boolean fitsWithin(final int frameCount) {
		return end <= frameCount;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof Interval)) return false;
		final Interval other = (Interval) o;
		return id == other.id && start == other.start && end == other.end;
	}

	@Override
	public int hashCode() {
		return 31 * (31 * id + start) + end;
	}

	@Override
	public String toString() {
		return "Interval " + id + " [" + start + "-" + end + "]";
	}

}
