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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import sc.fiji.kymoflow.util.PixelPoint;

/**
 * The ordered, read-only set of vessel segments analyzed in a run. Segment ids
 * run from 1 to {@link #size()} in catalog order, and this order is used by
 * every pipeline stage.
 */
public class SegmentCatalog implements Iterable<Segment> {

	private final List<Segment> segments;

	/**
	 * @param segments the segments, ordered by ascending id. Ids must be 1..n
	 */
	public SegmentCatalog(final List<Segment> segments) {
		if (segments == null) throw new IllegalArgumentException("Segments cannot be null");
		for (int i = 0; i < segments.size(); i++) {
			if (segments.get(i).getId() != i + 1)
				throw new IllegalArgumentException("Segment ids must be consecutive starting at 1: found #"
						+ segments.get(i).getId() + " at position " + (i + 1));
		}
		this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
	}

	/**
	 * Assembles a catalog from raw polylines, assigning ids in list order.
	 *
	 * @param names     the display names (null entries allowed). Null allowed
	 * @param polylines the node lists
	 * @param pixelSize the physical size of a pixel (µm)
	 * @return the catalog
	 */
	public static SegmentCatalog of(final List<String> names, final List<List<PixelPoint>> polylines,
			final double pixelSize) {
		final List<Segment> list = new ArrayList<>(polylines.size());
		for (int i = 0; i < polylines.size(); i++) {
			final String name = (names == null || i >= names.size()) ? null : names.get(i);
			list.add(new Segment(i + 1, name, polylines.get(i), pixelSize));
		}
		return new SegmentCatalog(list);
	}

	public int size() {
		return segments.size();
	}

	public boolean isEmpty() {
		return segments.isEmpty();
	}

	/**
	 * @param id the 1-based segment id
	 * @return the segment
	 */
	public Segment get(final int id) {
		if (id < 1 || id > segments.size())
			throw new IndexOutOfBoundsException("No segment #" + id);
		return segments.get(id - 1);
	}

	public List<Segment> list() {
		return segments;
	}

	/** @return the display names in catalog order */
	public List<String> getNames() {
		final List<String> names = new ArrayList<>(segments.size());
		segments.forEach(s -> names.add(s.getName()));
		return names;
	}

	/**
	 * @param pixelSize the physical size of a pixel (µm)
	 * @return a copy of this catalog with every segment recalibrated
	 */
	public SegmentCatalog withPixelSize(final double pixelSize) {
		final List<Segment> list = new ArrayList<>(segments.size());
		segments.forEach(s -> list.add(s.withPixelSize(pixelSize)));
		return new SegmentCatalog(list);
	}

	@Override
	public Iterator<Segment> iterator() {
		return segments.iterator();
	}

}
