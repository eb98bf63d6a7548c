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
import java.util.List;

import sc.fiji.kymoflow.util.PixelPoint;

/**
 * A traced vessel segment: an ordered polyline of pixel coordinates with a
 * stable 1-based id. Instances are immutable.
 */
public class Segment {

	private final int id;
	private final String name;
	private final List<PixelPoint> nodes;
	private final double pixelLength;
	private final double pixelSize;

	/**
	 * @param id        the 1-based ordinal of this segment in its catalog
	 * @param name      the display name. If null, {@code "Segment_<id>"} is used
	 * @param nodes     the polyline nodes, in pixel coordinates
	 * @param pixelSize the physical size of a pixel (µm)
	 */
	public Segment(final int id, final String name, final List<PixelPoint> nodes, final double pixelSize) {
		if (id < 1) throw new IllegalArgumentException("Segment id must be >= 1");
		if (nodes == null || nodes.isEmpty())
			throw new IllegalArgumentException("Segment " + id + " has no nodes");
		if (!(pixelSize > 0)) throw new IllegalArgumentException("Pixel size must be > 0");
		this.id = id;
		this.name = (name == null || name.isBlank()) ? "Segment_" + id : name;
		this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
		this.pixelSize = pixelSize;
		double length = 0;
		for (int i = 1; i < this.nodes.size(); i++) {
			length += this.nodes.get(i - 1).distanceTo(this.nodes.get(i));
		}
		this.pixelLength = length;
	}

	public int getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	/** @return the (unmodifiable) polyline nodes */
	public List<PixelPoint> getNodes() {
		return nodes;
	}

	public int size() {
		return nodes.size();
	}

	public PixelPoint getNode(final int index) {
		return nodes.get(index);
	}

	/** @return the length of the polyline in pixels */
	public double getPixelLength() {
		return pixelLength;
	}

	/** @return the physical length (µm), i.e., pixel-path length x pixel size */
	public double getLength() {
		return pixelLength * pixelSize;
	}

	public double getPixelSize() {
		return pixelSize;
	}

	/**
	 * Returns a copy of this segment calibrated with a different pixel size.
	 *
	 * @param newPixelSize the physical size of a pixel (µm)
	 * @return the recalibrated segment
	 */
	public Segment withPixelSize(final double newPixelSize) {
		return new Segment(id, name, nodes, newPixelSize);
	}

	@Override
	public String toString() {
		return name + " (#" + id + ", " + nodes.size() + " nodes)";
	}

}
