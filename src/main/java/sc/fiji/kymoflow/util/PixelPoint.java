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

package sc.fiji.kymoflow.util;

import java.util.Objects;

/**
 * A 2D point in (uncalibrated) pixel coordinates of a video frame.
 */
public class PixelPoint {

	/** The X-coordinate of the point */
	public final double x;

	/** The Y-coordinate of the point */
	public final double y;

	public PixelPoint(final double x, final double y) {
		this.x = x;
		this.y = y;
	}

	/** @return the X-coordinate of the point */
	public double getX() {
		return x;
	}

	/** @return the Y-coordinate of the point */
	public double getY() {
		return y;
	}

	/**
	 * @param other the second point
	 * @return the Euclidean distance (in pixels) between this point and
	 *         {@code other}
	 */
	public double distanceTo(final PixelPoint other) {
		final double dx = other.x - x;
		final double dy = other.y - y;
		return Math.sqrt(dx * dx + dy * dy);
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof PixelPoint)) return false;
		final PixelPoint other = (PixelPoint) o;
		return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(x, y);
	}

	@Override
	public String toString() {
		return "[" + x + ", " + y + "]";
	}

}
