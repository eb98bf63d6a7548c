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

package sc.fiji.kymoflow.analysis.orientation;

/**
 * The dominant orientation of a kymograph and how well the data supports it.
 * <p>
 * The angle is expressed in radians, in kymograph coordinates (X: position
 * along the segment, Y: time, increasing downwards), measured from the X axis
 * and folded into {@code [0, π)}. A streak produced by material moving
 * {@code v} pixels per frame in the direction of increasing position has
 * {@code tan(angle) = 1/v}. Either field may be NaN when no orientation could
 * be estimated.
 * </p>
 */
public class OrientationResult {

	private final double angle;
	private final double fitGoodness;

	public OrientationResult(final double angle, final double fitGoodness) {
		this.angle = angle;
		this.fitGoodness = fitGoodness;
	}

	/** @return a result flagging that no orientation could be estimated */
	public static OrientationResult undefined() {
		return new OrientationResult(Double.NaN, Double.NaN);
	}

	/** @return the dominant angle in radians */
	public double getAngle() {
		return angle;
	}

	/** @return the dominant angle in degrees */
	public double getAngleDegrees() {
		return Math.toDegrees(angle);
	}

	/** @return the goodness of fit, between 0 (no preferred orientation) and 1 */
	public double getFitGoodness() {
		return fitGoodness;
	}

	/** @return true if both angle and goodness are finite numbers */
	public boolean isFinite() {
		return Double.isFinite(angle) && Double.isFinite(fitGoodness);
	}

	@Override
	public String toString() {
		return String.format("OrientationResult[angle=%.4f rad, fit=%.4f]", angle, fitGoodness);
	}

}
