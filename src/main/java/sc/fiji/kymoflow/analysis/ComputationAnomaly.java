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

/**
 * Diagnostic record of a non-finite orientation or velocity that was recovered
 * by classifying the measurement as out of range.
 */
public class ComputationAnomaly {

	private final int segmentId;
	private final int intervalId;
	private final double rawAngle;

	public ComputationAnomaly(final int segmentId, final int intervalId, final double rawAngle) {
		this.segmentId = segmentId;
		this.intervalId = intervalId;
		this.rawAngle = rawAngle;
	}

	public int getSegmentId() {
		return segmentId;
	}

	public int getIntervalId() {
		return intervalId;
	}

	/** @return the angle (radians) reported by the estimator, possibly NaN */
	public double getRawAngle() {
		return rawAngle;
	}

	@Override
	public String toString() {
		return "Non-finite result for segment " + segmentId + ", interval " + intervalId + " (raw angle: " + rawAngle
				+ ")";
	}

}
