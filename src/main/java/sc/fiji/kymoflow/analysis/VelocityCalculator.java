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
import java.util.Collections;
import java.util.List;

import sc.fiji.kymoflow.Interval;
import sc.fiji.kymoflow.KymoFlowUtils;
import sc.fiji.kymoflow.Segment;

/**
 * Converts kymograph orientations into flow velocities and applies the
 * validity policy:
 * <ol>
 * <li>segments shorter than the minimum length are {@code TOO_SHORT}</li>
 * <li>non-finite velocities, and velocities whose magnitude exceeds the
 * maximum measurable speed, are {@code OUT_OF_RANGE}</li>
 * <li>anything else is numeric, rounded to two decimals</li>
 * </ol>
 * Velocity is {@code (1 / tan(angle)) * frameRate * pixelSize} (µm/s). Non-finite
 * results are recorded as {@link ComputationAnomaly anomalies}. Instances are
 * thread-safe.
 */
public class VelocityCalculator {

	private final double frameRate;
	private final double pixelSize;
	private final double minSegmentLength;
	private final double maxMeasuredSpeed;
	private final List<ComputationAnomaly> anomalies;

	/**
	 * @param frameRate        the acquisition rate (frames per second)
	 * @param pixelSize        the physical size of a pixel (µm)
	 * @param minSegmentLength the shortest analyzable segment (µm)
	 * @param maxMeasuredSpeed the fastest plausible speed (µm/s)
	 */
	public VelocityCalculator(final double frameRate, final double pixelSize, final double minSegmentLength,
			final double maxMeasuredSpeed) {
		if (!(frameRate > 0)) throw new IllegalArgumentException("Frame rate must be > 0");
		if (!(pixelSize > 0)) throw new IllegalArgumentException("Pixel size must be > 0");
		if (!(minSegmentLength >= 0)) throw new IllegalArgumentException("Minimum segment length must be >= 0");
		if (!(maxMeasuredSpeed > 0)) throw new IllegalArgumentException("Maximum measured speed must be > 0");
		this.frameRate = frameRate;
		this.pixelSize = pixelSize;
		this.minSegmentLength = minSegmentLength;
		this.maxMeasuredSpeed = maxMeasuredSpeed;
		this.anomalies = Collections.synchronizedList(new ArrayList<>());
	}

	/**
	 * Converts an angle into a velocity, without applying any policy.
	 *
	 * @param angle the kymograph orientation (radians)
	 * @return the velocity (µm/s). Infinite when {@code tan(angle) == 0}, NaN if
	 *         angle is NaN
	 */
	public double toVelocity(final double angle) {
		return (1d / Math.tan(angle)) * frameRate * pixelSize;
	}

	/**
	 * Classifies a measurement.
	 *
	 * @param segmentLength the physical length of the segment (µm)
	 * @param angle         the kymograph orientation (radians)
	 * @return the velocity entry
	 */
	public VelocityEntry classify(final double segmentLength, final double angle) {
		return classify(-1, -1, segmentLength, angle);
	}

	/**
	 * Classifies the measurement of a (segment, interval) pair, recording an
	 * anomaly if the angle or the velocity is not finite.
	 *
	 * @param segment  the measured segment
	 * @param interval the measured interval
	 * @param angle    the kymograph orientation (radians)
	 * @return the velocity entry
	 */
	public VelocityEntry classify(final Segment segment, final Interval interval, final double angle) {
		return classify(segment.getId(), interval.getId(), segment.getLength(), angle);
	}

	private VelocityEntry classify(final int segmentId, final int intervalId, final double segmentLength,
			final double angle) {
		if (segmentLength < minSegmentLength) {
			return VelocityEntry.tooShort();
		}
		if (Double.isNaN(angle)) {
			recordAnomaly(segmentId, intervalId, angle);
			return VelocityEntry.outOfRange();
		}
		final double velocity = toVelocity(angle);
		if (!Double.isFinite(velocity)) {
			recordAnomaly(segmentId, intervalId, angle);
			return VelocityEntry.outOfRange();
		}
		if (Math.abs(velocity) > maxMeasuredSpeed) {
			return VelocityEntry.outOfRange();
		}
		return VelocityEntry.numeric(velocity);
	}

	private void recordAnomaly(final int segmentId, final int intervalId, final double angle) {
		final ComputationAnomaly anomaly = new ComputationAnomaly(segmentId, intervalId, angle);
		anomalies.add(anomaly);
		KymoFlowUtils.warn(anomaly.toString());
	}

	/** @return a snapshot of the anomalies recorded so far */
	public List<ComputationAnomaly> getAnomalies() {
		synchronized (anomalies) {
			return new ArrayList<>(anomalies);
		}
	}

	public double getFrameRate() {
		return frameRate;
	}

	public double getPixelSize() {
		return pixelSize;
	}

	public double getMinSegmentLength() {
		return minSegmentLength;
	}

	public double getMaxMeasuredSpeed() {
		return maxMeasuredSpeed;
	}

}
