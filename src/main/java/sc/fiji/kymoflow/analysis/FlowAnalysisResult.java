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

import java.util.Collections;
import java.util.List;

import sc.fiji.kymoflow.IntervalCatalog;
import sc.fiji.kymoflow.SegmentCatalog;

/**
 * The outcome of a {@link FlowVelocityAnalyzer} run: velocity, angle (degrees)
 * and fit matrices, all with dimensions (|intervals|, |segments|), and the
 * computation anomalies recovered along the way.
 */
public class FlowAnalysisResult {

	private final SegmentCatalog segments;
	private final IntervalCatalog intervals;
	private final VelocityMatrix velocities;
	private final ValueMatrix angles;
	private final ValueMatrix fits;
	private final List<ComputationAnomaly> anomalies;

	public FlowAnalysisResult(final SegmentCatalog segments, final IntervalCatalog intervals,
			final VelocityMatrix velocities, final ValueMatrix angles, final ValueMatrix fits,
			final List<ComputationAnomaly> anomalies) {
		this.segments = segments;
		this.intervals = intervals;
		this.velocities = velocities;
		this.angles = angles;
		this.fits = fits;
		this.anomalies = Collections.unmodifiableList(anomalies);
	}

	public SegmentCatalog getSegments() {
		return segments;
	}

	public IntervalCatalog getIntervals() {
		return intervals;
	}

	public VelocityMatrix getVelocities() {
		return velocities;
	}

	/** @return the kymograph angles, in degrees */
	public ValueMatrix getAngles() {
		return angles;
	}

	public ValueMatrix getFits() {
		return fits;
	}

	public List<ComputationAnomaly> getAnomalies() {
		return anomalies;
	}

	@Override
	public String toString() {
		return "FlowAnalysisResult [" + intervals.size() + " intervals x " + segments.size() + " segments, "
				+ velocities.count(VelocityEntry.Kind.NUMERIC) + " numeric, "
				+ velocities.count(VelocityEntry.Kind.TOO_SHORT) + " short, "
				+ velocities.count(VelocityEntry.Kind.OUT_OF_RANGE) + " out, " + anomalies.size() + " anomalies]";
	}

}
