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

import ij.ImagePlus;
import ij.measure.Calibration;
import ij.process.FloatProcessor;

/**
 * A space-time raster for one (segment, interval) pair: one row per frame of
 * the interval, one column per sample along the segment.
 */
public class Kymograph {

	private final int segmentId;
	private final int intervalId;
	private final FloatProcessor raster;

	public Kymograph(final int segmentId, final int intervalId, final FloatProcessor raster) {
		if (raster == null) throw new IllegalArgumentException("Raster cannot be null");
		this.segmentId = segmentId;
		this.intervalId = intervalId;
		this.raster = raster;
	}

	public int getSegmentId() {
		return segmentId;
	}

	public int getIntervalId() {
		return intervalId;
	}

	/** @return the raster (X: position along the segment, Y: frame) */
	public FloatProcessor getRaster() {
		return raster;
	}

	/** @return the number of samples along the segment */
	public int getWidth() {
		return raster.getWidth();
	}

	/** @return the number of frames */
	public int getHeight() {
		return raster.getHeight();
	}

	/**
	 * @param pixelSize the sample spacing (µm)
	 * @param frameRate the acquisition rate (frames per second)
	 * @return this kymograph as a calibrated image
	 */
	public ImagePlus toImagePlus(final double pixelSize, final double frameRate) {
		final ImagePlus imp = new ImagePlus(getTitle(), raster);
		final Calibration cal = new Calibration();
		cal.pixelWidth = pixelSize;
		cal.setXUnit("micron");
		cal.pixelHeight = 1d / frameRate;
		cal.setYUnit("sec");
		imp.setCalibration(cal);
		return imp;
	}

	public String getTitle() {
		return String.format("kymo_I%03d_S%03d", intervalId, segmentId);
	}

}
