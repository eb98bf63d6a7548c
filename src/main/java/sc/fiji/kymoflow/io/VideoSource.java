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

package sc.fiji.kymoflow.io;

import ij.process.ImageProcessor;

/**
 * A frame-indexable, single-channel moving image. Frames are 1-based.
 */
public interface VideoSource {

	/** @return the number of frames available */
	int getFrameCount();

	/** @return the frame width in pixels */
	int getWidth();

	/** @return the frame height in pixels */
	int getHeight();

	/**
	 * Retrieves a frame. Callers must treat the returned processor as read-only.
	 *
	 * @param frame the 1-based frame index
	 * @return the frame raster
	 * @throws IndexOutOfBoundsException if frame is not within
	 *                                   {@code [1, getFrameCount()]}
	 */
	ImageProcessor getFrame(int frame);

	/**
	 * Records spatial and temporal calibration in the video metadata.
	 *
	 * @param pixelSize the physical size of a pixel (µm)
	 * @param frameRate the acquisition rate (frames per second)
	 */
	void setCalibration(double pixelSize, double frameRate);

	/** @return a descriptive name, e.g., the file name */
	String getTitle();

}
