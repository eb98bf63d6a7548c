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

import ij.process.ImageProcessor;

/**
 * Estimates the dominant line orientation of a kymograph. Implementations must
 * not modify the processor they are given and must be safe to call from
 * multiple threads.
 *
 * @see OrientationMethod
 */
public interface OrientationEstimator {

	/**
	 * @param kymograph         the kymograph raster (X: position, Y: time)
	 * @param flickerCorrected  if true, frame-wide intensity fluctuations (one
	 *                          value per row) are removed before estimation
	 * @return the estimated orientation. Never null, but possibly
	 *         {@link OrientationResult#undefined() undefined}
	 */
	OrientationResult estimate(ImageProcessor kymograph, boolean flickerCorrected);

}
