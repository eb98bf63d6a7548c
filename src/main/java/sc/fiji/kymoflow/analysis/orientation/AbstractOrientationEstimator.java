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

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Common scaffolding for {@link OrientationEstimator}s: works on a private
 * 32-bit copy of the kymograph, applies flicker correction when requested and
 * normalizes the reported angle.
 */
public abstract class AbstractOrientationEstimator implements OrientationEstimator {

	/** Smallest kymograph side that can hold an orientation */
	protected static final int MIN_SIZE = 3;

	@Override
	public OrientationResult estimate(final ImageProcessor kymograph, final boolean flickerCorrected) {
		if (kymograph == null) throw new IllegalArgumentException("Kymograph cannot be null");
		if (kymograph.getWidth() < MIN_SIZE || kymograph.getHeight() < MIN_SIZE)
			return OrientationResult.undefined();
		final FloatProcessor fp = (FloatProcessor) kymograph.convertToFloatProcessor().duplicate();
		if (flickerCorrected) removeRowMeans(fp);
		final OrientationResult result = computeOrientation(fp);
		if (result == null || !Double.isFinite(result.getAngle())) return OrientationResult.undefined();
		return new OrientationResult(fold(result.getAngle()), result.getFitGoodness());
	}

	/**
	 * Computes the orientation of the (possibly flicker-corrected) kymograph.
	 *
	 * @param fp a private copy of the kymograph that may be modified freely
	 * @return the orientation, with the angle in any half-turn. Undefined results
	 *         should have a NaN angle
	 */
	protected abstract OrientationResult computeOrientation(FloatProcessor fp);

	/**
	 * Removes frame-wide intensity fluctuations: each kymograph row (a single
	 * video frame) is offset to zero mean.
	 */
	static void removeRowMeans(final FloatProcessor fp) {
		final int w = fp.getWidth();
		final int h = fp.getHeight();
		final float[] pixels = (float[]) fp.getPixels();
		for (int y = 0; y < h; y++) {
			double sum = 0;
			for (int x = 0; x < w; x++)
				sum += pixels[y * w + x];
			final float mean = (float) (sum / w);
			for (int x = 0; x < w; x++)
				pixels[y * w + x] -= mean;
		}
	}

	/** Folds an angle (radians) into [0, π) */
	static double fold(final double angle) {
		double a = angle % Math.PI;
		if (a < 0) a += Math.PI;
		if (a >= Math.PI) a -= Math.PI;
		return a;
	}

}
