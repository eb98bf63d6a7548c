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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import ij.process.FloatProcessor;

/**
 * Estimates kymograph orientation from local intensity gradients.
 * <p>
 * Central-difference gradients are accumulated into the 2x2 structure tensor
 * of the whole kymograph. The eigenvector of the largest eigenvalue gives the
 * dominant gradient direction, to which streaks are perpendicular. The
 * goodness of fit is the coherence {@code (λ1 - λ2) / (λ1 + λ2)}: 1 for
 * perfectly parallel streaks, 0 for isotropic texture.
 * </p>
 */
public class LocalGradientEstimator extends AbstractOrientationEstimator {

	@Override
	protected OrientationResult computeOrientation(final FloatProcessor fp) {
		final int w = fp.getWidth();
		final int h = fp.getHeight();
		final float[] pixels = (float[]) fp.getPixels();
		double jxx = 0;
		double jyy = 0;
		double jxy = 0;
		// borders are skipped: one-sided differences would bias the tensor
		for (int y = 1; y < h - 1; y++) {
			for (int x = 1; x < w - 1; x++) {
				final double gx = 0.5 * (pixels[y * w + x + 1] - pixels[y * w + x - 1]);
				final double gy = 0.5 * (pixels[(y + 1) * w + x] - pixels[(y - 1) * w + x]);
				jxx += gx * gx;
				jyy += gy * gy;
				jxy += gx * gy;
			}
		}
		final double trace = jxx + jyy;
		if (!(trace > 0)) return OrientationResult.undefined();

		final RealMatrix tensor = new Array2DRowRealMatrix(new double[][] { { jxx, jxy }, { jxy, jyy } });
		final EigenDecomposition ed = new EigenDecomposition(tensor);
		final double[] eigenvalues = ed.getRealEigenvalues();
		final int major = (eigenvalues[0] >= eigenvalues[1]) ? 0 : 1;
		final double l1 = eigenvalues[major];
		final double l2 = eigenvalues[1 - major];
		final RealVector gradientDir = ed.getEigenvector(major);

		// streaks run perpendicular to the dominant gradient
		final double angle = Math.atan2(gradientDir.getEntry(0), -gradientDir.getEntry(1));
		final double coherence = (l1 - l2) / (l1 + l2);
		return new OrientationResult(angle, coherence);
	}

}
