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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

import ij.process.FloatProcessor;

/**
 * Estimates kymograph orientation from its power spectrum.
 * <p>
 * The (Hann-windowed, zero-padded) kymograph is Fourier transformed and the
 * spectral power is binned by orientation. Streaks concentrate power along the
 * frequency direction perpendicular to them. The dominant orientation is
 * refined as the power-weighted mean over the bins surrounding the peak, and
 * the goodness of fit is the fraction of the total power falling in those
 * bins.
 * </p>
 */
public class FourierComponentsEstimator extends AbstractOrientationEstimator {

	/** Number of orientation bins over a half turn (1° each) */
	private static final int N_BINS = 180;
	/** Half-width (in bins) of the window summarized around the peak */
	private static final int PEAK_HALF_WIDTH = 10;
	/** Frequencies below this radius carry the residual background */
	private static final double MIN_RADIUS = 2;

	@Override
	protected OrientationResult computeOrientation(final FloatProcessor fp) {
		final double[] histogram = orientationHistogram(fp);
		double total = 0;
		int peak = 0;
		for (int i = 0; i < N_BINS; i++) {
			total += histogram[i];
			if (histogram[i] > histogram[peak]) peak = i;
		}
		if (!(total > 0)) return OrientationResult.undefined();

		double sumSin = 0;
		double sumCos = 0;
		double windowPower = 0;
		for (int offset = -PEAK_HALF_WIDTH; offset <= PEAK_HALF_WIDTH; offset++) {
			final int bin = Math.floorMod(peak + offset, N_BINS);
			final double theta = binCenter(bin);
			sumSin += histogram[bin] * Math.sin(2 * theta);
			sumCos += histogram[bin] * Math.cos(2 * theta);
			windowPower += histogram[bin];
		}
		final double angle = 0.5 * Math.atan2(sumSin, sumCos);
		return new OrientationResult(angle, windowPower / total);
	}

	private static double binCenter(final int bin) {
		return (bin + 0.5) * Math.PI / N_BINS;
	}

	/**
	 * @return the spectral power binned by streak orientation over [0, π)
	 */
	double[] orientationHistogram(final FloatProcessor fp) {
		final int w = fp.getWidth();
		final int h = fp.getHeight();
		final int n = nextPowerOf2(Math.max(16, Math.max(w, h)));
		final float[] pixels = (float[]) fp.getPixels();

		double mean = 0;
		for (final float p : pixels)
			mean += p;
		mean /= pixels.length;

		final double[][] real = new double[n][n];
		for (int y = 0; y < h; y++) {
			final double wy = hann(y, h);
			for (int x = 0; x < w; x++) {
				real[y][x] = (pixels[y * w + x] - mean) * wy * hann(x, w);
			}
		}

		final FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);
		final Complex[][] rows = new Complex[n][];
		for (int y = 0; y < n; y++) {
			rows[y] = fft.transform(real[y], TransformType.FORWARD);
		}
		final double[] histogram = new double[N_BINS];
		final Complex[] column = new Complex[n];
		for (int u = 0; u < n; u++) {
			for (int y = 0; y < n; y++)
				column[y] = rows[y][u];
			final Complex[] spectrum = fft.transform(column, TransformType.FORWARD);
			final int fu = (u <= n / 2) ? u : u - n;
			for (int v = 0; v < n; v++) {
				final int fv = (v <= n / 2) ? v : v - n;
				final double radius = Math.sqrt(fu * fu + fv * fv);
				if (radius < MIN_RADIUS || radius > n / 2d) continue;
				final double power = spectrum[v].abs() * spectrum[v].abs();
				// streaks are perpendicular to their frequency vector
				final double theta = fold(Math.atan2(fv, fu) + Math.PI / 2);
				final int bin = Math.min(N_BINS - 1, (int) (theta / Math.PI * N_BINS));
				histogram[bin] += power;
			}
		}
		return histogram;
	}

	private static double hann(final int i, final int length) {
		if (length < 2) return 1;
		return 0.5 - 0.5 * Math.cos(2 * Math.PI * i / (length - 1));
	}

	private static int nextPowerOf2(final int value) {
		int n = 1;
		while (n < value)
			n <<= 1;
		return n;
	}

}
