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

import static org.junit.Assert.*;

import org.junit.Test;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

/**
 * Tests for the {@link OrientationEstimator} implementations, using synthetic
 * kymographs of streaks of known slope.
 */
public class OrientationEstimatorTest {

	private static final double LOCAL_TOLERANCE = 1e-6;
	private static final double FOURIER_TOLERANCE = Math.toRadians(2);

	/**
	 * @param speed the streak displacement per row (pixels per frame)
	 * @param flicker amplitude of a per-row (i.e., per-frame) intensity offset
	 */
	private static FloatProcessor streaks(final int width, final int height, final double speed,
			final double flicker) {
		final FloatProcessor fp = new FloatProcessor(width, height);
		for (int y = 0; y < height; y++) {
			final double offset = flicker * Math.sin(1.3 * y);
			for (int x = 0; x < width; x++) {
				fp.setf(x, y, (float) (100 + offset + 50 * Math.sin(2 * Math.PI * (x - speed * y) / 16)));
			}
		}
		return fp;
	}

	@Test
	public void testLocalGradientForwardFlow() {
		final OrientationResult result = new LocalGradientEstimator().estimate(streaks(64, 40, 1, 0), false);
		assertEquals("Forward flow of 1 px/frame is a 45 degree streak", Math.PI / 4, result.getAngle(),
				LOCAL_TOLERANCE);
		assertEquals("Perfect streaks are fully coherent", 1, result.getFitGoodness(), 1e-6);
	}

	@Test
	public void testLocalGradientReverseFlow() {
		final OrientationResult result = new LocalGradientEstimator().estimate(streaks(64, 40, -1, 0), false);
		assertEquals(3 * Math.PI / 4, result.getAngle(), LOCAL_TOLERANCE);
	}

	@Test
	public void testFourierComponents() {
		final OrientationEstimator estimator = new FourierComponentsEstimator();
		final OrientationResult forward = estimator.estimate(streaks(64, 64, 1, 0), false);
		assertEquals(Math.PI / 4, forward.getAngle(), FOURIER_TOLERANCE);
		assertTrue("Fit should be in (0, 1]", forward.getFitGoodness() > 0 && forward.getFitGoodness() <= 1);
		final OrientationResult reverse = estimator.estimate(streaks(64, 64, -1, 0), false);
		assertEquals(3 * Math.PI / 4, reverse.getAngle(), FOURIER_TOLERANCE);
	}

	@Test
	public void testFlickerCorrection() {
		final FloatProcessor flickering = streaks(64, 40, 1, 40);
		final OrientationResult corrected = new LocalGradientEstimator().estimate(flickering, true);
		assertEquals(Math.PI / 4, corrected.getAngle(), Math.toRadians(1));
		final OrientationResult uncorrected = new LocalGradientEstimator().estimate(flickering, false);
		assertTrue("Flicker should bias an uncorrected estimate",
				Math.abs(uncorrected.getAngle() - Math.PI / 4) > Math.abs(corrected.getAngle() - Math.PI / 4));
	}

	@Test
	public void testInputIsNotModified() {
		final FloatProcessor fp = streaks(32, 20, 1, 10);
		final float[] before = ((float[]) fp.getPixels()).clone();
		for (final OrientationMethod method : OrientationMethod.values())
			method.createEstimator().estimate(fp, true);
		assertArrayEquals(before, (float[]) fp.getPixels(), 0f);
	}

	@Test
	public void testUndefinedOrientation() {
		for (final OrientationMethod method : OrientationMethod.values()) {
			final OrientationEstimator estimator = method.createEstimator();
			final ByteProcessor blank = new ByteProcessor(32, 32);
			blank.setValue(80);
			blank.fill();
			assertTrue(method + ": uniform kymograph", Double.isNaN(estimator.estimate(blank, false).getAngle()));
			assertTrue(method + ": tiny kymograph",
					Double.isNaN(estimator.estimate(new FloatProcessor(2, 10), false).getAngle()));
		}
	}

	@Test
	public void testFold() {
		assertEquals(0, AbstractOrientationEstimator.fold(Math.PI), 1e-12);
		assertEquals(Math.PI / 4, AbstractOrientationEstimator.fold(-3 * Math.PI / 4), 1e-12);
		assertEquals(Math.PI / 2, AbstractOrientationEstimator.fold(5 * Math.PI / 2), 1e-12);
	}

	@Test
	public void testMethodLabels() {
		assertEquals(OrientationMethod.LOCAL_GRADIENT, OrientationMethod.fromLabel("local gradient"));
		assertEquals(OrientationMethod.FOURIER_COMPONENTS, OrientationMethod.fromLabel("FOURIER_COMPONENTS"));
		assertTrue(OrientationMethod.FOURIER_COMPONENTS.createEstimator() instanceof FourierComponentsEstimator);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownMethod() {
		OrientationMethod.fromLabel("hough transform");
	}

}
