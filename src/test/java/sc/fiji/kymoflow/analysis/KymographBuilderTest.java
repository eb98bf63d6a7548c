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

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.FloatProcessor;
import sc.fiji.kymoflow.Interval;
import sc.fiji.kymoflow.RangeException;
import sc.fiji.kymoflow.Segment;
import sc.fiji.kymoflow.SyntheticFlow;
import sc.fiji.kymoflow.io.ImagePlusVideoSource;
import sc.fiji.kymoflow.util.PixelPoint;

/**
 * Tests for {@link KymographBuilder}
 */
public class KymographBuilderTest {

	private ImagePlus imp;
	private KymographBuilder builder;
	private Segment segment;

	@Before
	public void setUp() {
		imp = SyntheticFlow.stripeVideo(30, 1);
		builder = new KymographBuilder(new ImagePlusVideoSource(imp));
		segment = new Segment(1, null, SyntheticFlow.horizontalLine(20, 10, 50), 0.5);
	}

	@Test
	public void testDimensions() {
		final Kymograph kymo = builder.build(segment, new Interval(2, 5, 16));
		assertEquals("One row per frame", 12, kymo.getHeight());
		assertEquals("One column per pixel of arc length", 41, kymo.getWidth());
		assertEquals(1, kymo.getSegmentId());
		assertEquals(2, kymo.getIntervalId());
		assertEquals("kymo_I002_S001", kymo.getTitle());
	}

	@Test
	public void testSamplesFollowTheVideo() {
		final Interval interval = new Interval(1, 3, 10);
		final Kymograph kymo = builder.build(segment, interval);
		final FloatProcessor raster = kymo.getRaster();
		for (int row = 0; row < kymo.getHeight(); row++) {
			final int frame = interval.getStart() + row;
			for (int col = 0; col < kymo.getWidth(); col++) {
				final float expected = imp.getStack().getProcessor(frame).getf(10 + col, 20);
				assertEquals("frame " + frame + ", column " + col, expected, raster.getf(col, row), 1e-4);
			}
		}
	}

	@Test
	public void testArcLengthSampling() {
		// an L-shaped path: 3 px along X, then 4 px along Y
		final Segment bent = new Segment(1, null,
				Arrays.asList(new PixelPoint(0, 0), new PixelPoint(3, 0), new PixelPoint(3, 4)), 1);
		final List<PixelPoint> samples = KymographBuilder.samplePositions(bent);
		assertEquals(8, samples.size());
		assertEquals(new PixelPoint(3, 0), samples.get(3));
		assertEquals(new PixelPoint(3, 2), samples.get(5));
		assertEquals(new PixelPoint(3, 4), samples.get(7));
		final Segment dot = new Segment(1, null, Arrays.asList(new PixelPoint(5, 5)), 1);
		assertEquals(1, KymographBuilder.samplePositions(dot).size());
	}

	@Test
	public void testSourceIsNotModified() {
		final ImageStack stack = imp.getStack();
		final float[] before = ((float[]) stack.getPixels(7)).clone();
		builder.build(segment, new Interval(1, 1, 30));
		assertArrayEquals(before, (float[]) stack.getPixels(7), 0f);
		assertEquals(30, stack.getSize());
	}

	@Test(expected = RangeException.class)
	public void testIntervalBeyondVideo() {
		builder.build(segment, new Interval(1, 25, 31));
	}

}
