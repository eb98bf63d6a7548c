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

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import sc.fiji.kymoflow.Interval;
import sc.fiji.kymoflow.Segment;
import sc.fiji.kymoflow.SyntheticFlow;

/**
 * Tests for {@link VelocityCalculator}
 */
public class VelocityCalculatorTest {

	private VelocityCalculator calculator;

	@Before
	public void setUp() {
		calculator = new VelocityCalculator(30, 0.5, 20, 2000);
	}

	@Test
	public void testShortSegmentIsShortForAnyAngle() {
		for (final double angle : new double[] { Math.PI / 4, 0, Double.NaN, 3 * Math.PI / 4 }) {
			final VelocityEntry entry = calculator.classify(15, angle);
			assertEquals("Segments shorter than the minimum are 'short' (angle " + angle + ")",
					VelocityEntry.Kind.TOO_SHORT, entry.getKind());
			assertEquals("short", entry.toToken());
		}
		assertTrue("Short segments record no anomalies", calculator.getAnomalies().isEmpty());
	}

	@Test
	public void testDiagonalStreakGivesNumericVelocity() {
		final VelocityEntry entry = calculator.classify(40, Math.PI / 4);
		assertTrue(entry.isNumeric());
		assertEquals(15.00, entry.getValue(), 0);
		assertEquals("15.00", entry.toToken());
	}

	@Test
	public void testReverseFlowIsNegative() {
		final VelocityEntry entry = calculator.classify(40, 3 * Math.PI / 4);
		assertEquals(-15.00, entry.getValue(), 0);
		assertEquals("-15.00", entry.toToken());
	}

	@Test
	public void testHorizontalStreakIsOutOfRange() {
		final VelocityEntry entry = calculator.classify(40, 0);
		assertEquals("tan(0) = 0 must not crash", VelocityEntry.Kind.OUT_OF_RANGE, entry.getKind());
		assertEquals("out", entry.toToken());
	}

	@Test
	public void testMaxMeasuredSpeedBoundary() {
		final VelocityCalculator calc = new VelocityCalculator(1, 1, 0, 2);
		// velocity = 1 / tan(angle)
		assertTrue("Speeds just below the maximum are numeric", calc.classify(10, Math.PI / 2 - Math.atan(1.99)).isNumeric());
		assertEquals(VelocityEntry.Kind.OUT_OF_RANGE, calc.classify(10, Math.atan(1 / 2.001)).getKind());
		assertEquals(VelocityEntry.Kind.OUT_OF_RANGE, calc.classify(10, Math.PI - Math.atan(1 / 2.001)).getKind());
	}

	@Test
	public void testTooShortTakesPrecedence() {
		assertEquals(VelocityEntry.Kind.TOO_SHORT, calculator.classify(19.99, 0.0001).getKind());
		assertTrue("Length equal to the minimum is analyzed", calculator.classify(20, Math.PI / 4).isNumeric());
	}

	@Test
	public void testNonFiniteAngleIsRecordedAsAnomaly() {
		final Segment segment = new Segment(3, null, SyntheticFlow.horizontalLine(0, 0, 100), 0.5);
		final VelocityEntry entry = calculator.classify(segment, new Interval(2, 10, 20), Double.NaN);
		assertEquals(VelocityEntry.Kind.OUT_OF_RANGE, entry.getKind());
		final List<ComputationAnomaly> anomalies = calculator.getAnomalies();
		assertEquals(1, anomalies.size());
		assertEquals(3, anomalies.get(0).getSegmentId());
		assertEquals(2, anomalies.get(0).getIntervalId());
		assertTrue(Double.isNaN(anomalies.get(0).getRawAngle()));
	}

	@Test
	public void testDivergentVelocityIsRecordedAsAnomaly() {
		final Segment segment = new Segment(1, null, SyntheticFlow.horizontalLine(0, 0, 100), 0.5);
		calculator.classify(segment, new Interval(1, 1, 5), 0);
		assertEquals(1, calculator.getAnomalies().size());
		assertEquals(0, calculator.getAnomalies().get(0).getRawAngle(), 0);
	}

	@Test
	public void testRounding() {
		final VelocityCalculator calc = new VelocityCalculator(1, 1, 0, 1000);
		final VelocityEntry entry = calc.classify(10, Math.atan(1 / 3.14159));
		assertEquals(3.14, entry.getValue(), 0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidFrameRate() {
		new VelocityCalculator(0, 1, 0, 1);
	}

}
