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

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ij.IJ;
import ij.ImagePlus;
import sc.fiji.kymoflow.IntervalCatalog;
import sc.fiji.kymoflow.RangeException;
import sc.fiji.kymoflow.SegmentCatalog;
import sc.fiji.kymoflow.SyntheticFlow;
import sc.fiji.kymoflow.analysis.orientation.LocalGradientEstimator;
import sc.fiji.kymoflow.io.ImagePlusVideoSource;
import sc.fiji.kymoflow.io.VideoSource;

/**
 * Tests for {@link FlowVelocityAnalyzer}
 */
public class FlowVelocityAnalyzerTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private VideoSource video;
	private SegmentCatalog segments;
	private IntervalCatalog intervals;

	@Before
	public void setUp() {
		video = new ImagePlusVideoSource(SyntheticFlow.stripeVideo(40, 1));
		segments = SyntheticFlow.twoSegments(0.5);
		intervals = IntervalCatalog.of(new int[] { 1, 10 }, new int[] { 16, 30 }, new int[] { 31, 40 });
	}

	private FlowVelocityAnalyzer analyzer() {
		// 10 fps, 0.5 um/px: 1 px/frame = 5 um/s
		return new FlowVelocityAnalyzer(video, segments, intervals, new LocalGradientEstimator(),
				new VelocityCalculator(10, 0.5, 20, 2000));
	}

	@Test
	public void testVelocities() throws IOException {
		final FlowAnalysisResult result = analyzer().run();
		final VelocityMatrix velocities = result.getVelocities();
		assertEquals(intervals.size(), velocities.getRowCount());
		assertEquals(segments.size(), velocities.getColumnCount());
		assertEquals(intervals.size(), result.getAngles().getRowCount());
		assertEquals(segments.size(), result.getFits().getColumnCount());
		for (int i = 1; i <= intervals.size(); i++) {
			assertEquals("Interval " + i, VelocityEntry.numeric(5), velocities.get(i, 1));
			assertEquals("Segment 2 is 10 um long", VelocityEntry.tooShort(), velocities.get(i, 2));
			assertEquals("Angles are stored in degrees", 45, result.getAngles().get(i, 1), 1e-3);
			assertEquals("Short segments still record their angle", 45, result.getAngles().get(i, 2), 1e-3);
		}
		assertTrue(result.getAnomalies().isEmpty());
	}

	@Test
	public void testMultithreadedRunMatchesSequentialRun() throws IOException {
		final FlowAnalysisResult sequential = analyzer().run();
		final FlowVelocityAnalyzer fva = analyzer();
		fva.setThreads(4);
		final FlowAnalysisResult parallel = fva.run();
		assertEquals(sequential.getVelocities(), parallel.getVelocities());
		assertEquals(sequential.getAngles(), parallel.getAngles());
		assertEquals(sequential.getFits(), parallel.getFits());
	}

	@Test
	public void testProgressIsReportedPerUnit() throws IOException {
		final AtomicInteger units = new AtomicInteger();
		final boolean[] finished = new boolean[1];
		final FlowVelocityAnalyzer fva = analyzer();
		fva.setProgressListener(new AnalysisProgressListener() {

			@Override
			public void unitCompleted(final int intervalId, final int segmentId, final int completed,
					final int total) {
				units.incrementAndGet();
				assertEquals(6, total);
			}

			@Override
			public void finished(final boolean success) {
				finished[0] = success;
			}
		});
		fva.run();
		assertEquals(6, units.get());
		assertTrue(finished[0]);
	}

	@Test
	public void testCancellation() throws IOException {
		final FlowVelocityAnalyzer fva = analyzer();
		final AtomicInteger units = new AtomicInteger();
		fva.setProgressListener(new AnalysisProgressListener() {

			@Override
			public void unitCompleted(final int intervalId, final int segmentId, final int completed,
					final int total) {
				units.incrementAndGet();
				fva.cancel();
			}

			@Override
			public void finished(final boolean success) {
				assertFalse(success);
			}
		});
		try {
			fva.run();
			fail("Run should have been cancelled");
		} catch (final CancellationException e) {
			assertTrue(fva.isCancelled());
			assertEquals("Cancellation is checked before each unit", 1, units.get());
		}
	}

	@Test
	public void testCancellationBeforeRun() throws IOException {
		final FlowVelocityAnalyzer fva = analyzer();
		final AtomicInteger units = new AtomicInteger();
		fva.setProgressListener(new AnalysisProgressListener() {

			@Override
			public void unitCompleted(final int intervalId, final int segmentId, final int completed,
					final int total) {
				units.incrementAndGet();
			}

			@Override
			public void finished(final boolean success) {
				assertFalse(success);
			}
		});
		fva.cancel();
		try {
			fva.run();
			fail("A request issued before the run should stop it");
		} catch (final CancellationException e) {
			assertEquals(0, units.get());
		}
	}

	@Test
	public void testIntervalBeyondVideo() throws IOException {
		final FlowVelocityAnalyzer fva = new FlowVelocityAnalyzer(video, segments,
				IntervalCatalog.of(new int[] { 1, 10 }, new int[] { 30, 41 }), new LocalGradientEstimator(),
				new VelocityCalculator(10, 0.5, 20, 2000));
		try {
			fva.run();
			fail("Interval exceeding the video should have been rejected");
		} catch (final RangeException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("40"));
		}
	}

	@Test
	public void testKymographExport() throws IOException {
		final File dir = new File(folder.getRoot(), "kymographs");
		final FlowVelocityAnalyzer fva = analyzer();
		fva.setKymographDirectory(dir);
		fva.run();
		final File kymo = new File(dir, "kymo_I002_S001.tif");
		assertTrue(kymo.exists());
		final ImagePlus imp = IJ.openImage(kymo.getAbsolutePath());
		assertEquals(81, imp.getWidth());
		assertEquals(15, imp.getHeight());
		assertEquals(0.5, imp.getCalibration().pixelWidth, 1e-6);
		assertEquals(6, dir.listFiles().length);
	}

}
