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

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import sc.fiji.kymoflow.DataIntegrityException;
import sc.fiji.kymoflow.IntervalCatalog;
import sc.fiji.kymoflow.RangeException;
import sc.fiji.kymoflow.SegmentCatalog;
import sc.fiji.kymoflow.SyntheticFlow;
import sc.fiji.kymoflow.analysis.ComputationAnomaly;
import sc.fiji.kymoflow.analysis.ValueMatrix;
import sc.fiji.kymoflow.analysis.VelocityEntry;
import sc.fiji.kymoflow.analysis.VelocityMatrix;

/**
 * Tests for {@link MatrixIO}
 */
public class MatrixIOTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private SegmentCatalog segments;
	private IntervalCatalog intervals;
	private VelocityMatrix velocities;

	@Before
	public void setUp() {
		segments = SyntheticFlow.twoSegments(0.5);
		intervals = IntervalCatalog.of(new int[] { 1, 10 }, new int[] { 20, 30 });
		velocities = VelocityMatrix.of(Arrays.asList(
				Arrays.asList(VelocityEntry.numeric(15), VelocityEntry.tooShort()),
				Arrays.asList(VelocityEntry.numeric(-0.456), VelocityEntry.outOfRange())));
	}

	private List<String> lines(final File file) throws IOException {
		return Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
	}

	@Test
	public void testVelocityFormat() throws IOException {
		final File file = new File(folder.getRoot(), MatrixIO.VELOCITY_FILE);
		MatrixIO.saveVelocities(velocities, segments.getNames(), file);
		assertEquals(Arrays.asList("// Segment_1,Segment_2", "15.00,short", "-0.46,out"), lines(file));
	}

	@Test
	public void testVelocityRoundTrip() throws IOException {
		final File file = new File(folder.getRoot(), MatrixIO.VELOCITY_FILE);
		MatrixIO.saveVelocities(velocities, segments.getNames(), file);
		assertEquals(velocities, MatrixIO.loadVelocities(file, segments, intervals));
	}

	@Test
	public void testRowCountMismatch() throws IOException {
		final File file = new File(folder.getRoot(), MatrixIO.VELOCITY_FILE);
		MatrixIO.saveVelocities(velocities, segments.getNames(), file);
		final IntervalCatalog three = IntervalCatalog.of(new int[] { 1, 10 }, new int[] { 20, 30 },
				new int[] { 40, 50 });
		try {
			MatrixIO.loadVelocities(file, segments, three);
			fail("Row count mismatch should have been reported");
		} catch (final RangeException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("2 row(s)"));
		}
	}

	@Test(expected = RangeException.class)
	public void testColumnCountMismatch() throws IOException {
		final File file = folder.newFile("velocity.csv");
		Files.write(file.toPath(), "// a,b\n1.00,2.00\n3.00\n".getBytes(StandardCharsets.UTF_8));
		MatrixIO.loadVelocities(file, segments, intervals);
	}

	@Test
	public void testInvalidCell() throws IOException {
		final File file = folder.newFile("velocity.csv");
		Files.write(file.toPath(), "// a,b\n1.00,2.00\n3.00,fast\n".getBytes(StandardCharsets.UTF_8));
		try {
			MatrixIO.loadVelocities(file, segments, intervals);
			fail("Invalid cell should have been reported");
		} catch (final DataIntegrityException e) {
			assertEquals(2, e.getRow());
		}
	}

	@Test
	public void testIncompleteMatrixLeavesExistingFileUntouched() throws IOException {
		final File file = new File(folder.getRoot(), MatrixIO.VELOCITY_FILE);
		MatrixIO.saveVelocities(velocities, segments.getNames(), file);
		final List<String> before = lines(file);
		final VelocityMatrix incomplete = new VelocityMatrix(2, 2);
		incomplete.put(1, 1, VelocityEntry.numeric(1));
		try {
			MatrixIO.saveVelocities(incomplete, segments.getNames(), file);
			fail("Incomplete matrix should have been rejected");
		} catch (final IllegalStateException e) {
			assertEquals(before, lines(file));
			assertEquals("No backup should be made", 1, folder.getRoot().listFiles().length);
		}
	}

	@Test
	public void testValueMatrices() throws IOException {
		final ValueMatrix angles = new ValueMatrix("Angle", 2, 2);
		angles.put(1, 1, 45);
		angles.put(1, 2, 135.126);
		angles.put(2, 1, 90);
		final File file = new File(folder.getRoot(), MatrixIO.ANGLE_FILE);
		MatrixIO.saveValues(angles, segments.getNames(), file);
		assertEquals(Arrays.asList("// Segment_1,Segment_2", "45.00,135.13", "90.00,NaN"), lines(file));
		final ValueMatrix reloaded = MatrixIO.loadValues(file, "Angle", 2);
		assertEquals(135.13, reloaded.get(1, 2), 0);
		assertTrue(Double.isNaN(reloaded.get(2, 2)));
	}

	@Test
	public void testSentinelInNumericMatrix() throws IOException {
		final File file = new File(folder.getRoot(), MatrixIO.VELOCITY_FILE);
		MatrixIO.saveVelocities(velocities, segments.getNames(), file);
		try {
			MatrixIO.loadValues(file, "Velocity", 2);
			fail("Sentinel should have been rejected");
		} catch (final DataIntegrityException e) {
			assertEquals("Offending row should be identified", 1, e.getRow());
		}
	}

	@Test
	public void testSummary() throws IOException {
		final File file = new File(folder.getRoot(), MatrixIO.SUMMARY_FILE);
		MatrixIO.saveSummary(velocities, segments, file);
		final List<String> lines = lines(file);
		assertEquals(3, lines.size());
		assertEquals("Segment_1,40.00,2,7.27,10.93,-0.46,15.00,0,0", lines.get(1));
		assertEquals("Segment_2,10.00,0,NaN,NaN,NaN,NaN,1,1", lines.get(2));
	}

	@Test
	public void testAnomalies() throws IOException {
		final File file = new File(folder.getRoot(), MatrixIO.ANOMALIES_FILE);
		MatrixIO.saveAnomalies(Collections.singletonList(new ComputationAnomaly(2, 3, Double.NaN)), file);
		assertEquals(Arrays.asList("Segment,Interval,Raw angle (rad)", "2,3,NaN"), lines(file));
	}

	@Test
	public void testExistingFilesAreBackedUp() throws IOException {
		final File file = new File(folder.getRoot(), MatrixIO.VELOCITY_FILE);
		MatrixIO.saveVelocities(velocities, segments.getNames(), file);
		MatrixIO.saveVelocities(velocities, segments.getNames(), file);
		MatrixIO.saveVelocities(velocities, segments.getNames(), file);
		assertEquals("No artifact should be silently overwritten", 3, folder.getRoot().listFiles().length);
	}

}
