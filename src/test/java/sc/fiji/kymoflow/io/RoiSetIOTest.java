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
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ij.gui.Roi;
import ij.io.RoiEncoder;
import sc.fiji.kymoflow.Segment;
import sc.fiji.kymoflow.SegmentCatalog;
import sc.fiji.kymoflow.util.PixelPoint;

/**
 * Tests for {@link RoiSetIO}
 */
public class RoiSetIOTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testRoundTrip() throws IOException {
		final List<PixelPoint> bent = Arrays.asList(new PixelPoint(1, 1), new PixelPoint(20, 1),
				new PixelPoint(20, 35.5));
		final List<PixelPoint> dot = Collections.singletonList(new PixelPoint(7, 9));
		final SegmentCatalog catalog = SegmentCatalog.of(Arrays.asList("feeder", "capillary"),
				Arrays.asList(bent, dot), 0.65);
		final File file = new File(folder.getRoot(), "segments.zip");
		RoiSetIO.save(catalog, file);

		final SegmentCatalog reloaded = RoiSetIO.load(file, 0.65);
		assertEquals(catalog.size(), reloaded.size());
		assertEquals(catalog.getNames(), reloaded.getNames());
		for (final Segment expected : catalog) {
			final Segment actual = reloaded.get(expected.getId());
			assertEquals(expected.getName(), expected.size(), actual.size());
			for (int i = 0; i < expected.size(); i++) {
				assertEquals(expected.getNode(i).x, actual.getNode(i).x, 1e-3);
				assertEquals(expected.getNode(i).y, actual.getNode(i).y, 1e-3);
			}
			assertEquals(expected.getLength(), actual.getLength(), 1e-3);
		}
	}

	@Test
	public void testSaveBacksUpExistingSet() throws IOException {
		final SegmentCatalog catalog = SegmentCatalog.of(null,
				Collections.singletonList(Arrays.asList(new PixelPoint(0, 0), new PixelPoint(5, 5))), 1);
		final File file = new File(folder.getRoot(), "segments.zip");
		RoiSetIO.save(catalog, file);
		RoiSetIO.save(catalog, file);
		assertEquals(2, folder.getRoot().listFiles().length);
	}

	@Test(expected = IOException.class)
	public void testAreaRoisAreRejected() throws IOException {
		final File file = new File(folder.getRoot(), "areas.zip");
		try (ZipOutputStream out = new ZipOutputStream(new FileOutputStream(file))) {
			out.putNextEntry(new ZipEntry("0001-box.roi"));
			out.write(RoiEncoder.saveAsByteArray(new Roi(0, 0, 10, 10)));
			out.closeEntry();
		}
		RoiSetIO.load(file, 1);
	}

	@Test(expected = IOException.class)
	public void testEmptySet() throws IOException {
		final File file = new File(folder.getRoot(), "empty.zip");
		try (ZipOutputStream out = new ZipOutputStream(new FileOutputStream(file))) {
			out.putNextEntry(new ZipEntry("readme.txt"));
			out.closeEntry();
		}
		RoiSetIO.load(file, 1);
	}

}
