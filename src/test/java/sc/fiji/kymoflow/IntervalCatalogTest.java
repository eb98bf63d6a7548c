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

package sc.fiji.kymoflow;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests for {@link Interval} and {@link IntervalCatalog}
 */
public class IntervalCatalogTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testParse() {
		final String text = "// startFrame,endFrame\n\n1,50\n  // motion artifact 51-60\n61, 100\n";
		final IntervalCatalog catalog = IntervalCatalog.parse(text);
		assertEquals("Comments and blank lines are ignored", 2, catalog.size());
		final Interval second = catalog.get(2);
		assertEquals(2, second.getId());
		assertEquals(61, second.getStart());
		assertEquals(100, second.getEnd());
		assertEquals("Bounds are inclusive", 40, second.getFrameCount());
	}

	@Test
	public void testRoundTrip() throws IOException {
		final IntervalCatalog catalog = IntervalCatalog.of(new int[] { 1, 10 }, new int[] { 15, 15 },
				new int[] { 20, 64 });
		final File file = new File(folder.getRoot(), "intervals.csv");
		catalog.save(file);
		final IntervalCatalog reloaded = IntervalCatalog.load(file);
		assertEquals(catalog.list(), reloaded.list());
	}

	@Test
	public void testSaveBacksUpExistingFile() throws IOException {
		final File file = new File(folder.getRoot(), "intervals.csv");
		IntervalCatalog.of(new int[] { 1, 5 }).save(file);
		IntervalCatalog.of(new int[] { 1, 8 }).save(file);
		final File[] files = folder.getRoot().listFiles();
		assertEquals("Previous file should have been preserved", 2, files.length);
		for (final File f : files) {
			if (f.equals(file)) continue;
			assertTrue(f.getName(), f.getName().matches("intervals_D\\d{4}-\\d{2}-\\d{2}T\\d{2}-\\d{2}-\\d{2}.*\\.csv"));
			assertTrue(new String(Files.readAllBytes(f.toPath()), StandardCharsets.UTF_8).contains("1,5"));
		}
	}

	@Test
	public void testEmptyFieldsAreRejected() {
		for (final String line : new String[] { "5,,10", ",20,30,", "20,30," }) {
			try {
				IntervalCatalog.parse(line + "\n");
				fail("'" + line + "' should have been rejected");
			} catch (final IllegalArgumentException e) {
				assertTrue(e.getMessage(), e.getMessage().startsWith("Line 1"));
			}
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testOverlappingIntervals() {
		IntervalCatalog.parse("1,20\n15,30\n");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDescendingIntervals() {
		IntervalCatalog.parse("40,50\n1,10\n");
	}

	@Test
	public void testMalformedLine() {
		try {
			IntervalCatalog.parse("1,20\n21;30\n");
			fail("Malformed line should have been rejected");
		} catch (final IllegalArgumentException e) {
			assertTrue(e.getMessage(), e.getMessage().startsWith("Line 2"));
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvertedRange() {
		new Interval(1, 10, 9);
	}

	@Test
	public void testValidateAgainstVideo() {
		final IntervalCatalog catalog = IntervalCatalog.of(new int[] { 1, 10 }, new int[] { 11, 20 });
		catalog.validateAgainst(20);
		try {
			catalog.validateAgainst(19);
			fail("Interval exceeding the video should have been rejected");
		} catch (final RangeException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("19"));
		}
	}

}
