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

package sc.fiji.kymoflow.util;

import static org.junit.Assert.*;

import java.awt.Color;
import java.awt.image.IndexColorModel;

import org.junit.Test;

import ij.plugin.LutLoader;

/**
 * Tests for {@link ColorMaps} and {@link ColorLut}
 */
public class ColorMapsTest {

	@Test
	public void testAllPalettesHave256Entries() {
		for (final String name : ColorMaps.names()) {
			final ColorLut lut = ColorMaps.get(name);
			assertEquals(name, lut.getName());
			for (int i = 0; i < ColorLut.SIZE; i++)
				assertNotNull(name + " entry " + i, lut.get(i));
		}
	}

	@Test
	public void testBuiltInPalettesMatchImageJ() {
		for (final String name : new String[] { ColorMaps.GRAYS, ColorMaps.FIRE, ColorMaps.SPECTRUM }) {
			final ColorLut lut = ColorMaps.get(name);
			final IndexColorModel expected = LutLoader.getLut(name);
			for (int i = 0; i < ColorLut.SIZE; i++)
				assertEquals(name + " entry " + i, expected.getRGB(i) & 0xffffff, lut.getRGB(i));
		}
	}

	@Test
	public void testGrays() {
		final ColorLut grays = ColorMaps.get(ColorMaps.GRAYS);
		assertEquals(Color.BLACK, grays.get(0));
		assertEquals(Color.WHITE, grays.get(255));
		assertEquals(new Color(128, 128, 128), grays.get(128));
	}

	@Test
	public void testFireEndpoints() {
		final ColorLut fire = ColorMaps.get(ColorMaps.FIRE);
		assertEquals("Fire starts at black", Color.BLACK, fire.get(0));
		final Color last = fire.get(255);
		assertTrue("Fire ends near white", last.getRed() > 240 && last.getGreen() > 240 && last.getBlue() > 200);
	}

	@Test
	public void testNameNormalization() {
		assertTrue(ColorMaps.isKnown("Fire.lut"));
		assertTrue(ColorMaps.isKnown(" VIRIDIS "));
		assertFalse(ColorMaps.isKnown("no-such-lut"));
		assertEquals(ColorMaps.get("plasma").getRGB(100), ColorMaps.get("Plasma.lut").getRGB(100));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownPalette() {
		ColorMaps.get("no-such-lut");
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void testIndexOutOfRange() {
		ColorMaps.get(ColorMaps.GRAYS).get(256);
	}

}
