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

import java.awt.Color;

/**
 * An immutable 256-entry lookup table mapping a normalized byte (0-255) to an
 * RGB color.
 */
public class ColorLut {

	public static final int SIZE = 256;

	private final String name;
	private final int[] rgb;

	/**
	 * @param name the palette name
	 * @param reds the 256 red components (0-255)
	 * @param greens the 256 green components (0-255)
	 * @param blues the 256 blue components (0-255)
	 */
	public ColorLut(final String name, final int[] reds, final int[] greens, final int[] blues) {
		if (reds.length != SIZE || greens.length != SIZE || blues.length != SIZE)
			throw new IllegalArgumentException("LUT components must have " + SIZE + " entries");
		this.name = name;
		rgb = new int[SIZE];
		for (int i = 0; i < SIZE; i++) {
			rgb[i] = ((reds[i] & 0xff) << 16) | ((greens[i] & 0xff) << 8) | (blues[i] & 0xff);
		}
	}

	/**
	 * @param name the palette name
	 * @param rgb  the red, green and blue components, in this order
	 */
	public ColorLut(final String name, final int[][] rgb) {
		this(name, rgb[0], rgb[1], rgb[2]);
	}

	/** @return the palette name */
	public String getName() {
		return name;
	}

	/**
	 * @param index the LUT index, 0-255
	 * @return the color at the specified index
	 */
	public Color get(final int index) {
		return new Color(getRGB(index));
	}

	/**
	 * @param index the LUT index, 0-255
	 * @return the packed RGB value at the specified index
	 */
	public int getRGB(final int index) {
		if (index < 0 || index >= SIZE)
			throw new IndexOutOfBoundsException("LUT index out of range: " + index);
		return rgb[index];
	}

	@Override
	public String toString() {
		return name;
	}

}
