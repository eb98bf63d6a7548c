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

import java.awt.Color;

import sc.fiji.kymoflow.util.ColorLut;

/**
 * Maps flow speeds to the colors of a {@link ColorLut}. The magnitude of a
 * velocity is clipped at the maximum plotted speed and linearly mapped into the
 * LUT: {@code floor(min(|v|, max) * 255 / max)}, so that 0 maps to the first
 * entry and speeds at (or above) the maximum map to the last.
 */
public class SpeedColorMapper {

	private final ColorLut lut;
	private final double maxPlotSpeed;

	/**
	 * @param lut          the color table
	 * @param maxPlotSpeed the speed (µm/s) mapped to the last LUT entry
	 */
	public SpeedColorMapper(final ColorLut lut, final double maxPlotSpeed) {
		if (lut == null) throw new IllegalArgumentException("lut cannot be null");
		if (!(maxPlotSpeed > 0) || Double.isInfinite(maxPlotSpeed))
			throw new IllegalArgumentException("Maximum plot speed must be a positive number");
		this.lut = lut;
		this.maxPlotSpeed = maxPlotSpeed;
	}

	/**
	 * @param velocity the (signed) velocity in µm/s
	 * @return the LUT index, 0-255
	 */
	public int getColorIndex(final double velocity) {
		if (Double.isNaN(velocity)) throw new IllegalArgumentException("Velocity is NaN");
		final double speed = Math.min(Math.abs(velocity), maxPlotSpeed);
		final int idx = (int) Math.floor(speed * (ColorLut.SIZE - 1) / maxPlotSpeed);
		return Math.max(0, Math.min(ColorLut.SIZE - 1, idx));
	}

	public Color getColor(final double velocity) {
		return lut.get(getColorIndex(velocity));
	}

	public int getRGB(final double velocity) {
		return lut.getRGB(getColorIndex(velocity));
	}

	public ColorLut getLut() {
		return lut;
	}

	public double getMaxPlotSpeed() {
		return maxPlotSpeed;
	}

}
