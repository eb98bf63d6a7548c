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

import java.io.File;
import java.io.IOException;

import ij.ImagePlus;
import ij.io.FileSaver;
import sc.fiji.kymoflow.KymoFlowUtils;

/** Saves rendered spatial maps as (multi-frame) TIFF files. */
public class SpatialMapWriter {

	private SpatialMapWriter() {}

	/**
	 * Saves a spatial map. An existing file at the same path is backed up first.
	 *
	 * @param map  the rendered map, one frame per interval
	 * @param file the output TIFF file
	 * @throws IOException if the file could not be written
	 */
	public static void save(final ImagePlus map, final File file) throws IOException {
		KymoFlowUtils.prepareForWriting(file);
		final FileSaver saver = new FileSaver(map);
		final boolean saved = (map.getStackSize() > 1) ? saver.saveAsTiffStack(file.getAbsolutePath())
				: saver.saveAsTiff(file.getAbsolutePath());
		if (!saved) throw new IOException("Could not save spatial map to " + file.getAbsolutePath());
		KymoFlowUtils.log("Spatial map saved: " + file.getAbsolutePath());
	}

}
