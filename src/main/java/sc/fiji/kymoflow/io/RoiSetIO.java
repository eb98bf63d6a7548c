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

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

import ij.gui.PointRoi;
import ij.gui.PolygonRoi;
import ij.gui.Roi;
import ij.io.RoiDecoder;
import ij.io.RoiEncoder;
import ij.process.FloatPolygon;
import sc.fiji.kymoflow.KymoFlowUtils;
import sc.fiji.kymoflow.Segment;
import sc.fiji.kymoflow.SegmentCatalog;
import sc.fiji.kymoflow.util.PixelPoint;

/**
 * Reads and writes segment catalogs as ImageJ ROI sets (the {@code .zip}
 * containers of the ROI Manager). Each segment is stored as a polyline ROI
 * named after the segment; single-node segments are stored as point ROIs.
 * Entry order defines segment ids (1..n).
 */
public class RoiSetIO {

	private static final String ROI_EXTENSION = ".roi";

	private RoiSetIO() {}

	/**
	 * Loads a segment catalog from a ROI set ({@code .zip}) or a single
	 * {@code .roi} file.
	 *
	 * @param file      the ROI set
	 * @param pixelSize the physical size of a pixel (µm)
	 * @return the catalog, in entry order
	 * @throws IOException if the file could not be read, holds no ROIs, or holds
	 *                     ROIs that are neither lines nor points
	 */
	public static SegmentCatalog load(final File file, final double pixelSize) throws IOException {
		final List<Roi> rois = new ArrayList<>();
		if (file.getName().toLowerCase().endsWith(ROI_EXTENSION)) {
			final Roi roi = new RoiDecoder(file.getAbsolutePath()).getRoi();
			if (roi == null) throw new IOException("Not a valid ROI file: " + file.getAbsolutePath());
			rois.add(roi);
		} else {
			try (final ZipInputStream in = new ZipInputStream(new FileInputStream(file))) {
				ZipEntry entry;
				while ((entry = in.getNextEntry()) != null) {
					final String name = entry.getName();
					if (!name.toLowerCase().endsWith(ROI_EXTENSION)) continue;
					final Roi roi = new RoiDecoder(in.readAllBytes(), name).getRoi();
					if (roi == null) throw new IOException("Invalid ROI entry '" + name + "' in " + file.getName());
					rois.add(roi);
				}
			}
		}
		if (rois.isEmpty()) throw new IOException("No ROIs found in " + file.getAbsolutePath());
		final List<Segment> segments = new ArrayList<>(rois.size());
		for (final Roi roi : rois) {
			final int id = segments.size() + 1;
			segments.add(new Segment(id, roi.getName(), toNodes(roi, id), pixelSize));
		}
		KymoFlowUtils.log("Loaded " + segments.size() + " segment(s) from " + file.getName());
		return new SegmentCatalog(segments);
	}

	private static List<PixelPoint> toNodes(final Roi roi, final int id) throws IOException {
		if (!roi.isLine() && roi.getType() != Roi.POINT)
			throw new IOException("ROI #" + id + " (" + roi.getName() + ") is not a line selection");
		final FloatPolygon polygon = roi.getFloatPolygon();
		final List<PixelPoint> nodes = new ArrayList<>(polygon.npoints);
		for (int i = 0; i < polygon.npoints; i++) {
			nodes.add(new PixelPoint(polygon.xpoints[i], polygon.ypoints[i]));
		}
		if (nodes.isEmpty()) throw new IOException("ROI #" + id + " (" + roi.getName() + ") has no nodes");
		return nodes;
	}

	/**
	 * Saves a segment catalog as a ROI set. An existing file is backed up first.
	 *
	 * @param catalog the segments to be saved
	 * @param file    the output {@code .zip} file
	 * @throws IOException if the file could not be written
	 */
	public static void save(final SegmentCatalog catalog, final File file) throws IOException {
		KymoFlowUtils.prepareForWriting(file);
		try (final ZipOutputStream out = new ZipOutputStream(new BufferedOutputStream(new FileOutputStream(file)))) {
			for (final Segment segment : catalog) {
				final Roi roi = toRoi(segment);
				out.putNextEntry(new ZipEntry(String.format("%04d-%s%s", segment.getId(), segment.getName(),
						ROI_EXTENSION)));
				out.write(RoiEncoder.saveAsByteArray(roi));
				out.closeEntry();
			}
		}
	}

	/** @return the ImageJ selection corresponding to a segment */
	public static Roi toRoi(final Segment segment) {
		final List<PixelPoint> nodes = segment.getNodes();
		final Roi roi;
		if (nodes.size() == 1) {
			roi = new PointRoi(nodes.get(0).x, nodes.get(0).y);
		} else {
			final FloatPolygon polygon = new FloatPolygon();
			nodes.forEach(node -> polygon.addPoint(node.x, node.y));
			roi = new PolygonRoi(polygon, Roi.POLYLINE);
		}
		roi.setName(segment.getName());
		return roi;
	}

}
