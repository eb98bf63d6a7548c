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

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.process.FloatProcessor;
import sc.fiji.kymoflow.io.RoiSetIO;
import sc.fiji.kymoflow.util.PixelPoint;

/**
 * Test fixtures: synthetic videos of a sinusoidal pattern drifting along X at
 * a constant speed, and horizontal segments sampling them.
 */
public class SyntheticFlow {

	public static final int WIDTH = 128;
	public static final int HEIGHT = 64;
	public static final double PERIOD = 16;

	private SyntheticFlow() {}

	/**
	 * @param frames the number of frames
	 * @param speed  the drift, in pixels per frame (positive: towards +X)
	 * @return a 32-bit single-channel video
	 */
	public static ImagePlus stripeVideo(final int frames, final double speed) {
		final ImageStack stack = new ImageStack(WIDTH, HEIGHT);
		for (int t = 1; t <= frames; t++) {
			final float[] pixels = new float[WIDTH * HEIGHT];
			for (int y = 0; y < HEIGHT; y++) {
				for (int x = 0; x < WIDTH; x++) {
					pixels[y * WIDTH + x] = (float) (100 + 50 * Math.sin(2 * Math.PI * (x - speed * t) / PERIOD));
				}
			}
			stack.addSlice("t" + t, new FloatProcessor(WIDTH, HEIGHT, pixels));
		}
		return new ImagePlus("stripes", stack);
	}

	/** @return the nodes of a horizontal polyline, one per pixel */
	public static List<PixelPoint> horizontalLine(final int y, final int x0, final int x1) {
		final List<PixelPoint> nodes = new ArrayList<>();
		for (int x = x0; x <= x1; x++) {
			nodes.add(new PixelPoint(x, y));
		}
		return nodes;
	}

	/**
	 * @return two segments: a long one (80 px) and a short one (20 px)
	 */
	public static SegmentCatalog twoSegments(final double pixelSize) {
		final List<List<PixelPoint>> lines = new ArrayList<>();
		lines.add(horizontalLine(20, 10, 90));
		lines.add(horizontalLine(44, 30, 50));
		return SegmentCatalog.of(null, lines, pixelSize);
	}

	/**
	 * Writes a complete project (video, segments, intervals and configuration)
	 * into a directory.
	 *
	 * @return the configuration file
	 */
	public static File writeProject(final File dir, final int frames, final String intervals, final String... extraConfigLines)
			throws IOException {
		final File video = new File(dir, "video.tif");
		if (!new FileSaver(stripeVideo(frames, 1)).saveAsTiffStack(video.getAbsolutePath()))
			throw new IOException("Could not save video");
		final File segments = new File(dir, "segments.zip");
		RoiSetIO.save(twoSegments(0.5), segments);
		final File intervalsFile = new File(dir, "intervals.csv");
		IntervalCatalog.parse(intervals).save(intervalsFile);
		final File config = new File(dir, "config.csv");
		try (PrintWriter pw = new PrintWriter(config, StandardCharsets.UTF_8)) {
			pw.println("// test project");
			pw.println("videoPath," + video.getAbsolutePath() + ",the video");
			pw.println("segmentsPath," + segments.getAbsolutePath() + ",");
			pw.println("intervalsPath," + intervalsFile.getAbsolutePath());
			pw.println("outputDir," + new File(dir, "out").getAbsolutePath());
			pw.println("pixelSize,0.5,um/px");
			pw.println("frameRate,10");
			pw.println("minSegmentLength,20");
			pw.println("maxMeasuredSpeed,2000");
			pw.println("maxPlotSpeed,10");
			pw.println("lineThickness,1");
			for (final String line : extraConfigLines)
				pw.println(line);
		}
		return config;
	}

}
