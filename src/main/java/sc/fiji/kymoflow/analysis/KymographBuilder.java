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

import java.util.ArrayList;
import java.util.List;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import sc.fiji.kymoflow.Interval;
import sc.fiji.kymoflow.RangeException;
import sc.fiji.kymoflow.Segment;
import sc.fiji.kymoflow.io.VideoSource;
import sc.fiji.kymoflow.util.PixelPoint;

/**
 * Builds kymographs by resampling video frames along a segment's path.
 * <p>
 * The polyline is sampled at unit (1 pixel) arc-length spacing, and the same
 * sample positions are used for every frame of the interval, so that a
 * kymograph column always corresponds to the same physical position along the
 * vessel. Intensities are bilinearly interpolated. Frames are read without
 * altering the video source.
 * </p>
 */
public class KymographBuilder {

	private final VideoSource video;

	/**
	 * @param video the video from which pixel intensities will be retrieved
	 */
	public KymographBuilder(final VideoSource video) throws IllegalArgumentException {
		if (video == null) {
			throw new IllegalArgumentException("Video cannot be null");
		}
		this.video = video;
	}

	/**
	 * @param segment  the segment to be sampled
	 * @param interval the frame range to be sampled
	 * @return the kymograph: {@code interval.getFrameCount()} rows by
	 *         {@code samplePositions(segment).size()} columns
	 * @throws RangeException if the interval exceeds the frames of the video
	 */
	public Kymograph build(final Segment segment, final Interval interval) {
		if (segment == null) {
			throw new IllegalArgumentException("Segment cannot be null");
		}
		if (interval == null) {
			throw new IllegalArgumentException("Interval cannot be null");
		}
		if (!interval.fitsWithin(video.getFrameCount())) {
			throw new RangeException(interval + " exceeds the " + video.getFrameCount() + " frames of "
					+ video.getTitle());
		}
		final List<PixelPoint> samples = samplePositions(segment);
		final int width = samples.size();
		final int height = interval.getFrameCount();
		final float[] pixels = new float[width * height];
		for (int row = 0; row < height; row++) {
			final ImageProcessor frame = video.getFrame(interval.getStart() + row);
			for (int col = 0; col < width; col++) {
				final PixelPoint p = samples.get(col);
				pixels[row * width + col] = (float) frame.getInterpolatedValue(p.x, p.y);
			}
		}
		return new Kymograph(segment.getId(), interval.getId(), new FloatProcessor(width, height, pixels));
	}

	/**
	 * Computes the positions at which a segment is sampled: its first node, then
	 * one position per pixel of arc length along the polyline.
	 *
	 * @param segment the segment
	 * @return the sample positions, in pixel coordinates. Never empty
	 */
	public static List<PixelPoint> samplePositions(final Segment segment) {
		final List<PixelPoint> nodes = segment.getNodes();
		final double length = segment.getPixelLength();
		final int nSamples = (int) Math.floor(length) + 1;
		final List<PixelPoint> samples = new ArrayList<>(nSamples);
		samples.add(nodes.get(0));
		if (nSamples == 1) return samples;

		int leg = 1; // index of the node ending the current leg
		double legStart = 0; // arc length at the start of the current leg
		double legLength = nodes.get(0).distanceTo(nodes.get(1));
		for (int i = 1; i < nSamples; i++) {
			final double s = i;
			while (s > legStart + legLength && leg < nodes.size() - 1) {
				legStart += legLength;
				leg++;
				legLength = nodes.get(leg - 1).distanceTo(nodes.get(leg));
			}
			final PixelPoint a = nodes.get(leg - 1);
			final PixelPoint b = nodes.get(leg);
			final double t = (legLength > 0) ? Math.min(1d, (s - legStart) / legLength) : 0d;
			samples.add(new PixelPoint(a.x + t * (b.x - a.x), a.y + t * (b.y - a.y)));
		}
		return samples;
	}

	public VideoSource getVideo() {
		return video;
	}

}
