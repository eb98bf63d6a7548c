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
import java.util.List;

import ij.ImagePlus;
import ij.ImageStack;
import ij.gui.PolygonRoi;
import ij.gui.Roi;
import ij.measure.Calibration;
import ij.process.ColorProcessor;
import ij.process.FloatPolygon;
import sc.fiji.kymoflow.Segment;
import sc.fiji.kymoflow.SegmentCatalog;
import sc.fiji.kymoflow.config.KymoFlowConfig;
import sc.fiji.kymoflow.config.ParameterKind;
import sc.fiji.kymoflow.util.ColorMaps;
import sc.fiji.kymoflow.util.PixelPoint;

/**
 * Renders velocity matrices back onto the vessel network: one RGB frame per
 * interval, at the size of the video, in which each segment with a numeric
 * velocity is drawn in its speed color, with an arrow (at its midpoint) giving
 * the flow direction.
 * <p>
 * Segments holding a sentinel are not drawn. Segments are painted in catalog
 * order, so later segments overpaint pixels shared with earlier ones. No
 * arrow is drawn when {@code |velocity| <= arrowCutoff}.
 * </p>
 */
public class SpatialMapRenderer {

	/** Offset (in polyline nodes) of the arrow anchors from the midpoint */
	public static final int ARROW_BRACKET = 8;

	private final SegmentCatalog segments;
	private final int width;
	private final int height;
	private final SpeedColorMapper colorMapper;
	private int lineThickness = 3;
	private double arrowSize = 10;
	private double arrowCutoff;
	private Color backgroundColor = Color.BLACK;
	private Color arrowColor;

	/**
	 * @param segments    the segment geometry
	 * @param width       the width of rendered frames (video width)
	 * @param height      the height of rendered frames (video height)
	 * @param colorMapper the speed-to-color mapping
	 */
	public SpatialMapRenderer(final SegmentCatalog segments, final int width, final int height,
			final SpeedColorMapper colorMapper) {
		if (segments == null || colorMapper == null) throw new IllegalArgumentException("Arguments cannot be null");
		if (width < 1 || height < 1) throw new IllegalArgumentException("Invalid frame dimensions");
		this.segments = segments;
		this.width = width;
		this.height = height;
		this.colorMapper = colorMapper;
	}

	/**
	 * Creates a renderer from the map rendering parameters of a configuration.
	 *
	 * @throws sc.fiji.kymoflow.ConfigurationException if a required rendering
	 *                                                 parameter is empty
	 */
	public static SpatialMapRenderer fromConfig(final KymoFlowConfig config, final SegmentCatalog segments,
			final int width, final int height) {
		final SpeedColorMapper mapper = new SpeedColorMapper(ColorMaps.get(config.getString(ParameterKind.LUT)),
				config.getDouble(ParameterKind.MAX_PLOT_SPEED));
		final SpatialMapRenderer renderer = new SpatialMapRenderer(segments, width, height, mapper);
		renderer.setLineThickness(config.getInt(ParameterKind.LINE_THICKNESS));
		renderer.setArrowSize(config.getDouble(ParameterKind.ARROW_SIZE));
		renderer.setArrowCutoff(config.getDouble(ParameterKind.ARROW_CUTOFF));
		renderer.setBackgroundColor(config.getColor(ParameterKind.BACKGROUND_COLOR));
		renderer.setArrowColor(config.getColorOrNull(ParameterKind.ARROW_COLOR));
		return renderer;
	}

	public void setLineThickness(final int lineThickness) {
		if (lineThickness < 1) throw new IllegalArgumentException("Line thickness must be >= 1");
		this.lineThickness = lineThickness;
	}

	public void setArrowSize(final double arrowSize) {
		if (!(arrowSize > 0)) throw new IllegalArgumentException("Arrow size must be > 0");
		this.arrowSize = arrowSize;
	}

	/** @param arrowCutoff speeds at or below this value (µm/s) get no arrow */
	public void setArrowCutoff(final double arrowCutoff) {
		if (!(arrowCutoff >= 0)) throw new IllegalArgumentException("Arrow cutoff must be >= 0");
		this.arrowCutoff = arrowCutoff;
	}

	public void setBackgroundColor(final Color backgroundColor) {
		this.backgroundColor = (backgroundColor == null) ? Color.BLACK : backgroundColor;
	}

	/** @param arrowColor the arrow color. Null paints arrows in segment color */
	public void setArrowColor(final Color arrowColor) {
		this.arrowColor = arrowColor;
	}

	/**
	 * Renders all the intervals of a velocity matrix.
	 *
	 * @param velocities the velocity matrix. Its column count must match the
	 *                   number of segments
	 * @param pixelSize  the pixel size (µm) used to calibrate the output. Ignored
	 *                   if not positive
	 * @return the spatial map, one frame per interval
	 */
	public ImagePlus render(final VelocityMatrix velocities, final double pixelSize) {
		final ImageStack stack = new ImageStack(width, height);
		for (int i = 1; i <= velocities.getRowCount(); i++) {
			stack.addSlice("Interval " + i, renderFrame(velocities.getRow(i)));
		}
		final ImagePlus imp = new ImagePlus("Spatial map", stack);
		if (pixelSize > 0) {
			final Calibration cal = imp.getCalibration();
			cal.pixelWidth = pixelSize;
			cal.pixelHeight = pixelSize;
			cal.setUnit("micron");
		}
		return imp;
	}

	/**
	 * Renders a single interval.
	 *
	 * @param row the velocity entries of the interval, in segment order
	 * @return the rendered frame
	 */
	public ColorProcessor renderFrame(final List<VelocityEntry> row) {
		if (row.size() != segments.size())
			throw new IllegalArgumentException("Expected " + segments.size() + " entries but got " + row.size());
		final ColorProcessor cp = new ColorProcessor(width, height);
		cp.setColor(backgroundColor);
		cp.fill();
		for (final Segment segment : segments) {
			final VelocityEntry entry = row.get(segment.getId() - 1);
			if (entry == null || entry.isSentinel()) continue;
			drawSegment(cp, segment, entry.getValue());
		}
		return cp;
	}

	private void drawSegment(final ColorProcessor cp, final Segment segment, final double velocity) {
		final Color color = colorMapper.getColor(velocity);
		cp.setColor(color);
		cp.setLineWidth(lineThickness);
		final List<PixelPoint> nodes = segment.getNodes();
		final PixelPoint first = nodes.get(0);
		if (nodes.size() == 1) {
			cp.drawDot(px(first.x), px(first.y));
		} else {
			cp.moveTo(px(first.x), px(first.y));
			for (int i = 1; i < nodes.size(); i++) {
				cp.lineTo(px(nodes.get(i).x), px(nodes.get(i).y));
			}
		}
		final PixelPoint[] anchors = arrowAnchors(segment);
		if (velocity > arrowCutoff) {
			drawArrow(cp, anchors[0], anchors[1], (arrowColor == null) ? color : arrowColor);
		} else if (velocity < -arrowCutoff) {
			drawArrow(cp, anchors[1], anchors[0], (arrowColor == null) ? color : arrowColor);
		}
	}

	/**
	 * @return the two nodes bracketing the midpoint of a segment's polyline
	 *         ({@link #ARROW_BRACKET} nodes before and after it, clamped to the
	 *         polyline), in the order of increasing position
	 */
	public static PixelPoint[] arrowAnchors(final Segment segment) {
		final int n = segment.size();
		final int mid = n / 2;
		final int pre = Math.max(0, mid - ARROW_BRACKET);
		final int post = Math.min(n - 1, mid + ARROW_BRACKET);
		return new PixelPoint[] { segment.getNode(pre), segment.getNode(post) };
	}

	private void drawArrow(final ColorProcessor cp, final PixelPoint from, final PixelPoint to, final Color color) {
		final double dx = to.x - from.x;
		final double dy = to.y - from.y;
		final double length = Math.sqrt(dx * dx + dy * dy);
		if (length == 0) return;
		cp.setColor(color);
		cp.drawLine(px(from.x), px(from.y), px(to.x), px(to.y));
		final double ux = dx / length;
		final double uy = dy / length;
		final double baseX = to.x - ux * arrowSize;
		final double baseY = to.y - uy * arrowSize;
		final double halfWidth = arrowSize / 2;
		final float[] xs = { (float) (to.x + ux * lineThickness / 2d), (float) (baseX - uy * halfWidth),
				(float) (baseX + uy * halfWidth) };
		final float[] ys = { (float) (to.y + uy * lineThickness / 2d), (float) (baseY + ux * halfWidth),
				(float) (baseY - ux * halfWidth) };
		cp.fill(new PolygonRoi(new FloatPolygon(xs, ys), Roi.POLYGON));
	}

	private static int px(final double coordinate) {
		return (int) Math.round(coordinate);
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public SpeedColorMapper getColorMapper() {
		return colorMapper;
	}

}
