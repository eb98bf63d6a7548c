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

import ij.ImagePlus;
import sc.fiji.kymoflow.analysis.AnalysisProgressListener;
import sc.fiji.kymoflow.analysis.FlowAnalysisResult;
import sc.fiji.kymoflow.analysis.FlowVelocityAnalyzer;
import sc.fiji.kymoflow.analysis.SpatialMapRenderer;
import sc.fiji.kymoflow.analysis.VelocityCalculator;
import sc.fiji.kymoflow.analysis.VelocityMatrix;
import sc.fiji.kymoflow.config.ConfigLoader;
import sc.fiji.kymoflow.config.KymoFlowConfig;
import sc.fiji.kymoflow.config.ParameterKind;
import sc.fiji.kymoflow.io.ImagePlusVideoSource;
import sc.fiji.kymoflow.io.MatrixIO;
import sc.fiji.kymoflow.io.RoiSetIO;
import sc.fiji.kymoflow.io.SpatialMapWriter;
import sc.fiji.kymoflow.io.VideoSource;
import sc.fiji.kymoflow.util.Logger;

/**
 * Runs a complete flow analysis from a single configuration: loads the
 * segment and interval catalogs and the video, measures velocities, persists
 * the matrices (velocity, angle, fit), the segment summary and anomaly report,
 * and renders the spatial map.
 * <p>
 * All inputs are validated before anything is written, so that a run aborted
 * by a {@link ConfigurationException} or {@link RangeException} leaves earlier
 * outputs untouched. Outputs replacing existing files are preceded by a backup
 * of those files.
 * </p>
 */
public class FlowPipeline {

	public static final String SPATIAL_MAP_FILE = "spatial_map.tif";
	public static final String KYMOGRAPH_DIR = "kymographs";
	public static final String CONFIG_COPY_FILE = "kymoflow_config.csv";

	private final KymoFlowConfig config;
	private final Logger logger;
	private AnalysisProgressListener listener;
	private volatile FlowVelocityAnalyzer analyzer;
	private VideoSource video;

	public FlowPipeline(final KymoFlowConfig config) {
		if (config == null) throw new IllegalArgumentException("Configuration cannot be null");
		this.config = config;
		KymoFlowUtils.setDebugMode(config.getBoolean(ParameterKind.DEBUG_MODE));
		logger = new Logger(FlowPipeline.class);
	}

	/**
	 * @param configFile the configuration file
	 * @return a pipeline for the loaded configuration
	 * @throws IOException if the file could not be read
	 */
	public static FlowPipeline fromFile(final File configFile) throws IOException {
		return new FlowPipeline(ConfigLoader.load(configFile));
	}

	/**
	 * Uses an already opened video instead of the one referenced by the
	 * configuration.
	 */
	public void setVideo(final VideoSource video) {
		this.video = video;
	}

	public void setProgressListener(final AnalysisProgressListener listener) {
		this.listener = listener;
	}

	/** Requests the running analysis (if any) to stop */
	public void cancel() {
		final FlowVelocityAnalyzer current = analyzer;
		if (current != null) current.cancel();
	}

	/**
	 * Runs the full pipeline: analysis, persistence and spatial map rendering.
	 *
	 * @return the analysis result
	 * @throws ConfigurationException if a required parameter is missing or a
	 *                                referenced file does not exist
	 * @throws RangeException         if an interval exceeds the frames of the
	 *                                video
	 * @throws IOException            if an input could not be read or an output
	 *                                could not be written
	 */
	public FlowAnalysisResult run() throws IOException {
		final long start = System.currentTimeMillis();
		final double pixelSize = config.getDouble(ParameterKind.PIXEL_SIZE);
		final double frameRate = config.getDouble(ParameterKind.FRAME_RATE);
		final VelocityCalculator calculator = new VelocityCalculator(frameRate, pixelSize,
				config.getDouble(ParameterKind.MIN_SEGMENT_LENGTH), config.getDouble(ParameterKind.MAX_MEASURED_SPEED));
		final File outputDir = config.getDirectory(ParameterKind.OUTPUT_DIR);
		final SegmentCatalog segments = loadSegments(pixelSize);
		final IntervalCatalog intervals = loadIntervals();
		final VideoSource source = openVideo(false);
		source.setCalibration(pixelSize, frameRate);
		intervals.validateAgainst(source.getFrameCount());
		final SpatialMapRenderer renderer = SpatialMapRenderer.fromConfig(config, segments, source.getWidth(),
				source.getHeight());

		final FlowVelocityAnalyzer fva = new FlowVelocityAnalyzer(source, segments, intervals,
				config.getOrientationMethod().createEstimator(), calculator);
		fva.setFlickerCorrected(config.getBoolean(ParameterKind.FLICKER_CORRECTION));
		fva.setThreads(config.getInt(ParameterKind.THREADS));
		fva.setProgressListener(listener);
		fva.setDebug(KymoFlowUtils.isDebugMode());
		if (config.getBoolean(ParameterKind.SAVE_KYMOGRAPHS)) fva.setKymographDirectory(new File(outputDir, KYMOGRAPH_DIR));
		analyzer = fva;
		final FlowAnalysisResult result;
		try {
			result = fva.run();
		} finally {
			analyzer = null;
		}

		MatrixIO.saveAll(result, outputDir);
		ConfigLoader.save(config, new File(outputDir, CONFIG_COPY_FILE));
		final ImagePlus map = renderer.render(result.getVelocities(), pixelSize);
		SpatialMapWriter.save(map, new File(outputDir, SPATIAL_MAP_FILE));
		logger.info(result + ". Outputs saved to " + outputDir.getAbsolutePath() + " ("
				+ KymoFlowUtils.getElapsedTime(start) + ")");
		return result;
	}

	/**
	 * Renders the spatial map from a previously saved velocity matrix, without
	 * re-analyzing the video.
	 *
	 * @return the rendered map
	 * @throws RangeException         if the number of rows of the velocity matrix
	 *                                differs from the number of intervals, or its
	 *                                columns from the number of segments
	 * @throws DataIntegrityException if the velocity matrix holds invalid cells
	 * @throws IOException            if an input could not be read or the map
	 *                                could not be written
	 */
	public ImagePlus renderMap() throws IOException {
		final double pixelSize = config.getDouble(ParameterKind.PIXEL_SIZE);
		final File outputDir = config.getDirectory(ParameterKind.OUTPUT_DIR);
		final SegmentCatalog segments = loadSegments(pixelSize);
		final IntervalCatalog intervals = loadIntervals();
		final File velocityFile = new File(outputDir, MatrixIO.VELOCITY_FILE);
		if (!velocityFile.exists())
			throw new ConfigurationException(ParameterKind.OUTPUT_DIR, "holds no " + MatrixIO.VELOCITY_FILE
					+ " (the flow analysis must be run first)");
		final VelocityMatrix velocities = MatrixIO.loadVelocities(velocityFile, segments, intervals);
		final VideoSource source = openVideo(true);
		final SpatialMapRenderer renderer = SpatialMapRenderer.fromConfig(config, segments, source.getWidth(),
				source.getHeight());
		final ImagePlus map = renderer.render(velocities, pixelSize);
		SpatialMapWriter.save(map, new File(outputDir, SPATIAL_MAP_FILE));
		logger.info("Spatial map rendered for " + intervals.size() + " interval(s)");
		return map;
	}

	private SegmentCatalog loadSegments(final double pixelSize) throws IOException {
		final File file = config.getFile(ParameterKind.SEGMENTS_PATH);
		final SegmentCatalog segments = RoiSetIO.load(file, pixelSize);
		logger.debug("Loaded " + segments.size() + " segment(s) from " + file.getName());
		return segments;
	}

	private IntervalCatalog loadIntervals() throws IOException {
		final File file = config.getFile(ParameterKind.INTERVALS_PATH);
		try {
			final IntervalCatalog intervals = IntervalCatalog.load(file);
			if (intervals.isEmpty()) throw new ConfigurationException(ParameterKind.INTERVALS_PATH, "defines no intervals");
			return intervals;
		} catch (final IllegalArgumentException e) {
			throw new ConfigurationException(ParameterKind.INTERVALS_PATH, "holds invalid intervals: " + e.getMessage());
		}
	}

	private VideoSource openVideo(final boolean dimensionsOnly) throws IOException {
		if (video != null) return video;
		final boolean virtual = dimensionsOnly || config.getBoolean(ParameterKind.VIRTUAL_STACK);
		video = ImagePlusVideoSource.open(config.getFile(ParameterKind.VIDEO_PATH), virtual);
		logger.debug("Opened " + video.getTitle() + ": " + video.getWidth() + "x" + video.getHeight() + ", "
				+ video.getFrameCount() + " frames");
		return video;
	}

	public KymoFlowConfig getConfig() {
		return config;
	}

}
