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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import ij.ImagePlus;
import ij.io.FileSaver;
import sc.fiji.kymoflow.Interval;
import sc.fiji.kymoflow.IntervalCatalog;
import sc.fiji.kymoflow.KymoFlowUtils;
import sc.fiji.kymoflow.Segment;
import sc.fiji.kymoflow.SegmentCatalog;
import sc.fiji.kymoflow.analysis.orientation.OrientationEstimator;
import sc.fiji.kymoflow.analysis.orientation.OrientationResult;
import sc.fiji.kymoflow.io.VideoSource;
import sc.fiji.kymoflow.util.Logger;

/**
 * Measures flow velocities for every (interval, segment) pair of a traced
 * video: each pair is resampled into a kymograph, its dominant orientation is
 * estimated and converted into a velocity entry.
 * <p>
 * Units are independent of each other, so segments of an interval may be
 * processed on a thread pool ({@link #setThreads(int)}). Results are inserted
 * into the matrices by (interval, segment) key: a multithreaded run yields the
 * same matrices as a sequential one. Runs can be cancelled cooperatively: the
 * cancellation flag (and the interrupt status of the calling thread) is checked
 * before each unit.
 * </p>
 */
public class FlowVelocityAnalyzer {

	private final KymographBuilder builder;
	private final SegmentCatalog segments;
	private final IntervalCatalog intervals;
	private final OrientationEstimator estimator;
	private final VelocityCalculator calculator;
	private final Logger logger;

	private boolean flickerCorrected;
	private int nThreads = 1;
	private File kymographDir;
	private AnalysisProgressListener listener;
	private volatile boolean cancelled;

	public FlowVelocityAnalyzer(final VideoSource video, final SegmentCatalog segments, final IntervalCatalog intervals,
			final OrientationEstimator estimator, final VelocityCalculator calculator) {
		if (segments == null || intervals == null || estimator == null || calculator == null)
			throw new IllegalArgumentException("Arguments cannot be null");
		this.builder = new KymographBuilder(video);
		this.segments = segments;
		this.intervals = intervals;
		this.estimator = estimator;
		this.calculator = calculator;
		logger = new Logger(FlowVelocityAnalyzer.class);
	}

	/** Sets whether kymographs are flicker-corrected prior to orientation analysis */
	public void setFlickerCorrected(final boolean flickerCorrected) {
		this.flickerCorrected = flickerCorrected;
	}

	/**
	 * @param nThreads the number of worker threads. Values below 1 are treated as
	 *                 1 (sequential run)
	 */
	public void setThreads(final int nThreads) {
		this.nThreads = Math.max(1, nThreads);
	}

	/**
	 * @param dir the directory in which kymographs are to be saved as TIFF. Null
	 *            (the default) disables kymograph export
	 */
	public void setKymographDirectory(final File dir) {
		this.kymographDir = dir;
	}

	public void setProgressListener(final AnalysisProgressListener listener) {
		this.listener = listener;
	}

	public void setDebug(final boolean debug) {
		logger.setDebug(debug);
	}

	/**
	 * Requests the analysis to stop before its next unit. Also honored by a run
	 * that has not started yet: a cancelled analyzer cannot be run again.
	 */
	public void cancel() {
		cancelled = true;
	}

	public boolean isCancelled() {
		return cancelled;
	}

	/**
	 * Runs the analysis.
	 *
	 * @return the analysis result
	 * @throws sc.fiji.kymoflow.RangeException if an interval exceeds the frames
	 *                                         of the video
	 * @throws CancellationException           if the run was cancelled
	 * @throws IOException                     if a kymograph could not be saved
	 */
	public FlowAnalysisResult run() throws IOException {
		intervals.validateAgainst(builder.getVideo().getFrameCount());
		final long start = System.currentTimeMillis();
		final int total = intervals.size() * segments.size();
		logger.info("Analyzing " + segments.size() + " segment(s) over " + intervals.size() + " interval(s) using "
				+ nThreads + " thread(s)...");

		final VelocityMatrix velocities = new VelocityMatrix(intervals.size(), segments.size());
		final ValueMatrix angles = new ValueMatrix("Angle", intervals.size(), segments.size());
		final ValueMatrix fits = new ValueMatrix("Fit", intervals.size(), segments.size());
		final AtomicInteger counter = new AtomicInteger();
		boolean success = false;
		try {
			if (nThreads == 1) {
				for (final Interval interval : intervals) {
					for (final Segment segment : segments) {
						score(segment, interval, velocities, angles, fits, counter, total);
					}
				}
			} else {
				runMultithreaded(velocities, angles, fits, counter, total);
			}
			success = true;
		} finally {
			if (listener != null) listener.finished(success);
		}
		final List<ComputationAnomaly> anomalies = calculator.getAnomalies();
		if (!anomalies.isEmpty())
			logger.warn(anomalies.size() + " non-finite measurement(s) were classified as out of range");
		logger.info("Analysis completed in " + KymoFlowUtils.getElapsedTime(start));
		return new FlowAnalysisResult(segments, intervals, velocities, angles, fits, anomalies);
	}

	private void runMultithreaded(final VelocityMatrix velocities, final ValueMatrix angles, final ValueMatrix fits,
			final AtomicInteger counter, final int total) throws IOException {
		final ExecutorService es = Executors.newFixedThreadPool(nThreads);
		try {
			for (final Interval interval : intervals) {
				final List<Future<Void>> futures = new ArrayList<>(segments.size());
				for (final Segment segment : segments) {
					futures.add(es.submit(() -> {
						score(segment, interval, velocities, angles, fits, counter, total);
						return null;
					}));
				}
				for (final Future<Void> future : futures) {
					try {
						future.get();
					} catch (final InterruptedException e) {
						Thread.currentThread().interrupt();
						cancelled = true;
						throw new CancellationException("Analysis interrupted");
					} catch (final ExecutionException e) {
						final Throwable cause = e.getCause();
						if (cause instanceof IOException) throw (IOException) cause;
						if (cause instanceof RuntimeException) throw (RuntimeException) cause;
						if (cause instanceof Error) throw (Error) cause;
						throw new IllegalStateException(cause);
					}
				}
			}
		} finally {
			es.shutdownNow();
		}
	}

	private void score(final Segment segment, final Interval interval, final VelocityMatrix velocities,
			final ValueMatrix angles, final ValueMatrix fits, final AtomicInteger counter, final int total)
			throws IOException {
		if (cancelled || Thread.currentThread().isInterrupted()) {
			cancelled = true;
			throw new CancellationException("Analysis cancelled before " + interval + ", segment " + segment.getId());
		}
		final Kymograph kymograph = builder.build(segment, interval);
		if (kymographDir != null) saveKymograph(kymograph);
		final OrientationResult orientation = estimator.estimate(kymograph.getRaster(), flickerCorrected);
		final VelocityEntry entry = calculator.classify(segment, interval, orientation.getAngle());
		velocities.put(interval.getId(), segment.getId(), entry);
		angles.put(interval.getId(), segment.getId(), orientation.getAngleDegrees());
		fits.put(interval.getId(), segment.getId(), orientation.getFitGoodness());
		final int completed = counter.incrementAndGet();
		logger.debug(String.format("[%d/%d] %s, %s: %s (angle: %s)", completed, total, interval, segment.getName(),
				entry.toToken(), orientation));
		if (listener != null) listener.unitCompleted(interval.getId(), segment.getId(), completed, total);
	}

	private void saveKymograph(final Kymograph kymograph) throws IOException {
		final File file = new File(kymographDir, kymograph.getTitle() + ".tif");
		KymoFlowUtils.prepareForWriting(file);
		final ImagePlus imp = kymograph.toImagePlus(calculator.getPixelSize(), calculator.getFrameRate());
		if (!new FileSaver(imp).saveAsTiff(file.getAbsolutePath()))
			throw new IOException("Could not save " + file.getAbsolutePath());
	}

}
