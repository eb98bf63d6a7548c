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

/**
 * Receives progress updates from a {@link FlowVelocityAnalyzer}, one per
 * (interval, segment) unit. Callbacks may arrive from worker threads.
 */
public interface AnalysisProgressListener {

	/*
	 * Called once a unit has been scored. Units complete in no particular order
	 * when the analysis is multithreaded.
	 */
	void unitCompleted(int intervalId, int segmentId, int completed, int total);

	/* Called once, after the last unit, or after the run was cancelled */
	void finished(boolean success);

}
