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

package sc.fiji.kymoflow.plugin;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CancellationException;

import org.scijava.app.StatusService;
import org.scijava.command.Command;
import org.scijava.command.ContextCommand;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.widget.FileWidget;

import sc.fiji.kymoflow.FlowPipeline;
import sc.fiji.kymoflow.KymoFlowException;
import sc.fiji.kymoflow.KymoFlowUtils;
import sc.fiji.kymoflow.analysis.AnalysisProgressListener;
import sc.fiji.kymoflow.analysis.FlowAnalysisResult;

/**
 * Command measuring blood flow velocities from a traced vessel video, as
 * described by a KymoFlow configuration file. Saves the velocity, angle and
 * fit tables and the spatial map to the configured output directory.
 */
@Plugin(type = Command.class, menuPath = "Plugins>KymoFlow>Measure Flow Velocities...",
		label = "KymoFlow: Measure Flow Velocities")
public class FlowVelocityCmd extends ContextCommand {

	@Parameter
	private LogService logService;

	@Parameter
	private StatusService statusService;

	@Parameter(label = "Configuration file", style = FileWidget.OPEN_STYLE,
			description = "<HTML>Text file listing the run parameters (<i>key,value,description</i>)")
	private File configFile;

	private FlowPipeline pipeline;
	private FlowAnalysisResult result;

	public FlowVelocityCmd() {
		// required for SciJava discovery
	}

	/**
	 * Instantiates a new FlowVelocityCmd for scripted (non-interactive) runs.
	 *
	 * @param configFile the configuration file
	 */
	public FlowVelocityCmd(final File configFile) {
		this.configFile = configFile;
	}

	@Override
	public void run() {
		KymoFlowUtils.setContext(getContext());
		try {
			pipeline = FlowPipeline.fromFile(configFile);
			pipeline.setProgressListener(new AnalysisProgressListener() {

				@Override
				public void unitCompleted(final int intervalId, final int segmentId, final int completed,
						final int total) {
					statusService.showProgress(completed, total);
				}

				@Override
				public void finished(final boolean success) {
					statusService.clearStatus();
				}
			});
			statusService.showStatus("Measuring flow velocities...");
			result = pipeline.run();
			statusService.showStatus("Flow analysis completed: " + result);
		} catch (final CancellationException e) {
			cancel("Flow analysis cancelled.");
		} catch (final KymoFlowException | IOException e) {
			logService.error("Flow analysis failed: " + e.getMessage(), e);
			cancel(e.getMessage());
		}
	}

	@Override
	public void cancel(final String reason) {
		if (pipeline != null) pipeline.cancel();
		super.cancel(reason);
	}

	/** @return the result of the last run, or null if it did not complete */
	public FlowAnalysisResult getResult() {
		return result;
	}

}
