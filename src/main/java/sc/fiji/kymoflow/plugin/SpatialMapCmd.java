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

import java.awt.GraphicsEnvironment;
import java.io.File;
import java.io.IOException;

import org.scijava.command.Command;
import org.scijava.command.ContextCommand;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.widget.FileWidget;

import ij.ImagePlus;
import sc.fiji.kymoflow.FlowPipeline;
import sc.fiji.kymoflow.KymoFlowException;
import sc.fiji.kymoflow.KymoFlowUtils;

/**
 * Command re-rendering the spatial map from a previously saved velocity table,
 * e.g., after changing the rendering parameters of a configuration file.
 */
@Plugin(type = Command.class, menuPath = "Plugins>KymoFlow>Render Spatial Map...",
		label = "KymoFlow: Render Spatial Map")
public class SpatialMapCmd extends ContextCommand {

	@Parameter
	private LogService logService;

	@Parameter(label = "Configuration file", style = FileWidget.OPEN_STYLE)
	private File configFile;

	@Parameter(label = "Display map", required = false)
	private boolean display;

	private ImagePlus map;

	public SpatialMapCmd() {
		// required for SciJava discovery
	}

	/**
	 * Instantiates a new SpatialMapCmd for scripted (non-interactive) runs.
	 *
	 * @param configFile the configuration file
	 */
	public SpatialMapCmd(final File configFile) {
		this.configFile = configFile;
	}

	@Override
	public void run() {
		KymoFlowUtils.setContext(getContext());
		try {
			map = FlowPipeline.fromFile(configFile).renderMap();
			if (display && !GraphicsEnvironment.isHeadless()) map.show();
		} catch (final KymoFlowException | IOException e) {
			logService.error("Spatial map could not be rendered: " + e.getMessage(), e);
			cancel(e.getMessage());
		}
	}

	/** @return the rendered map, or null if rendering failed */
	public ImagePlus getMap() {
		return map;
	}

}
