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
package sc.fiji.kymoflow.util;

import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import sc.fiji.kymoflow.KymoFlowUtils;

/**
 * Logger for a single KymoFlow component. Messages are routed to the
 * {@link LogService} of the context and prefixed with the component name.
 * <p>
 * Debug messages follow {@link KymoFlowUtils#isDebugMode()} unless the
 * component overrides it with {@link #setDebug(boolean)}.
 * </p>
 */
public class Logger {

	@Parameter
	private LogService logService;

	private final String component;
	private Boolean debug;

	public Logger(final Class<?> clazz) {
		this(KymoFlowUtils.getContext(), clazz.getSimpleName());
	}

	/**
	 * @param context   the SciJava context providing the LogService
	 * @param component the name prefixed to every message
	 */
	public Logger(final Context context, final String component) {
		context.inject(this);
		this.component = component;
	}

	private String format(final Object msg) {
		return "[" + component + "] " + msg;
	}

	public void info(final Object msg) {
		logService.info(format(msg));
	}

	/** Logs a message only while debugging. */
	public void debug(final Object msg) {
		if (isDebug()) logService.info(format(msg));
	}

	public void warn(final Object msg) {
		logService.warn(format(msg));
	}

	public boolean isDebug() {
		return (debug == null) ? KymoFlowUtils.isDebugMode() || logService.isDebug() : debug;
	}

	/**
	 * @param debug whether debug messages of this component should be logged.
	 *              Overrides the global debug mode
	 */
	public void setDebug(final boolean debug) {
		this.debug = debug;
	}

}
