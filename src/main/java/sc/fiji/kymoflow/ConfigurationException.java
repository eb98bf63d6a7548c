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

import sc.fiji.kymoflow.config.ParameterKind;

/**
 * Thrown when a required parameter is missing, empty or malformed, or when a
 * path referenced by the configuration does not exist. The message names the
 * parameter and the upstream step expected to supply it.
 */
public class ConfigurationException extends KymoFlowException {

	private static final long serialVersionUID = 1L;
	private final ParameterKind parameter;

	public ConfigurationException(final ParameterKind parameter, final String problem) {
		super(buildMessage(parameter, problem));
		this.parameter = parameter;
	}

	public ConfigurationException(final String message) {
		super(message);
		this.parameter = null;
	}

	private static String buildMessage(final ParameterKind parameter, final String problem) {
		if (parameter == null) return problem;
		return String.format("Parameter '%s' %s. It should be set by: %s", parameter.getKey(), problem,
				parameter.getSuppliedBy());
	}

	/**
	 * @return the offending parameter, or null if the error is not tied to a
	 *         single parameter
	 */
	public ParameterKind getParameter() {
		return parameter;
	}

}
