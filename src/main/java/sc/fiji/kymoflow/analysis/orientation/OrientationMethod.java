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

package sc.fiji.kymoflow.analysis.orientation;

import java.util.ArrayList;
import java.util.List;

/**
 * The available {@link OrientationEstimator} strategies, as selected by
 * configuration.
 */
public enum OrientationMethod {

	LOCAL_GRADIENT("local gradient"),
	FOURIER_COMPONENTS("fourier components");

	private final String label;

	OrientationMethod(final String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	/** @return a new estimator implementing this method */
	public OrientationEstimator createEstimator() {
		return switch (this) {
			case LOCAL_GRADIENT -> new LocalGradientEstimator();
			case FOURIER_COMPONENTS -> new FourierComponentsEstimator();
		};
	}

	public static List<String> labels() {
		final List<String> labels = new ArrayList<>();
		for (final OrientationMethod m : values())
			labels.add(m.label);
		return labels;
	}

	/**
	 * @param label the method label (case insensitive), or the constant name
	 * @return the matching method
	 * @throws IllegalArgumentException if label is not recognized
	 */
	public static OrientationMethod fromLabel(final String label) {
		for (final OrientationMethod m : values()) {
			if (m.label.equalsIgnoreCase(label.trim()) || m.name().equalsIgnoreCase(label.trim())) return m;
		}
		throw new IllegalArgumentException("Unknown orientation method: " + label);
	}

}
