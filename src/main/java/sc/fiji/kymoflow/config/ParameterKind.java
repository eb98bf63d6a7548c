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

package sc.fiji.kymoflow.config;

import java.awt.Color;
import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import ij.plugin.Colors;
import sc.fiji.kymoflow.ConfigurationException;
import sc.fiji.kymoflow.analysis.orientation.OrientationMethod;
import sc.fiji.kymoflow.util.ColorMaps;

/**
 * The parameters understood by KymoFlow. Each kind carries its key, storage
 * type, default value (null when the parameter is required), validation
 * constraint and the upstream step responsible for supplying it.
 */
public enum ParameterKind {

	VIDEO_PATH("videoPath", ValueType.FILE, null, Constraint.NONE, "video acquisition (path to the recording)"),
	SEGMENTS_PATH("segmentsPath", ValueType.FILE, null, Constraint.NONE,
			"skeleton tracing (ROI set of segment polylines)"),
	INTERVALS_PATH("intervalsPath", ValueType.FILE, null, Constraint.NONE,
			"interval annotation (startFrame,endFrame list)"),
	OUTPUT_DIR("outputDir", ValueType.DIRECTORY, null, Constraint.NONE, "project setup (output directory)"),
	PIXEL_SIZE("pixelSize", ValueType.DOUBLE, null, Constraint.POSITIVE, "microscope calibration (µm per pixel)"),
	FRAME_RATE("frameRate", ValueType.DOUBLE, null, Constraint.POSITIVE, "acquisition settings (frames per second)"),
	MIN_SEGMENT_LENGTH("minSegmentLength", ValueType.DOUBLE, null, Constraint.NON_NEGATIVE,
			"analysis thresholds (shortest analyzable segment, µm)"),
	MAX_MEASURED_SPEED("maxMeasuredSpeed", ValueType.DOUBLE, null, Constraint.POSITIVE,
			"analysis thresholds (fastest plausible speed, µm/s)"),
	ORIENTATION_METHOD("orientationMethod", ValueType.CHOICE, OrientationMethod.LOCAL_GRADIENT.getLabel(),
			Constraint.NONE, "analysis options (orientation estimator)", OrientationMethod.labels()),
	FLICKER_CORRECTION("flickerCorrection", ValueType.BOOLEAN, "false", Constraint.NONE,
			"analysis options (illumination flicker correction)"),
	SAVE_KYMOGRAPHS("saveKymographs", ValueType.BOOLEAN, "false", Constraint.NONE,
			"analysis options (kymograph export)"),
	THREADS("threads", ValueType.INTEGER, "1", Constraint.POSITIVE, "analysis options (number of threads)"),
	VIRTUAL_STACK("virtualStack", ValueType.BOOLEAN, "false", Constraint.NONE,
			"video acquisition (open recording as virtual stack)"),
	MAX_PLOT_SPEED("maxPlotSpeed", ValueType.DOUBLE, null, Constraint.POSITIVE,
			"map rendering (speed mapped to the top of the LUT, µm/s)"),
	LINE_THICKNESS("lineThickness", ValueType.INTEGER, "3", Constraint.POSITIVE, "map rendering (line width, pixels)"),
	ARROW_SIZE("arrowSize", ValueType.DOUBLE, "10", Constraint.POSITIVE, "map rendering (arrow head size, pixels)"),
	ARROW_CUTOFF("arrowCutoff", ValueType.DOUBLE, "0", Constraint.NON_NEGATIVE,
			"map rendering (slowest speed drawn with an arrow, µm/s)"),
	BACKGROUND_COLOR("backgroundColor", ValueType.COLOR, "black", Constraint.NONE, "map rendering (background color)"),
	ARROW_COLOR("arrowColor", ValueType.COLOR, "", Constraint.NONE,
			"map rendering (arrow color, empty for segment color)"),
	LUT("lut", ValueType.CHOICE, ColorMaps.FIRE, Constraint.NONE, "map rendering (colormap)", ColorMaps.names()),
	DEBUG_MODE("debugMode", ValueType.BOOLEAN, "false", Constraint.NONE, "logging (verbose output)");

	enum Constraint {
		NONE, POSITIVE, NON_NEGATIVE
	}

	private final String key;
	private final ValueType type;
	private final String defaultValue;
	private final Constraint constraint;
	private final String suppliedBy;
	private final List<String> choices;

	ParameterKind(final String key, final ValueType type, final String defaultValue, final Constraint constraint,
			final String suppliedBy) {
		this(key, type, defaultValue, constraint, suppliedBy, Collections.emptyList());
	}

	ParameterKind(final String key, final ValueType type, final String defaultValue, final Constraint constraint,
			final String suppliedBy, final List<String> choices) {
		this.key = key;
		this.type = type;
		this.defaultValue = defaultValue;
		this.constraint = constraint;
		this.suppliedBy = suppliedBy;
		this.choices = Collections.unmodifiableList(choices);
	}

	public String getKey() {
		return key;
	}

	public ValueType getType() {
		return type;
	}

	/** @return the default value, or null if the parameter must be supplied */
	public String getDefaultValue() {
		return defaultValue;
	}

	/** @return the upstream step expected to supply this parameter */
	public String getSuppliedBy() {
		return suppliedBy;
	}

	public List<String> getChoices() {
		return choices;
	}

	/** @return true if an empty value is an error when the parameter is read */
	public boolean isRequired() {
		return defaultValue == null;
	}

	/**
	 * @param key a configuration key (case insensitive)
	 * @return the matching parameter, or null if {@code key} is not recognized
	 */
	public static ParameterKind fromKey(final String key) {
		if (key == null) return null;
		return Arrays.stream(values()).filter(k -> k.key.equalsIgnoreCase(key.trim())).findFirst().orElse(null);
	}

	/**
	 * Parses and validates a raw (non-empty) value.
	 *
	 * @param raw the value as read from the configuration
	 * @return the typed value: a String, File, Double, Integer, Boolean or Color
	 * @throws ConfigurationException if the value is malformed or violates this
	 *                                parameter's constraint
	 */
	Object parse(final String raw) {
		final String value = raw.trim();
		switch (type) {
		case DOUBLE:
			try {
				final double d = Double.parseDouble(value);
				checkConstraint(d);
				return d;
			} catch (final NumberFormatException e) {
				throw new ConfigurationException(this, "is not a number: '" + value + "'");
			}
		case INTEGER:
			try {
				final int i = Integer.parseInt(value);
				checkConstraint(i);
				return i;
			} catch (final NumberFormatException e) {
				throw new ConfigurationException(this, "is not an integer: '" + value + "'");
			}
		case BOOLEAN:
			switch (value.toLowerCase(Locale.ROOT)) {
			case "true", "yes", "1", "on":
				return Boolean.TRUE;
			case "false", "no", "0", "off":
				return Boolean.FALSE;
			default:
				throw new ConfigurationException(this, "is not a boolean: '" + value + "'");
			}
		case COLOR:
			final Color color = (value.startsWith("#")) ? Colors.decode(value, null) : Colors.getColor(value, null);
			if (color == null) throw new ConfigurationException(this, "is not a valid color: '" + value + "'");
			return color;
		case CHOICE:
			return choices.stream().filter(c -> c.equalsIgnoreCase(value)).findFirst()
					.orElseThrow(() -> new ConfigurationException(this,
							"must be one of " + StringUtils.join(choices, ", ") + " (got '" + value + "')"));
		case FILE:
		case DIRECTORY:
			return new File(value);
		default:
			return value;
		}
	}

	private void checkConstraint(final double value) {
		if (!Double.isFinite(value)) throw new ConfigurationException(this, "must be finite (got " + value + ")");
		if (constraint == Constraint.POSITIVE && value <= 0)
			throw new ConfigurationException(this, "must be > 0 (got " + value + ")");
		if (constraint == Constraint.NON_NEGATIVE && value < 0)
			throw new ConfigurationException(this, "must be >= 0 (got " + value + ")");
	}

}
