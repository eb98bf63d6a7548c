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
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import sc.fiji.kymoflow.ConfigurationException;
import sc.fiji.kymoflow.analysis.orientation.OrientationMethod;

/**
 * Immutable set of run parameters. Values are parsed and validated once, when
 * the configuration is built; a parameter left empty only fails when it is
 * first read, with a {@link ConfigurationException} naming it.
 * <p>
 * Instances are never mutated: {@link #with(ParameterKind, Object)} returns a
 * rebuilt copy.
 * </p>
 */
public class KymoFlowConfig {

	private final Map<ParameterKind, String> rawValues;
	private final Map<ParameterKind, Object> values;

	private KymoFlowConfig(final Map<ParameterKind, String> rawValues) {
		final EnumMap<ParameterKind, String> raw = new EnumMap<>(ParameterKind.class);
		final EnumMap<ParameterKind, Object> parsed = new EnumMap<>(ParameterKind.class);
		for (final ParameterKind kind : ParameterKind.values()) {
			final String value = rawValues.get(kind);
			raw.put(kind, (value == null) ? "" : value.trim());
			if (value != null && !value.isBlank()) {
				parsed.put(kind, kind.parse(value));
			} else if (kind.getDefaultValue() != null && !kind.getDefaultValue().isEmpty()) {
				parsed.put(kind, kind.parse(kind.getDefaultValue()));
			}
		}
		this.rawValues = Collections.unmodifiableMap(raw);
		this.values = Collections.unmodifiableMap(parsed);
	}

	/**
	 * @param rawValues the raw (string) values. Missing keys load as empty
	 * @return the validated configuration
	 * @throws ConfigurationException if a non-empty value is malformed
	 */
	public static KymoFlowConfig of(final Map<ParameterKind, String> rawValues) {
		return new KymoFlowConfig(rawValues);
	}

	/** @return a configuration in which every parameter is empty */
	public static KymoFlowConfig empty() {
		return new KymoFlowConfig(Collections.emptyMap());
	}

	/**
	 * Rebuilds this configuration with one parameter changed.
	 *
	 * @param kind  the parameter
	 * @param value the new raw value. Null or empty clears the parameter
	 * @return the new configuration
	 */
	public KymoFlowConfig with(final ParameterKind kind, final Object value) {
		final EnumMap<ParameterKind, String> raw = new EnumMap<>(rawValues);
		raw.put(kind, (value == null) ? "" : String.valueOf(value));
		return new KymoFlowConfig(raw);
	}

	/** @return the raw value of a parameter as loaded (empty if missing) */
	public String getRaw(final ParameterKind kind) {
		return rawValues.get(kind);
	}

	/** @return an unmodifiable view of all raw values */
	public Map<ParameterKind, String> getRawValues() {
		return rawValues;
	}

	/** @return true if the parameter has a value, either explicit or default */
	public boolean isSet(final ParameterKind kind) {
		return values.containsKey(kind);
	}

	private Object require(final ParameterKind kind, final ValueType... expectedTypes) {
		boolean typeMatch = false;
		for (final ValueType t : expectedTypes)
			typeMatch |= kind.getType() == t;
		if (!typeMatch)
			throw new IllegalArgumentException(kind + " is of type " + kind.getType());
		final Object value = values.get(kind);
		if (value == null) throw new ConfigurationException(kind, "is empty");
		return value;
	}

	public double getDouble(final ParameterKind kind) {
		return (Double) require(kind, ValueType.DOUBLE);
	}

	public int getInt(final ParameterKind kind) {
		return (Integer) require(kind, ValueType.INTEGER);
	}

	public boolean getBoolean(final ParameterKind kind) {
		return (Boolean) require(kind, ValueType.BOOLEAN);
	}

	public String getString(final ParameterKind kind) {
		return (String) require(kind, ValueType.TEXT, ValueType.CHOICE);
	}

	public Color getColor(final ParameterKind kind) {
		return (Color) require(kind, ValueType.COLOR);
	}

	/**
	 * @return the color value of an optional parameter, or null if it is empty
	 */
	public Color getColorOrNull(final ParameterKind kind) {
		return isSet(kind) ? getColor(kind) : null;
	}

	/**
	 * @return the file referenced by a {@link ValueType#FILE} parameter
	 * @throws ConfigurationException if the parameter is empty or the file does
	 *                                not exist
	 */
	public File getFile(final ParameterKind kind) {
		final File file = (File) require(kind, ValueType.FILE);
		if (!file.exists()) throw new ConfigurationException(kind, "refers to a missing file: " + file.getAbsolutePath());
		return file;
	}

	/**
	 * @return the directory referenced by a {@link ValueType#DIRECTORY}
	 *         parameter. It may not exist yet
	 * @throws ConfigurationException if the parameter is empty or refers to a
	 *                                regular file
	 */
	public File getDirectory(final ParameterKind kind) {
		final File dir = (File) require(kind, ValueType.DIRECTORY);
		if (dir.isFile()) throw new ConfigurationException(kind, "refers to a file, not a directory: " + dir);
		return dir;
	}

	public OrientationMethod getOrientationMethod() {
		return OrientationMethod.fromLabel(getString(ParameterKind.ORIENTATION_METHOD));
	}

	@Override
	public String toString() {
		final StringBuilder sb = new StringBuilder("KymoFlowConfig[");
		rawValues.forEach((k, v) -> {
			if (!v.isEmpty()) sb.append(k.getKey()).append('=').append(v).append("; ");
		});
		return sb.append(']').toString();
	}

}
