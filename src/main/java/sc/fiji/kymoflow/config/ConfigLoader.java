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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.EnumMap;
import java.util.Map;

import sc.fiji.kymoflow.KymoFlowUtils;

/**
 * Reads and writes KymoFlow configuration files.
 * <p>
 * One parameter per line: {@code key,value,description}. Value and description
 * are optional and the description may contain commas (the value may not).
 * Lines starting with two or more comment markers ({@code //} or {@code ##})
 * are ignored, as are blank lines and unknown keys. Keys absent from the file
 * load as empty.
 * </p>
 */
public class ConfigLoader {

	private ConfigLoader() {
	}

	/**
	 * @param file the configuration file
	 * @return the validated configuration
	 * @throws IOException if the file could not be read
	 * @throws sc.fiji.kymoflow.ConfigurationException if a value is malformed
	 */
	public static KymoFlowConfig load(final File file) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
			return load(reader);
		}
	}

	public static KymoFlowConfig load(final Reader reader) throws IOException {
		final BufferedReader br = (reader instanceof BufferedReader) ? (BufferedReader) reader
				: new BufferedReader(reader);
		final Map<ParameterKind, String> raw = new EnumMap<>(ParameterKind.class);
		String line;
		int lineNumber = 0;
		while ((line = br.readLine()) != null) {
			lineNumber++;
			final String trimmed = line.trim();
			if (trimmed.isEmpty() || isComment(trimmed)) continue;
			final String[] fields = trimmed.split(",", 3);
			final ParameterKind kind = ParameterKind.fromKey(fields[0]);
			if (kind == null) {
				KymoFlowUtils.log("Ignoring unknown configuration key '" + fields[0].trim() + "' (line " + lineNumber
						+ ")");
				continue;
			}
			raw.put(kind, (fields.length > 1) ? fields[1].trim() : "");
		}
		return KymoFlowConfig.of(raw);
	}

	static boolean isComment(final String trimmedLine) {
		return trimmedLine.startsWith("//") || trimmedLine.startsWith("##");
	}

	/**
	 * Writes a configuration, one line per known parameter (including empty
	 * ones). An existing file is backed up first.
	 */
	public static void save(final KymoFlowConfig config, final File file) throws IOException {
		KymoFlowUtils.prepareForWriting(file);
		try (BufferedWriter bw = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8);
				PrintWriter pw = new PrintWriter(bw)) {
			pw.println("// KymoFlow configuration: key,value,description");
			for (final ParameterKind kind : ParameterKind.values()) {
				pw.print(kind.getKey());
				pw.print(',');
				pw.print(config.getRaw(kind));
				pw.print(',');
				pw.println(kind.getSuppliedBy());
			}
			KymoFlowUtils.checkError(pw, file);
		}
	}

}
