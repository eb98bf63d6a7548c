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

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.util.FileUtils;

/** Static utilities for KymoFlow **/
public class KymoFlowUtils {

	/*
	 * NB: This pattern needs to be OS agnostic: e.g., Microsoft Windows does not
	 * support colons in filenames
	 */
	private static final String TIMESTAMP_PATTERN = "'_D'yyyy-MM-dd'T'HH-mm-ss";
	private static Context context;
	private static LogService logService;
	private static volatile boolean verbose;

	private static boolean initialized;

	private KymoFlowUtils() {}

	private static synchronized void initialize() {
		if (initialized) return;
		if (context == null) getContext();
		if (logService == null) logService = context.getService(LogService.class);
		initialized = true;
	}

	public static synchronized void log(final String string) {
		if (!isDebugMode()) return;
		if (!initialized) initialize();
		logService.info("[KymoFlow] " + string);
	}

	public static synchronized void warn(final String string) {
		if (!initialized) initialize();
		logService.warn("[KymoFlow] " + string);
	}

	/**
	 * Assesses if KymoFlow is running in debug mode
	 *
	 * @return the debug flag
	 */
	public static boolean isDebugMode() {
		return verbose;
	}

	/**
	 * Enables/disables debug mode
	 *
	 * @param b verbose flag
	 */
	public static void setDebugMode(final boolean b) {
		if (isDebugMode() && !b) {
			log("Exiting debug mode...");
		}
		verbose = b;
		if (isDebugMode()) {
			log("Entering debug mode...");
		}
	}

	/**
	 * Convenience method to access the SciJava context used for logging.
	 *
	 * @return the context. Never null
	 */
	public static synchronized Context getContext() {
		if (context == null) {
			try {
				context = new Context(LogService.class);
			} catch (final RuntimeException ex) {
				System.out.println("[KymoFlowUtils] SciJava context could not be initialized: " + ex.getMessage());
				throw ex;
			}
		}
		return context;
	}

	public static synchronized void setContext(final Context context) {
		KymoFlowUtils.context = context;
		logService = null;
		initialized = false;
	}

	public static String stripExtension(final String filename) {
		final int lastDot = filename.lastIndexOf(".");
		return (lastDot > 0) ? filename.substring(0, lastDot) : filename;
	}

	public static void csvQuoteAndPrint(final PrintWriter pw, final Object o) {
		pw.print(stringForCSV("" + o));
	}

	private static String stringForCSV(final String s) {
		boolean quote = false;
		String result = s;
		if (s.indexOf(',') >= 0) quote = true;
		if (s.indexOf('"') >= 0) {
			quote = true;
			result = s.replaceAll("\"", "\"\"");
		}
		if (quote) return "\"" + result + "\"";
		else return result;
	}

	/**
	 * Rounds a value to the specified number of decimal places (half-up). Negative
	 * zero is normalized to zero.
	 */
	public static double round(final double value, final int digits) {
		if (!Double.isFinite(value)) return value;
		final double rounded = new BigDecimal(value).setScale(digits, RoundingMode.HALF_UP).doubleValue();
		return (rounded == 0d) ? 0d : rounded;
	}

	/**
	 * Formats a value with exactly {@code digits} decimal places, using '.' as
	 * decimal separator regardless of locale.
	 */
	public static String formatDouble(final double value, final int digits) {
		if (Double.isNaN(value)) return "NaN";
		return String.format(Locale.US, "%." + digits + "f", round(value, digits));
	}

	public static String getElapsedTime(final long fromStart) {
		final long time = System.currentTimeMillis() - fromStart;
		if (time < 1000)
			return String.format("%02d msec", time);
		else if (time < 90000)
			return String.format("%02d sec", TimeUnit.MILLISECONDS.toSeconds(time));
		return String.format("%02d min, %02d sec", TimeUnit.MILLISECONDS.toMinutes(time),
				TimeUnit.MILLISECONDS.toSeconds(time)
						- TimeUnit.MINUTES.toSeconds(TimeUnit.MILLISECONDS.toMinutes(time)));
	}

	public static String getTimeStamp() {
		return new SimpleDateFormat(TIMESTAMP_PATTERN).format(new Date());
	}

	/**
	 * Moves an existing file out of the way so that a new artifact can be written
	 * at its path. The file is renamed to {@code <stem>_D<timestamp>.<ext>}, made
	 * unique if needed. Nothing happens if the file does not exist.
	 *
	 * @param file the path about to be written
	 * @return the backup copy, or null if there was nothing to back up
	 * @throws IOException if the existing file could not be renamed
	 */
	public static File backupExisting(final File file) throws IOException {
		if (file == null || !file.exists()) return null;
		final String extension = FileUtils.getExtension(file);
		final String suffix = (extension == null || extension.isEmpty()) ? "" : "." + extension;
		final String stem = stripExtension(file.getName());
		final File backup = getUniquelySuffixedFile(new File(file.getParentFile(), stem + getTimeStamp() + suffix));
		if (!file.renameTo(backup)) {
			throw new IOException("Could not back up " + file.getAbsolutePath() + " to " + backup.getName());
		}
		log("Backed up " + file.getName() + " as " + backup.getName());
		return backup;
	}

	/**
	 * Creates the parent directories of a file (if needed) and backs up any
	 * existing file at its path.
	 *
	 * @see #backupExisting(File)
	 */
	public static void prepareForWriting(final File file) throws IOException {
		final File parent = file.getAbsoluteFile().getParentFile();
		if (parent != null && !parent.exists() && !parent.mkdirs()) {
			throw new IOException("Could not create directory " + parent.getAbsolutePath());
		}
		backupExisting(file);
	}

	/**
	 * @throws IOException if the writer has encountered an error, which
	 *                     {@link PrintWriter} does not report otherwise
	 */
	public static void checkError(final PrintWriter pw, final File file) throws IOException {
		if (pw.checkError()) throw new IOException("Could not write " + file.getAbsolutePath());
	}

	public static File getUniquelySuffixedFile(final File referenceFile) {
		if (referenceFile.exists()) {
			final String extension = FileUtils.getExtension(referenceFile);
			final String suffix = (extension == null || extension.isEmpty()) ? "" : "." + extension;
			final String filenameWithoutExt = stripExtension(referenceFile.getName());
			return getUniqueFileName(filenameWithoutExt, suffix, referenceFile.getParentFile());
		}
		return referenceFile;
	}

	private static File getUniqueFileName(final String filename, final String extension, final File parent) {
		for (int i = 1; i <= 500; i++) {
			final File putativeUniqueFile = new File(parent, filename + "-" + i + extension);
			if (!putativeUniqueFile.exists())
				return putativeUniqueFile;
		}
		return new File(parent, filename + "-" + System.nanoTime() + extension);
	}

}
