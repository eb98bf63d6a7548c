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

import sc.fiji.kymoflow.KymoFlowUtils;

/**
 * The outcome of a velocity measurement for one (segment, interval) pair:
 * either a numeric speed (µm/s, rounded to two decimals) or a sentinel
 * recording why no usable value exists. Text formatting happens only at the
 * persistence boundary ({@link #toToken()}).
 */
public final class VelocityEntry {

	/** The variant of an entry */
	public enum Kind {
		/** A measured velocity */
		NUMERIC(null),
		/** The segment is too short to be analyzed */
		TOO_SHORT("short"),
		/** The velocity is non-finite or faster than plausible */
		OUT_OF_RANGE("out");

		private final String token;

		Kind(final String token) {
			this.token = token;
		}

		/** @return the persisted token of a sentinel kind (null for NUMERIC) */
		public String getToken() {
			return token;
		}
	}

	private static final VelocityEntry TOO_SHORT = new VelocityEntry(Kind.TOO_SHORT, Double.NaN);
	private static final VelocityEntry OUT_OF_RANGE = new VelocityEntry(Kind.OUT_OF_RANGE, Double.NaN);

	private final Kind kind;
	private final double value;

	private VelocityEntry(final Kind kind, final double value) {
		this.kind = kind;
		this.value = value;
	}

	/**
	 * @param velocity the velocity (µm/s). Rounded to two decimals
	 * @return a numeric entry
	 * @throws IllegalArgumentException if velocity is not finite
	 */
	public static VelocityEntry numeric(final double velocity) {
		if (!Double.isFinite(velocity))
			throw new IllegalArgumentException("Numeric entries require a finite velocity");
		return new VelocityEntry(Kind.NUMERIC, KymoFlowUtils.round(velocity, 2));
	}

	public static VelocityEntry tooShort() {
		return TOO_SHORT;
	}

	public static VelocityEntry outOfRange() {
		return OUT_OF_RANGE;
	}

	/**
	 * Parses a persisted cell.
	 *
	 * @param token a two-decimal number, {@code short} or {@code out}
	 * @return the entry
	 * @throws NumberFormatException if token is neither a sentinel nor a finite
	 *                               number
	 */
	public static VelocityEntry fromToken(final String token) {
		final String t = token.trim();
		if (Kind.TOO_SHORT.token.equalsIgnoreCase(t)) return TOO_SHORT;
		if (Kind.OUT_OF_RANGE.token.equalsIgnoreCase(t)) return OUT_OF_RANGE;
		final double value = Double.parseDouble(t);
		if (!Double.isFinite(value)) throw new NumberFormatException("Non-finite velocity: " + t);
		return numeric(value);
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isNumeric() {
		return kind == Kind.NUMERIC;
	}

	public boolean isSentinel() {
		return kind != Kind.NUMERIC;
	}

	/**
	 * @return the velocity (µm/s)
	 * @throws IllegalStateException if this entry is a sentinel
	 */
	public double getValue() {
		if (!isNumeric()) throw new IllegalStateException("Sentinel entry (" + kind + ") holds no velocity");
		return value;
	}

	/** @return the persisted form: two-decimal number, "short" or "out" */
	public String toToken() {
		return (isNumeric()) ? KymoFlowUtils.formatDouble(value, 2) : kind.getToken();
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof VelocityEntry)) return false;
		final VelocityEntry other = (VelocityEntry) o;
		return kind == other.kind && Double.compare(value, other.value) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * kind.hashCode() + Double.hashCode(value);
	}

	@Override
	public String toString() {
		return toToken();
	}

}
