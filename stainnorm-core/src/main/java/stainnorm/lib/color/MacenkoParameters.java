/*-
 * #%L
 * This file is part of stainnorm.
 * %%
 * Copyright (C) 2024 stainnorm developers
 * %%
 * stainnorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * stainnorm is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with stainnorm.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package stainnorm.lib.color;

import java.util.Objects;

import stainnorm.lib.common.GeneralTools;
import stainnorm.lib.io.GsonTools;

/**
 * Immutable parameters for Macenko stain estimation and normalization.
 * <p>
 * Use {@link #builder()} to create an instance; values are validated when {@link Builder#build()} is called, 
 * so any instance is guaranteed to be valid.
 */
public final class MacenkoParameters {

	/**
	 * Default background (transmitted light) intensity.
	 */
	public static final double DEFAULT_IO = 255;

	/**
	 * Default optical density threshold for foreground pixels.
	 */
	public static final double DEFAULT_BETA = 0.15;

	/**
	 * Default percentile used to find robust extreme angles.
	 */
	public static final double DEFAULT_ALPHA = 1;

	/**
	 * Percentile used to determine the maximum concentration of each stain.
	 */
	public static final double MAX_CONCENTRATION_PERCENTILE = 99;

	private static final MacenkoParameters DEFAULT = builder().build();

	private final double io;
	private final double beta;
	private final double alpha;
	private final boolean intensityNorm;

	private MacenkoParameters(Builder builder) {
		this.io = builder.io;
		this.beta = builder.beta;
		this.alpha = builder.alpha;
		this.intensityNorm = builder.intensityNorm;
	}

	/**
	 * Get the default parameters.
	 * @return
	 */
	public static MacenkoParameters getDefault() {
		return DEFAULT;
	}

	/**
	 * Create a new builder, initialized with default values.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Create a new builder, initialized with the values of this instance.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder()
				.io(io)
				.beta(beta)
				.alpha(alpha)
				.intensityNorm(intensityNorm);
	}

	/**
	 * Read parameters from a JSON object, e.g. {@code {"io": 240, "beta": 0.2}}.
	 * Missing values take their defaults.
	 * 
	 * @param json
	 * @return
	 * @throws InvalidNormalizationParameterException if any value is invalid
	 */
	public static MacenkoParameters fromJson(String json) throws InvalidNormalizationParameterException {
		Objects.requireNonNull(json, "JSON must not be null");
		return GsonTools.getInstance().fromJson(json, MacenkoParameters.class);
	}

	/**
	 * Get a JSON representation of the parameters.
	 * @return
	 */
	public String toJson() {
		return GsonTools.getInstance().toJson(this);
	}

	/**
	 * Background intensity; optical densities are computed relative to this.
	 * @return
	 */
	public double getIo() {
		return io;
	}

	/**
	 * Optical density threshold; a pixel is foreground if any channel exceeds this.
	 * @return
	 */
	public double getBeta() {
		return beta;
	}

	/**
	 * Percentile (0-50, exclusive) used to find the extreme stain angles.
	 * @return
	 */
	public double getAlpha() {
		return alpha;
	}

	/**
	 * True if stain concentrations should be rescaled to match the target.
	 * @return
	 */
	public boolean doIntensityNorm() {
		return intensityNorm;
	}

	@Override
	public String toString() {
		return "MacenkoParameters [Io=" + GeneralTools.formatNumber(io, 3) 
				+ ", beta=" + GeneralTools.formatNumber(beta, 3) 
				+ ", alpha=" + GeneralTools.formatNumber(alpha, 3) 
				+ ", intensityNorm=" + intensityNorm + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(io, beta, alpha, intensityNorm);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof MacenkoParameters))
			return false;
		MacenkoParameters other = (MacenkoParameters)obj;
		return Double.compare(io, other.io) == 0 && 
				Double.compare(beta, other.beta) == 0 &&
				Double.compare(alpha, other.alpha) == 0 &&
				intensityNorm == other.intensityNorm;
	}


	/**
	 * Builder for {@link MacenkoParameters}.
	 */
	public static final class Builder {

		private double io = DEFAULT_IO;
		private double beta = DEFAULT_BETA;
		private double alpha = DEFAULT_ALPHA;
		private boolean intensityNorm = true;

		private Builder() {}

		/**
		 * Set the background intensity; must be &gt; 0.
		 * @param io
		 * @return this builder
		 */
		public Builder io(double io) {
			this.io = io;
			return this;
		}

		/**
		 * Set the optical density threshold for foreground pixels; must be &gt;= 0.
		 * @param beta
		 * @return this builder
		 */
		public Builder beta(double beta) {
			this.beta = beta;
			return this;
		}

		/**
		 * Set the percentile used to find extreme angles; must be &gt; 0 and &lt; 50.
		 * @param alpha
		 * @return this builder
		 */
		public Builder alpha(double alpha) {
			this.alpha = alpha;
			return this;
		}

		/**
		 * Specify whether stain concentrations should be rescaled to match the target.
		 * @param doNormalize
		 * @return this builder
		 */
		public Builder intensityNorm(boolean doNormalize) {
			this.intensityNorm = doNormalize;
			return this;
		}

		/**
		 * Build the parameters.
		 * @return
		 * @throws InvalidNormalizationParameterException if any value is invalid
		 */
		public MacenkoParameters build() throws InvalidNormalizationParameterException {
			if (!GeneralTools.isPositiveFinite(io))
				throw new InvalidNormalizationParameterException("Io must be a finite value > 0, but was " + io);
			if (!(beta >= 0) || !Double.isFinite(beta))
				throw new InvalidNormalizationParameterException("beta must be a finite value >= 0, but was " + beta);
			if (!(alpha > 0 && alpha < 50))
				throw new InvalidNormalizationParameterException("alpha must be > 0 and < 50, but was " + alpha);
			return new MacenkoParameters(this);
		}

	}

}
