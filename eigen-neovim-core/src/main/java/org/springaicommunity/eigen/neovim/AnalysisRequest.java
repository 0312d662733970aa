package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

/**
 * Parameters of one analysis over the cache.
 *
 * @param thresholds percentage thresholds for the statistics
 * @param since optional filter on the last push time
 * @param skipNonNeovim whether files classified as something other than a Neovim config
 * are left out
 */
public record AnalysisRequest(Thresholds thresholds, @Nullable SinceFilter since, boolean skipNonNeovim) {

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {

		private Thresholds thresholds = Thresholds.defaults();

		private @Nullable SinceFilter since;

		private boolean skipNonNeovim = true;

		private Builder() {
		}

		public Builder thresholds(Thresholds thresholds) {
			this.thresholds = thresholds;
			return this;
		}

		public Builder since(@Nullable SinceFilter since) {
			this.since = since;
			return this;
		}

		public Builder skipNonNeovim(boolean skipNonNeovim) {
			this.skipNonNeovim = skipNonNeovim;
			return this;
		}

		public AnalysisRequest build() {
			return new AnalysisRequest(thresholds, since, skipNonNeovim);
		}

	}

}
