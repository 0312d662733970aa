package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A repository discovered by a search. Immutable; {@link #fullName()} is the
 * deduplication key across the whole crawl.
 *
 * @param fullName repository identity in "owner/name" format
 * @param stars stargazer count, the popularity score
 * @param defaultBranch branch the config is downloaded from
 * @param strategy id of the query strategy that discovered the repository
 * @param htmlUrl web URL of the repository
 * @param pushedAt time of the last push, if known
 */
public record RepositoryRef(String fullName, int stars, String defaultBranch, String strategy, String htmlUrl,
		@Nullable Instant pushedAt) {

	public RepositoryRef {
		if (fullName == null || fullName.indexOf('/') <= 0 || fullName.indexOf('/') == fullName.length() - 1) {
			throw new IllegalArgumentException("fullName must be in owner/name format: " + fullName);
		}
	}

	public String owner() {
		return fullName.substring(0, fullName.indexOf('/'));
	}

	public String name() {
		return fullName.substring(fullName.indexOf('/') + 1);
	}

}
