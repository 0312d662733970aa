package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Sidecar record stored next to each cached config: the discovery metadata that is not
 * part of the file itself.
 *
 * @param fullName repository in "owner/name" format
 * @param stars popularity at discovery time
 * @param defaultBranch branch the file was downloaded from
 * @param strategy id of the query strategy that found the repository
 * @param htmlUrl web URL of the repository
 * @param pushedAt last push time, if known
 * @param path file path inside the repository
 * @param fetchedAt download time
 * @param contentHash SHA-256 hex digest of the content
 */
public record ConfigMetadata(String fullName, int stars, String defaultBranch, String strategy, String htmlUrl,
		@Nullable Instant pushedAt, String path, Instant fetchedAt, String contentHash) {

	static ConfigMetadata from(CachedConfig config) {
		RepositoryRef repo = config.repository();
		return new ConfigMetadata(repo.fullName(), repo.stars(), repo.defaultBranch(), repo.strategy(),
				repo.htmlUrl(), repo.pushedAt(), config.path(), config.fetchedAt(), config.contentHash());
	}

	RepositoryRef toRepositoryRef() {
		return new RepositoryRef(fullName, stars, defaultBranch, strategy, htmlUrl, pushedAt);
	}

}
