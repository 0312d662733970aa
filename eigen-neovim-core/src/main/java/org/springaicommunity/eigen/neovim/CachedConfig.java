package org.springaicommunity.eigen.neovim;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * A fetched config file. Created once per repository on a successful download and never
 * mutated.
 *
 * @param repository the owning repository
 * @param path path of the file inside the repository
 * @param content raw source text
 * @param fetchedAt when the file was downloaded
 * @param contentHash SHA-256 hex digest of the UTF-8 content
 */
public record CachedConfig(RepositoryRef repository, String path, String content, Instant fetchedAt,
		String contentHash) {

	/**
	 * Create a cached config, computing the content hash.
	 */
	public static CachedConfig of(RepositoryRef repository, String path, String content, Instant fetchedAt) {
		return new CachedConfig(repository, path, content, fetchedAt, sha256(content));
	}

	/**
	 * The repository identity ("owner/name").
	 */
	public String identity() {
		return repository.fullName();
	}

	static String sha256(String content) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
		}
		catch (NoSuchAlgorithmException e) {
			// every JRE ships SHA-256
			throw new IllegalStateException(e);
		}
	}

}
