package org.springaicommunity.eigen.neovim;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.eigen.neovim.GitHubHttpClient.GitHubApiException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link CodeSearchService} backed by the GitHub REST API.
 *
 * <p>
 * Converts GitHub JSON responses to records at the service boundary. A query is exhausted
 * when a page comes back empty, GitHub answers 422 (query past its result window), the
 * reported total has been paged through, or the 1000-result cap is reached.
 */
public class GitHubCodeSearchService implements CodeSearchService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubCodeSearchService.class);

	/** GitHub never returns more than this many results for one search query. */
	public static final int MAX_SEARCH_RESULTS = 1000;

	private static final String DEFAULT_BRANCH = "main";

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final int perPage;

	public GitHubCodeSearchService(GitHubClient client, ObjectMapper objectMapper, int perPage) {
		if (perPage < 1 || perPage > 100) {
			throw new IllegalArgumentException("perPage must be between 1 and 100, got: " + perPage);
		}
		this.client = client;
		this.objectMapper = objectMapper;
		this.perPage = perPage;
	}

	@Override
	public SearchPage search(QueryStrategy strategy, int page) {
		String queryString = "q=" + URLEncoder.encode(strategy.query(), StandardCharsets.UTF_8) + "&per_page="
				+ perPage + "&page=" + page;
		String response;
		try {
			response = client.getWithQuery("/search/code", queryString);
		}
		catch (GitHubApiException e) {
			if (e.getStatusCode() == 422) {
				logger.debug("Query '{}' rejected at page {} (422), treating as exhausted", strategy.query(), page);
				return SearchPage.end();
			}
			throw e;
		}

		JsonNode root = readTree(response, "search results");
		long total = root.path("total_count").asLong(0);
		List<SearchHit> hits = new ArrayList<>();
		for (JsonNode item : root.path("items")) {
			JsonNode repository = item.path("repository");
			String fullName = repository.path("full_name").asText("");
			if (fullName.isEmpty()) {
				continue;
			}
			hits.add(new SearchHit(fullName, item.path("path").asText("init.lua"),
					repository.path("html_url").asText("https://github.com/" + fullName)));
		}

		int maxPage = MAX_SEARCH_RESULTS / perPage;
		boolean exhausted = hits.isEmpty() || (long) page * perPage >= total || page >= maxPage;
		logger.debug("Query '{}' page {}: {} hits of {} total{}", strategy.query(), page, hits.size(), total,
				exhausted ? " (last page)" : "");
		return new SearchPage(hits, total, exhausted ? null : page + 1);
	}

	@Override
	public RepositoryRef describe(SearchHit hit, QueryStrategy strategy) {
		try {
			JsonNode repo = readTree(client.get("/repos/" + hit.fullName()), "repository " + hit.fullName());
			return new RepositoryRef(hit.fullName(), repo.path("stargazers_count").asInt(0),
					repo.path("default_branch").asText(DEFAULT_BRANCH), strategy.id(),
					repo.path("html_url").asText(hit.htmlUrl()), parseInstant(repo.path("pushed_at").asText(null)));
		}
		catch (GitHubApiException | TransientFetchException e) {
			logger.debug("Could not describe {}: {}. Using defaults", hit.fullName(), e.getMessage());
			return new RepositoryRef(hit.fullName(), 0, DEFAULT_BRANCH, strategy.id(), hit.htmlUrl(), null);
		}
	}

	@Override
	public Optional<String> fetchContent(RepositoryRef repository, String path) {
		try {
			return Optional.of(client.getRaw(repository.owner(), repository.name(), repository.defaultBranch(), path));
		}
		catch (GitHubApiException e) {
			if (e.getStatusCode() == 404) {
				return Optional.empty();
			}
			throw e;
		}
	}

	private JsonNode readTree(String json, String what) {
		try {
			return objectMapper.readTree(json);
		}
		catch (JsonProcessingException e) {
			throw new GitHubApiException("Malformed JSON in " + what + ": " + e.getOriginalMessage(), e);
		}
	}

	private static @Nullable Instant parseInstant(@Nullable String text) {
		if (text == null || text.isEmpty() || "null".equals(text)) {
			return null;
		}
		try {
			return Instant.parse(text);
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse timestamp: {}", text);
			return null;
		}
	}

}
