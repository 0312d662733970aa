package org.springaicommunity.eigen.neovim;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springaicommunity.eigen.neovim.GitHubHttpClient.GitHubApiException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link GitHubCodeSearchService}.
 */
@DisplayName("GitHubCodeSearchService Tests")
@ExtendWith(MockitoExtension.class)
class GitHubCodeSearchServiceTest {

	@Mock
	private GitHubClient client;

	private GitHubCodeSearchService service;

	private final QueryStrategy strategy = new QueryStrategy("filename:init.lua path:nvim",
			QueryStrategy.Kind.CUSTOM);

	@BeforeEach
	void setUp() {
		service = new GitHubCodeSearchService(client, ObjectMapperFactory.create(), 2);
	}

	private static String searchJson(long total, String... fullNames) {
		StringBuilder items = new StringBuilder();
		for (String fullName : fullNames) {
			if (items.length() > 0) {
				items.append(',');
			}
			items.append("{\"path\":\"nvim/init.lua\",\"repository\":{\"full_name\":\"")
				.append(fullName)
				.append("\",\"html_url\":\"https://github.com/")
				.append(fullName)
				.append("\"}}");
		}
		return "{\"total_count\":" + total + ",\"items\":[" + items + "]}";
	}

	@Nested
	@DisplayName("Search Tests")
	class SearchTest {

		@Test
		@DisplayName("Should map hits and point to the next page")
		void shouldMapHits() {
			when(client.getWithQuery(eq("/search/code"), anyString())).thenReturn(searchJson(5, "a/one", "b/two"));

			SearchPage page = service.search(strategy, 1);

			assertThat(page.hits()).extracting(SearchHit::fullName).containsExactly("a/one", "b/two");
			assertThat(page.hits().get(0).path()).isEqualTo("nvim/init.lua");
			assertThat(page.totalCount()).isEqualTo(5);
			assertThat(page.nextPage()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should encode the query and page parameters")
		void shouldEncodeQuery() {
			when(client.getWithQuery(eq("/search/code"), anyString())).thenReturn(searchJson(0));

			service.search(strategy, 3);

			verify(client).getWithQuery("/search/code", "q=filename%3Ainit.lua+path%3Anvim&per_page=2&page=3");
		}

		@Test
		@DisplayName("Should end the query once the total is paged through")
		void shouldEndWhenTotalReached() {
			when(client.getWithQuery(eq("/search/code"), anyString())).thenReturn(searchJson(4, "a/one", "b/two"));

			assertThat(service.search(strategy, 2).isLast()).isTrue();
		}

		@Test
		@DisplayName("Should end the query on an empty page")
		void shouldEndOnEmptyPage() {
			when(client.getWithQuery(eq("/search/code"), anyString())).thenReturn(searchJson(100));

			assertThat(service.search(strategy, 1).isLast()).isTrue();
		}

		@Test
		@DisplayName("Should treat 422 as the end of the query")
		void shouldTreat422AsExhausted() {
			when(client.getWithQuery(eq("/search/code"), anyString()))
				.thenThrow(new GitHubApiException("Validation Failed", 422, "{}"));

			SearchPage page = service.search(strategy, 11);

			assertThat(page.hits()).isEmpty();
			assertThat(page.isLast()).isTrue();
		}

		@Test
		@DisplayName("Should propagate other failures")
		void shouldPropagateOtherFailures() {
			when(client.getWithQuery(eq("/search/code"), anyString()))
				.thenThrow(new RateLimitedException("exhausted", null));

			assertThatThrownBy(() -> service.search(strategy, 1)).isInstanceOf(RateLimitedException.class);
		}

		@Test
		@DisplayName("Should reject per-page sizes GitHub does not accept")
		void shouldRejectInvalidPerPage() {
			assertThatThrownBy(() -> new GitHubCodeSearchService(client, ObjectMapperFactory.create(), 101))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Describe Tests")
	class DescribeTest {

		private final SearchHit hit = new SearchHit("owner/dots", "init.lua", "https://github.com/owner/dots");

		@Test
		@DisplayName("Should read stars, branch and push time")
		void shouldDescribeRepository() {
			when(client.get("/repos/owner/dots")).thenReturn(
					"{\"stargazers_count\":42,\"default_branch\":\"master\",\"html_url\":\"https://github.com/owner/dots\",\"pushed_at\":\"2024-05-01T10:00:00Z\"}");

			RepositoryRef ref = service.describe(hit, strategy);

			assertThat(ref.stars()).isEqualTo(42);
			assertThat(ref.defaultBranch()).isEqualTo("master");
			assertThat(ref.strategy()).isEqualTo(strategy.id());
			assertThat(ref.pushedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
		}

		@Test
		@DisplayName("Should fall back to 0 stars and main when the lookup fails")
		void shouldFallBackOnFailure() {
			when(client.get("/repos/owner/dots")).thenThrow(new GitHubApiException("Not found", 404, ""));

			RepositoryRef ref = service.describe(hit, strategy);

			assertThat(ref.stars()).isZero();
			assertThat(ref.defaultBranch()).isEqualTo("main");
			assertThat(ref.pushedAt()).isNull();
		}

	}

	@Nested
	@DisplayName("Fetch Content Tests")
	class FetchContentTest {

		private final RepositoryRef ref = new RepositoryRef("owner/dots", 1, "main", "q", "https://github.com/owner/dots",
				null);

		@Test
		@DisplayName("Should download from the default branch")
		void shouldDownload() {
			when(client.getRaw("owner", "dots", "main", "init.lua")).thenReturn("vim.opt.number = true");

			assertThat(service.fetchContent(ref, "init.lua")).contains("vim.opt.number = true");
		}

		@Test
		@DisplayName("Should return empty for a missing file")
		void shouldReturnEmptyOn404() {
			when(client.getRaw("owner", "dots", "main", "init.lua"))
				.thenThrow(new GitHubApiException("Not found", 404, ""));

			assertThat(service.fetchContent(ref, "init.lua")).isEmpty();
		}

	}

}
