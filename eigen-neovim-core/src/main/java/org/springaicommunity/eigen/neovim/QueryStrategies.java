package org.springaicommunity.eigen.neovim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered set of query partitions used by {@code fetch-all}.
 *
 * <p>
 * Order matters: path variants come first, then star brackets from the most popular down
 * (better configs early), then creation-year and push-date windows, {@code language:lua}
 * variants, topics, and finally extra path variants.
 */
public final class QueryStrategies {

	private static final String INIT_LUA = "filename:init.lua";

	private static final List<QueryStrategy> DEFAULTS = buildDefaults();

	private QueryStrategies() {
	}

	/**
	 * Returns the default strategy list in crawl order.
	 */
	public static List<QueryStrategy> defaults() {
		return DEFAULTS;
	}

	/**
	 * Wraps a single user-supplied query.
	 */
	public static List<QueryStrategy> custom(String query) {
		return List.of(new QueryStrategy(query, QueryStrategy.Kind.CUSTOM));
	}

	private static List<QueryStrategy> buildDefaults() {
		List<QueryStrategy> list = new ArrayList<>();

		for (String path : List.of(".config/nvim", "nvim", "dotfiles", "config")) {
			add(list, QueryStrategy.Kind.PATH, INIT_LUA + " path:" + path);
		}

		for (String stars : List.of(">1000", "500..1000", "200..500", "100..200", "50..100", "20..50", "10..20",
				"5..10", "1..5", "0")) {
			add(list, QueryStrategy.Kind.POPULARITY, INIT_LUA + " stars:" + stars);
		}

		for (int year = 2024; year >= 2017; year--) {
			add(list, QueryStrategy.Kind.CREATED, INIT_LUA + " created:" + year + "-01-01.." + year + "-12-31");
		}
		add(list, QueryStrategy.Kind.CREATED, INIT_LUA + " created:<2017-01-01");

		for (String pushed : List.of(">2024-06-01", "2024-01-01..2024-06-01", "2023-06-01..2024-01-01",
				"2023-01-01..2023-06-01")) {
			add(list, QueryStrategy.Kind.PUSHED, INIT_LUA + " pushed:" + pushed);
		}

		String luaInit = "language:lua " + INIT_LUA;
		add(list, QueryStrategy.Kind.LANGUAGE, luaInit);
		for (String stars : List.of(">100", "10..100", "1..10", "0")) {
			add(list, QueryStrategy.Kind.LANGUAGE, luaInit + " stars:" + stars);
		}
		for (int year = 2024; year >= 2021; year--) {
			add(list, QueryStrategy.Kind.LANGUAGE, luaInit + " created:" + year + "-01-01.." + year + "-12-31");
		}
		add(list, QueryStrategy.Kind.LANGUAGE, luaInit + " created:<2021-01-01");
		for (String pushed : List.of(">2024-01-01", "2023-01-01..2024-01-01", "<2023-01-01")) {
			add(list, QueryStrategy.Kind.LANGUAGE, luaInit + " pushed:" + pushed);
		}

		addTopicBrackets(list, "neovim", List.of(">100", "10..100", "1..10", "0"));
		addTopicBrackets(list, "dotfiles", List.of(">50", "10..50", "1..10", "0"));
		for (String topic : List.of("vim", "nvim", "lua", "config", "configuration")) {
			add(list, QueryStrategy.Kind.TOPIC, INIT_LUA + " topic:" + topic);
		}
		for (String topic : List.of("neovim", "nvim", "dotfiles", "vim")) {
			add(list, QueryStrategy.Kind.TOPIC, "language:lua topic:" + topic);
		}

		for (String path : List.of("lua", "neovim", ".nvim", "vim")) {
			add(list, QueryStrategy.Kind.PATH, INIT_LUA + " path:" + path);
		}
		return Collections.unmodifiableList(list);
	}

	private static void addTopicBrackets(List<QueryStrategy> list, String topic, List<String> starBrackets) {
		String base = INIT_LUA + " topic:" + topic;
		add(list, QueryStrategy.Kind.TOPIC, base);
		for (String stars : starBrackets) {
			add(list, QueryStrategy.Kind.TOPIC, base + " stars:" + stars);
		}
		add(list, QueryStrategy.Kind.TOPIC, base + " created:>2023-01-01");
		add(list, QueryStrategy.Kind.TOPIC, base + " created:<2023-01-01");
	}

	private static void add(List<QueryStrategy> list, QueryStrategy.Kind kind, String query) {
		list.add(new QueryStrategy(query, kind));
	}

}
