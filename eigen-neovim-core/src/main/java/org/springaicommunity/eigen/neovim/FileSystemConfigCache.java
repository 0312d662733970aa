package org.springaicommunity.eigen.neovim;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * File system implementation of {@link ConfigCache}.
 *
 * <p>
 * Layout: {@code <dir>/<owner>__<name>.lua} holds the config text and
 * {@code <owner>__<name>.meta.json} the {@link ConfigMetadata}. The sidecar is written
 * first and the {@code .lua} file last, each atomically, so an existing {@code .lua}
 * file always means a complete entry. Older caches with {@code .lua.meta} key=value
 * sidecars (or none) are still readable.
 */
public class FileSystemConfigCache implements ConfigCache {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemConfigCache.class);

	private static final String CONFIG_SUFFIX = ".lua";

	private static final String METADATA_SUFFIX = ".meta.json";

	private static final String LEGACY_METADATA_SUFFIX = ".lua.meta";

	private static final String SEPARATOR = "__";

	private final Path directory;

	private final ObjectMapper objectMapper;

	public FileSystemConfigCache(Path directory, ObjectMapper objectMapper) {
		this.directory = directory;
		this.objectMapper = objectMapper;
	}

	public Path getDirectory() {
		return directory;
	}

	@Override
	public boolean contains(String fullName) {
		return Files.exists(configFile(fullName));
	}

	@Override
	public void write(CachedConfig config) {
		String fullName = config.identity();
		try {
			AtomicFiles.write(metadataFile(fullName),
					objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(ConfigMetadata.from(config)));
			AtomicFiles.write(configFile(fullName), config.content().getBytes(StandardCharsets.UTF_8));
			logger.debug("Cached {} ({} bytes)", fullName, config.content().length());
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to cache config for " + fullName, e);
		}
	}

	@Override
	public Set<String> identities() {
		Set<String> result = new TreeSet<>();
		for (Path file : configFiles()) {
			String identity = identityOf(file);
			if (identity != null) {
				result.add(identity);
			}
		}
		return result;
	}

	@Override
	public CacheContents load() {
		List<CachedConfig> configs = new ArrayList<>();
		List<ItemFailure> unreadable = new ArrayList<>();
		for (Path file : configFiles()) {
			String identity = identityOf(file);
			if (identity == null) {
				logger.debug("Ignoring {}: not named owner__name.lua", file.getFileName());
				continue;
			}
			try {
				configs.add(load(identity, file));
			}
			catch (IOException e) {
				String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
				logger.warn("Skipping unreadable cached config {}: {}", file.getFileName(), reason);
				unreadable.add(new ItemFailure(identity, reason));
			}
		}
		configs.sort(Comparator.comparingInt((CachedConfig c) -> c.repository().stars())
			.reversed()
			.thenComparing(CachedConfig::identity));
		logger.debug("Loaded {} cached configs from {} ({} unreadable)", configs.size(), directory,
				unreadable.size());
		return new CacheContents(configs, unreadable);
	}

	private CachedConfig load(String identity, Path file) throws IOException {
		String content = Files.readString(file, StandardCharsets.UTF_8);
		Path metadata = metadataFile(identity);
		if (Files.exists(metadata)) {
			ConfigMetadata meta = objectMapper.readValue(metadata.toFile(), ConfigMetadata.class);
			return new CachedConfig(meta.toRepositoryRef(), meta.path(), content, meta.fetchedAt(),
					CachedConfig.sha256(content));
		}
		Instant modified = Files.getLastModifiedTime(file).toInstant();
		Map<String, String> legacy = readLegacyMetadata(legacyMetadataFile(identity));
		RepositoryRef repository = new RepositoryRef(identity, parseStars(legacy.get("stars")), "main", "unknown",
				legacy.getOrDefault("url", "https://github.com/" + identity), parseInstant(legacy.get("pushed_at")));
		return CachedConfig.of(repository, legacy.getOrDefault("path", "init.lua"), content, modified);
	}

	private List<Path> configFiles() {
		if (!Files.isDirectory(directory)) {
			return List.of();
		}
		try (Stream<Path> files = Files.list(directory)) {
			return files.filter(p -> p.getFileName().toString().endsWith(CONFIG_SUFFIX))
				.filter(Files::isRegularFile)
				.sorted()
				.toList();
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to list cache directory " + directory, e);
		}
	}

	private static @Nullable String identityOf(Path file) {
		String fileName = file.getFileName().toString();
		String stem = fileName.substring(0, fileName.length() - CONFIG_SUFFIX.length());
		int separator = stem.indexOf(SEPARATOR);
		if (separator <= 0 || separator + SEPARATOR.length() >= stem.length()) {
			return null;
		}
		return stem.substring(0, separator) + "/" + stem.substring(separator + SEPARATOR.length());
	}

	private Path configFile(String fullName) {
		return directory.resolve(stem(fullName) + CONFIG_SUFFIX);
	}

	private Path metadataFile(String fullName) {
		return directory.resolve(stem(fullName) + METADATA_SUFFIX);
	}

	private Path legacyMetadataFile(String fullName) {
		return directory.resolve(stem(fullName) + LEGACY_METADATA_SUFFIX);
	}

	private static String stem(String fullName) {
		int slash = fullName.indexOf('/');
		if (slash <= 0) {
			throw new IllegalArgumentException("fullName must be in owner/name format: " + fullName);
		}
		return fullName.substring(0, slash) + SEPARATOR + fullName.substring(slash + 1);
	}

	private static Map<String, String> readLegacyMetadata(Path file) throws IOException {
		Map<String, String> values = new HashMap<>();
		if (!Files.exists(file)) {
			return values;
		}
		for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
			int eq = line.indexOf('=');
			if (eq > 0) {
				values.put(line.substring(0, eq), line.substring(eq + 1));
			}
		}
		return values;
	}

	private static int parseStars(@Nullable String value) {
		if (value == null) {
			return 0;
		}
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			return 0;
		}
	}

	private static @Nullable Instant parseInstant(@Nullable String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		try {
			return Instant.parse(value.trim());
		}
		catch (DateTimeParseException e) {
			return null;
		}
	}

}
