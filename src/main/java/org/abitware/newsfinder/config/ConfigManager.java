package org.abitware.newsfinder.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link NewsFinderSettings}: classpath defaults from {@code newsfinder.properties},
 * overridden by an optional properties file on disk.
 */
public class ConfigManager {
	private static final Logger log = LoggerFactory.getLogger(ConfigManager.class);

	static final String DEFAULTS_RESOURCE = "/newsfinder.properties";

	private final Path file;

	public ConfigManager() {
		this(Paths.get(System.getProperty("user.home"), ".newsfinder", "config.properties"));
	}

	public ConfigManager(Path file) {
		this.file = file;
	}

	public Path getFile() {
		return file;
	}

	public NewsFinderSettings load() {
		Properties p = new Properties();
		try (InputStream in = ConfigManager.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (in != null)
				p.load(in);
		} catch (IOException e) {
			log.warn("Could not read built-in defaults {}: {}", DEFAULTS_RESOURCE, e.getMessage());
		}
		if (file != null && Files.isRegularFile(file)) {
			try (InputStream in = Files.newInputStream(file)) {
				p.load(in);
			} catch (IOException e) {
				log.warn("Could not read config file {}: {}", file, e.getMessage());
			}
		}
		return fromProperties(p);
	}

	static NewsFinderSettings fromProperties(Properties p) {
		NewsFinderSettings s = new NewsFinderSettings();
		String dir = p.getProperty("index.dir", "").trim();
		if (!dir.isEmpty())
			s.indexDir = Paths.get(expandHome(dir));
		s.fullText = Boolean.parseBoolean(p.getProperty("index.fullText", String.valueOf(s.fullText)).trim());

		s.pageSize = (int) positive(p, "page.size", s.pageSize);
		s.searchPageSize = (int) positive(p, "search.pageSize", s.pageSize);
		s.latestCount = (int) positive(p, "latest.count", s.pageSize);

		s.sessionMaxEntries = positive(p, "session.maxEntries", s.sessionMaxEntries);
		s.sessionTtlMinutes = positive(p, "session.ttlMinutes", s.sessionTtlMinutes);
		s.adminUserId = number(p, "admin.userId", s.adminUserId);
		return s;
	}

	private static long positive(Properties p, String key, long def) {
		long v = number(p, key, def);
		if (v < 1) {
			log.warn("Setting {}={} must be positive, using {}", key, v, def);
			return def;
		}
		return v;
	}

	private static long number(Properties p, String key, long def) {
		String raw = p.getProperty(key);
		if (raw == null || raw.trim().isEmpty())
			return def;
		try {
			return Long.parseLong(raw.trim());
		} catch (NumberFormatException e) {
			log.warn("Setting {}='{}' is not a number, using {}", key, raw, def);
			return def;
		}
	}

	private static String expandHome(String path) {
		if (path.equals("~") || path.startsWith("~/"))
			return System.getProperty("user.home") + path.substring(1);
		return path;
	}
}
