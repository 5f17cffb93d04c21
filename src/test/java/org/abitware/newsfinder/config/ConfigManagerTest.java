package org.abitware.newsfinder.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigManagerTest {

    @Test
    void emptyPropertiesGiveDefaults() {
        NewsFinderSettings s = ConfigManager.fromProperties(new Properties());
        NewsFinderSettings d = new NewsFinderSettings();
        assertThat(s.indexDir).isEqualTo(d.indexDir);
        assertThat(s.fullText).isTrue();
        assertThat(s.pageSize).isEqualTo(10);
        assertThat(s.sessionTtlMinutes).isEqualTo(1440);
        assertThat(s.adminUserId).isZero();
    }

    @Test
    void pageSizesInheritFromPageSize() {
        Properties p = new Properties();
        p.setProperty("page.size", "20");
        NewsFinderSettings s = ConfigManager.fromProperties(p);
        assertThat(s.searchPageSize).isEqualTo(20);
        assertThat(s.latestCount).isEqualTo(20);

        p.setProperty("search.pageSize", "5");
        assertThat(ConfigManager.fromProperties(p).searchPageSize).isEqualTo(5);
    }

    @Test
    void invalidNumbersFallBack() {
        Properties p = new Properties();
        p.setProperty("page.size", "abc");
        p.setProperty("session.maxEntries", "-3");
        p.setProperty("admin.userId", " 42 ");
        NewsFinderSettings s = ConfigManager.fromProperties(p);
        assertThat(s.pageSize).isEqualTo(10);
        assertThat(s.sessionMaxEntries).isEqualTo(10_000);
        assertThat(s.adminUserId).isEqualTo(42);
    }

    @Test
    void homeIsExpanded() {
        Properties p = new Properties();
        p.setProperty("index.dir", "~/news-index");
        p.setProperty("index.fullText", "false");
        NewsFinderSettings s = ConfigManager.fromProperties(p);
        assertThat(s.indexDir).isEqualTo(Paths.get(System.getProperty("user.home"), "news-index"));
        assertThat(s.fullText).isFalse();
    }

    @Test
    void overrideFileWinsOverBuiltInDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.properties");
        Files.write(file, "page.size=5\nadmin.userId=42\n".getBytes(StandardCharsets.UTF_8));
        NewsFinderSettings s = new ConfigManager(file).load();
        assertThat(s.pageSize).isEqualTo(5);
        assertThat(s.adminUserId).isEqualTo(42);
        assertThat(s.searchPageSize).isEqualTo(10);
    }

    @Test
    void missingFileUsesBuiltInDefaults(@TempDir Path dir) {
        NewsFinderSettings s = new ConfigManager(dir.resolve("absent.properties")).load();
        assertThat(s.pageSize).isEqualTo(10);
        assertThat(s.fullText).isTrue();
    }
}
