package org.abitware.newsfinder.config;

import java.nio.file.Path;
import java.nio.file.Paths;

//NewsFinderSettings.java
public class NewsFinderSettings {
 public Path indexDir = Paths.get(System.getProperty("user.home"), ".newsfinder", "index");
 // false: no inverted index over title/summary, every search scans
 public boolean fullText = true;

 public int pageSize = 10;
 public int searchPageSize = 10;
 public int latestCount = 10;

 // search / source pagination sessions
 public long sessionMaxEntries = 10_000;
 public long sessionTtlMinutes = 24 * 60;

 // 0 = nobody may run admin commands
 public long adminUserId = 0L;
}
