/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror;

import org.torproject.metrics.recordmirror.conf.Configuration;
import org.torproject.metrics.recordmirror.conf.ConfigurationException;
import org.torproject.metrics.recordmirror.conf.Key;
import org.torproject.metrics.recordmirror.cron.MirrorTask;
import org.torproject.metrics.recordmirror.cron.Scheduler;
import org.torproject.metrics.recordmirror.cron.ShutdownHook;
import org.torproject.metrics.recordmirror.source.SourceException;
import org.torproject.metrics.recordmirror.store.StoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;

/**
 * Main class for starting a RecordMirror instance.
 * <br>
 * Run without arguments in order to read the usage information, i.e.
 * <br>
 * <code>java -jar recordmirror.jar</code>
 */
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static final String CONF_FILE = "recordmirror.properties";

  /**
   * At most one argument.
   * See class description {@link Main}.
   */
  public static void main(String[] args) throws Exception {
    Configuration conf = new Configuration();
    RecordMirror mirror;
    Scheduler scheduler = new Scheduler();
    try {
      Path confPath = null;
      if (args == null || args.length == 0) {
        confPath = Paths.get(CONF_FILE);
      } else if (args.length == 1) {
        confPath = Paths.get(args[0]);
      } else {
        printUsage("RecordMirror takes at most one argument.");
        return;
      }
      if (!confPath.toFile().exists() || confPath.toFile().length() < 1L) {
        writeDefaultConfig(confPath);
        return;
      } else {
        conf.loadAndCheckConfiguration(confPath);
      }
      mirror = RecordMirror.create(conf);
    } catch (ConfigurationException ce) {
      printUsage(ce.getMessage());
      return;
    }
    ShutdownHook shutdownHook = new ShutdownHook(scheduler,
        mirror.getWorker());
    Runtime.getRuntime().addShutdownHook(shutdownHook);
    syncTableMappings(mirror);
    Map<Key, MirrorTask> tasks = new HashMap<>();
    tasks.put(Key.RefreshActivated, mirror.getRefreshTask());
    scheduler.scheduleModuleRuns(tasks, conf);
    if (!conf.getBool(Key.RunOnce)) {
      shutdownHook.stayAlive();
    }
  }

  /** Refreshes the table mapping once, so that webhooks resolve tables. */
  static void syncTableMappings(RecordMirror mirror) {
    try {
      mirror.getSchemaSync().sync();
    } catch (SourceException | StoreException e) {
      log.warn("Cannot synchronize table mapping at start-up: {}",
          e.getMessage());
    }
  }

  private static void printUsage(String msg) {
    final String usage = "Usage:\njava -jar recordmirror.jar "
        + "[path/to/configFile]";
    System.out.println(msg + "\n" + usage);
  }

  private static void writeDefaultConfig(Path confPath) {
    try {
      Files.copy(Main.class.getClassLoader().getResource(CONF_FILE)
          .openStream(), confPath, StandardCopyOption.REPLACE_EXISTING);
      printUsage("Could not find config file. In the default "
          + "configuration, no record source is configured. You need to "
          + "change the configuration (" + CONF_FILE
          + ") and provide at least the source base id and token. "
          + "Refer to the manual for more information.");
    } catch (IOException e) {
      log.error("Cannot write default configuration. Reason: " + e, e);
      throw new RuntimeException(e);
    }
  }

}
