/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.torproject.metrics.recordmirror.conf.Configuration;
import org.torproject.metrics.recordmirror.conf.Key;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class MainTest {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  @Test()
  public void testInitRunConfig() throws Exception {
    Path conf = tmpf.getRoot().toPath().resolve("test.conf");
    assertTrue(!Files.exists(conf));
    Main.main(new String[] { conf.toString() });
    assertTrue(Files.size(conf) > 0L);
    Configuration written = new Configuration();
    try (InputStream is = Files.newInputStream(conf)) {
      written.load(is);
    }
    assertEquals("File", written.getProperty(Key.StoreBackend.name()));
  }

  @Test()
  public void testTooManyArguments() throws Exception {
    Main.main(new String[] { "a", "b" });
  }

  @Test()
  public void testUnconfiguredSource() throws Exception {
    Path conf = tmpf.newFile("empty-source.properties").toPath();
    Files.write(conf, "RunOnce = true\n".getBytes());
    Main.main(new String[] { conf.toString() });
  }
}
