/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.version;

import org.torproject.metrics.recordmirror.persist.PersistenceUtils;
import org.torproject.metrics.recordmirror.store.SlotId;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Active pointer stored in a single file that is replaced by an atomic
 * move.
 */
public class FileActivePointer implements ActivePointer {

  private final Path pointerPath;

  public FileActivePointer(Path pointerPath) {
    this.pointerPath = pointerPath;
  }

  @Override
  public SlotId read() throws IOException {
    try {
      String content = new String(Files.readAllBytes(this.pointerPath),
          StandardCharsets.UTF_8);
      return SlotId.parse(content);
    } catch (NoSuchFileException e) {
      return SlotId.A;
    } catch (IllegalArgumentException e) {
      throw new IOException("Corrupt active pointer in " + this.pointerPath
          + ".", e);
    }
  }

  @Override
  public void write(SlotId slot) throws IOException {
    PersistenceUtils.storeAtomically((slot.name() + "\n")
        .getBytes(StandardCharsets.UTF_8), this.pointerPath);
  }
}
