/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.refresh;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Record identifiers created, changed, and destroyed in one table. */
public final class TableDiff {

  private final Set<String> createdIds;

  private final Set<String> changedIds;

  private final Set<String> destroyedIds;

  /** Creates a diff, copying the given identifiers. */
  public TableDiff(Collection<String> createdIds,
      Collection<String> changedIds, Collection<String> destroyedIds) {
    this.createdIds = Collections.unmodifiableSet(
        new LinkedHashSet<>(createdIds));
    this.changedIds = Collections.unmodifiableSet(
        new LinkedHashSet<>(changedIds));
    this.destroyedIds = Collections.unmodifiableSet(
        new LinkedHashSet<>(destroyedIds));
  }

  public Set<String> getCreatedIds() {
    return createdIds;
  }

  public Set<String> getChangedIds() {
    return changedIds;
  }

  public Set<String> getDestroyedIds() {
    return destroyedIds;
  }

  /** Returns created and changed identifiers, created ones first. */
  public Set<String> getUpsertIds() {
    Set<String> ids = new LinkedHashSet<>(this.createdIds);
    ids.addAll(this.changedIds);
    return ids;
  }

  public boolean isEmpty() {
    return createdIds.isEmpty() && changedIds.isEmpty()
        && destroyedIds.isEmpty();
  }

  /** Returns a diff containing the identifiers of both diffs. */
  public TableDiff merge(TableDiff other) {
    Set<String> created = new LinkedHashSet<>(this.createdIds);
    created.addAll(other.createdIds);
    Set<String> changed = new LinkedHashSet<>(this.changedIds);
    changed.addAll(other.changedIds);
    Set<String> destroyed = new LinkedHashSet<>(this.destroyedIds);
    destroyed.addAll(other.destroyedIds);
    return new TableDiff(created, changed, destroyed);
  }

  @Override
  public String toString() {
    return createdIds.size() + " created, " + changedIds.size()
        + " changed, " + destroyedIds.size() + " destroyed";
  }
}
