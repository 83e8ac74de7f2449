package com.phillippitts.strokecoach.service.corpus;

import com.phillippitts.strokecoach.domain.ReferenceEntry;
import com.phillippitts.strokecoach.domain.StrokeType;

import java.util.List;

/**
 * Read-only view of the reference strokes.
 *
 * <p>Implementations hand out immutable snapshots: a caller iterating
 * {@link #entries(StrokeType)} never observes a concurrent reload.
 */
public interface ReferenceCorpus {

    /**
     * Entries of one stroke type, sorted by player id.
     */
    List<ReferenceEntry> entries(StrokeType strokeType);

    /** Total number of entries across stroke types. */
    int size();

    /**
     * Re-reads the backing store and swaps the snapshot atomically.
     *
     * @return number of entries in the new snapshot
     */
    int reload();
}
