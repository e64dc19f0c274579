package com.streamfirst.interchain.ports;

import com.streamfirst.interchain.domain.Cursor;
import com.streamfirst.interchain.domain.CursorKey;
import java.util.Collection;
import java.util.Map;

/** Persisted per-bridge, per-chain indexing checkpoints. */
public interface CursorPort {

  /**
   * Reads the current cursors of the given keys. Keys without a checkpoint are absent from
   * the result.
   *
   * @throws StorageException if the read fails
   */
  Map<CursorKey, Cursor> fetch(Collection<CursorKey> keys);

  /**
   * Writes cursors. Implementations keep the forward boundary at the maximum and the backward
   * boundary at the minimum of the stored and the supplied value.
   *
   * @throws StorageException if the write fails
   */
  void upsert(Map<CursorKey, Cursor> cursors);
}
