package org.mcts.base.util.foreign;

/**
 * Converts between a foreign object and an immutable string snapshot of it.
 *
 * Decoding a snapshot must always produce a fresh object, so that the caller is free to mutate it.
 *
 * @param <T> the type of the foreign object.
 */
public interface SnapshotCodec<T>
{
  /**
   * @return a snapshot of the specified object.
   *
   * @param xiObject - the object.
   *
   * @throws SnapshotException if the object can't be snapshotted.
   */
  String toSnapshot(T xiObject);

  /**
   * @return a newly created object, equivalent to the one the snapshot was taken from.
   *
   * @param xiSnapshot - the snapshot.
   *
   * @throws SnapshotException if the snapshot can't be decoded.
   */
  T fromSnapshot(String xiSnapshot);
}
