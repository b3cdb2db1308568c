package org.mcts.base.util.foreign;

/**
 * Thrown when a foreign object can't be converted to or from its snapshot.
 *
 * This always indicates a problem with the foreign game's object model (or its codec), never with the search.
 */
public class SnapshotException extends RuntimeException
{
  private static final long serialVersionUID = 1L;

  public SnapshotException(String xiMessage)
  {
    super(xiMessage);
  }

  public SnapshotException(String xiMessage, Throwable xiCause)
  {
    super(xiMessage, xiCause);
  }
}
