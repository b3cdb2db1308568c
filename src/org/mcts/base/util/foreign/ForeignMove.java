package org.mcts.base.util.foreign;

import org.mcts.base.util.statemachine.GameMove;

/**
 * A native move standing in for a move of a foreign game.  Two moves are equal if their snapshots are.
 */
public final class ForeignMove extends GameMove
{
  private final ForeignStateAdapter<?, ?> mAdapter;
  private final String                    mSnapshot;
  private final String                    mDescription;

  ForeignMove(ForeignStateAdapter<?, ?> xiAdapter, String xiSnapshot, String xiDescription)
  {
    mAdapter = xiAdapter;
    mSnapshot = xiSnapshot;
    mDescription = xiDescription;
  }

  ForeignStateAdapter<?, ?> getAdapter()
  {
    return mAdapter;
  }

  /**
   * @return the snapshot of the foreign move.
   */
  public String getSnapshot()
  {
    return mSnapshot;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof ForeignMove))
    {
      return false;
    }
    ForeignMove lOther = (ForeignMove)xiOther;
    return (mAdapter == lOther.mAdapter) && mSnapshot.equals(lOther.mSnapshot);
  }

  @Override
  public int hashCode()
  {
    return mSnapshot.hashCode();
  }

  // Captured when the move was wrapped.
  @Override
  public String toString()
  {
    return mDescription;
  }
}
