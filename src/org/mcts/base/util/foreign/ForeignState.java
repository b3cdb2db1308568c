package org.mcts.base.util.foreign;

import java.util.Collections;
import java.util.List;

import org.mcts.base.util.statemachine.GameMove;
import org.mcts.base.util.statemachine.GameState;

/**
 * A native state standing in for a state of a foreign game.  Holds only an immutable snapshot, so it is safe to share
 * between threads.
 */
public final class ForeignState extends GameState
{
  private final ForeignStateAdapter<?, ?> mAdapter;
  private final String                    mSnapshot;
  private final boolean                   mTerminal;
  private final boolean                   mFirstSideToMove;
  private volatile List<GameMove>         mLegalMoves = null;

  ForeignState(ForeignStateAdapter<?, ?> xiAdapter,
               String xiSnapshot,
               boolean xiTerminal,
               boolean xiFirstSideToMove)
  {
    mAdapter = xiAdapter;
    mSnapshot = xiSnapshot;
    mTerminal = xiTerminal;
    mFirstSideToMove = xiFirstSideToMove;
  }

  @Override
  public List<GameMove> getLegalMoves()
  {
    if (mTerminal)
    {
      return Collections.emptyList();
    }

    List<GameMove> lLegalMoves = mLegalMoves;
    if (lLegalMoves == null)
    {
      lLegalMoves = Collections.unmodifiableList(mAdapter.getLegalMoves(this));
      mLegalMoves = lLegalMoves;
    }
    return lLegalMoves;
  }

  @Override
  public GameState applyMove(GameMove xiMove)
  {
    if (!(xiMove instanceof ForeignMove))
    {
      throw new IllegalArgumentException("Can't apply " + xiMove + " to a foreign state");
    }
    return mAdapter.applyMove(this, (ForeignMove)xiMove);
  }

  @Override
  public double playout()
  {
    return mAdapter.playout(this);
  }

  @Override
  public double heuristicPlayout()
  {
    return mAdapter.heuristicPlayout(this);
  }

  @Override
  public double evaluateMove(GameMove xiMove)
  {
    if (!(xiMove instanceof ForeignMove))
    {
      throw new IllegalArgumentException("Can't evaluate " + xiMove + " in a foreign state");
    }
    return mAdapter.evaluateMove(this, (ForeignMove)xiMove);
  }

  @Override
  public boolean isTerminal()
  {
    return mTerminal;
  }

  @Override
  public boolean isFirstSideToMove()
  {
    return mFirstSideToMove;
  }

  @Override
  public GameState deepCopy()
  {
    return new ForeignState(mAdapter, mSnapshot, mTerminal, mFirstSideToMove);
  }

  ForeignStateAdapter<?, ?> getAdapter()
  {
    return mAdapter;
  }

  /**
   * @return the snapshot of the foreign state.
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
    if (!(xiOther instanceof ForeignState))
    {
      return false;
    }
    ForeignState lOther = (ForeignState)xiOther;
    return (mAdapter == lOther.mAdapter) && mSnapshot.equals(lOther.mSnapshot);
  }

  @Override
  public int hashCode()
  {
    return mSnapshot.hashCode();
  }

  @Override
  public String toString()
  {
    return mSnapshot;
  }
}
