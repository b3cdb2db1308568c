package org.mcts.base.test;

import org.mcts.base.util.statemachine.GameMove;

/**
 * A move in a {@link ScriptedState} game, identified by its index in the legal move list.
 */
public class ScriptedMove extends GameMove
{
  private final int mIndex;

  public ScriptedMove(int xiIndex)
  {
    mIndex = xiIndex;
  }

  public int getIndex()
  {
    return mIndex;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof ScriptedMove) && (((ScriptedMove)xiOther).mIndex == mIndex);
  }

  @Override
  public int hashCode()
  {
    return mIndex;
  }

  @Override
  public String toString()
  {
    return "move" + mIndex;
  }
}
