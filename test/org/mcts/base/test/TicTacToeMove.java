package org.mcts.base.test;

import org.mcts.base.util.statemachine.GameMove;

/**
 * A tic-tac-toe move: a mark in one of the cells, numbered 0-8 row by row.
 */
public class TicTacToeMove extends GameMove
{
  private final int mCell;

  public TicTacToeMove(int xiCell)
  {
    mCell = xiCell;
  }

  public int getCell()
  {
    return mCell;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof TicTacToeMove) && (((TicTacToeMove)xiOther).mCell == mCell);
  }

  @Override
  public int hashCode()
  {
    return mCell;
  }

  @Override
  public String toString()
  {
    return "mark " + (mCell / 3 + 1) + " " + (mCell % 3 + 1);
  }
}
