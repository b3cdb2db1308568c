package org.mcts.base.player.search;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

import org.mcts.base.util.statemachine.GameMove;
import org.mcts.base.util.statemachine.GameState;

/**
 * A node in an MCTS search tree.
 *
 * Each node represents one reachable state and exclusively owns its children.  The value held by a node is from the
 * point of view of the side that moved into it, so that a parent choosing between its children simply compares their
 * means.
 *
 * Nodes are only ever modified by the controlling thread of the tree that owns them.
 */
public class SearchTreeNode
{
  private SearchTreeNode             mParent;
  private final GameMove             mMove;
  private final GameState            mState;
  private final boolean              mMoverIsFirstSide;
  private final Deque<GameMove>      mUntriedMoves;
  private final List<SearchTreeNode> mChildren = new ArrayList<>();

  private int                        mNumVisits = 0;
  private double                     mValueSum = 0;
  private int                        mNumDirectRollouts = 0;

  /**
   * A candidate move, along with the prior that determines when it is expanded.
   */
  private static class ScoredMove
  {
    final GameMove mMove;
    final double   mScore;

    ScoredMove(GameMove xiMove, double xiScore)
    {
      mMove = xiMove;
      mScore = xiScore;
    }
  }

  private static final Comparator<ScoredMove> HIGHEST_SCORE_FIRST = new Comparator<ScoredMove>()
  {
    @Override
    public int compare(ScoredMove xiA, ScoredMove xiB)
    {
      return Double.compare(xiB.mScore, xiA.mScore);
    }
  };

  /**
   * Create a root node.
   *
   * @param xiState - the state at the root.
   *
   * @return the new node.
   */
  public static SearchTreeNode createRoot(GameState xiState)
  {
    // Nobody moved into the root.  Attribute it to the side not to move, which keeps the perspective alternating.
    return new SearchTreeNode(null, null, xiState, !xiState.isFirstSideToMove());
  }

  private SearchTreeNode(SearchTreeNode xiParent,
                         GameMove xiMove,
                         GameState xiState,
                         boolean xiMoverIsFirstSide)
  {
    mParent = xiParent;
    mMove = xiMove;
    mState = xiState;
    mMoverIsFirstSide = xiMoverIsFirstSide;
    mUntriedMoves = orderCandidateMoves(xiState);
  }

  /**
   * @return the legal moves in the specified state, in the order in which they should be expanded.  Moves with a
   * higher prior come first.  The sort is stable, so moves with the same prior keep the state's own order.
   */
  private static Deque<GameMove> orderCandidateMoves(GameState xiState)
  {
    Deque<GameMove> lResult = new ArrayDeque<>();
    if (xiState.isTerminal())
    {
      return lResult;
    }

    List<GameMove> lLegalMoves = xiState.getLegalMoves();
    List<ScoredMove> lScoredMoves = new ArrayList<>(lLegalMoves.size());
    for (GameMove lMove : lLegalMoves)
    {
      lScoredMoves.add(new ScoredMove(lMove, xiState.evaluateMove(lMove)));
    }
    Collections.sort(lScoredMoves, HIGHEST_SCORE_FIRST);

    for (ScoredMove lScoredMove : lScoredMoves)
    {
      lResult.add(lScoredMove.mMove);
    }
    return lResult;
  }

  /**
   * Select the child to descend into, using the upper-confidence bound.  Unvisited children are always selected first.
   * Ties go to the first child encountered.
   *
   * @param xiExplorationBias - the exploration constant.
   *
   * @return the selected child.
   */
  public SearchTreeNode selectChild(double xiExplorationBias)
  {
    assert(!mChildren.isEmpty()) : "Can't select from a node without children";

    double lBestScore = Double.NEGATIVE_INFINITY;
    SearchTreeNode lBestChild = null;
    double lLogParentVisits = Math.log(mNumVisits);

    for (SearchTreeNode lChild : mChildren)
    {
      double lScore;
      if (lChild.mNumVisits == 0)
      {
        lScore = Double.POSITIVE_INFINITY;
      }
      else
      {
        lScore = lChild.getMean() + xiExplorationBias * Math.sqrt(lLogParentVisits / lChild.mNumVisits);
      }

      if ((lBestChild == null) || (lScore > lBestScore))
      {
        lBestScore = lScore;
        lBestChild = lChild;
      }
    }

    return lBestChild;
  }

  /**
   * Expand this node by one child, using the next untried move.
   *
   * @return the new child.
   */
  public SearchTreeNode expand()
  {
    assert(!mState.isTerminal()) : "Can't expand a terminal node";
    assert(!mUntriedMoves.isEmpty()) : "Can't expand a node without untried moves";

    GameMove lMove = mUntriedMoves.poll();
    SearchTreeNode lChild = new SearchTreeNode(this, lMove, mState.applyMove(lMove), mState.isFirstSideToMove());
    mChildren.add(lChild);

    return lChild;
  }

  /**
   * Record that a rollout was performed from this node (rather than from one of its descendants).
   */
  public void recordDirectRollout()
  {
    mNumDirectRollouts++;
  }

  /**
   * Update this node and all its ancestors with the outcome of a rollout.
   *
   * @param xiOutcome - the rollout outcome, from the point of view of the first side.
   */
  public void backPropagate(double xiOutcome)
  {
    assert(xiOutcome >= 0.0 && xiOutcome <= 1.0) : "Outcome out of range: " + xiOutcome;

    for (SearchTreeNode lNode = this; lNode != null; lNode = lNode.mParent)
    {
      lNode.mNumVisits++;
      lNode.mValueSum += lNode.mMoverIsFirstSide ? xiOutcome : (1.0 - xiOutcome);
    }
  }

  /**
   * @return the child reached by the specified move, or null if it hasn't been expanded.
   *
   * @param xiMove - the move.
   */
  public SearchTreeNode findChild(GameMove xiMove)
  {
    for (SearchTreeNode lChild : mChildren)
    {
      if (lChild.mMove.equals(xiMove))
      {
        return lChild;
      }
    }
    return null;
  }

  /**
   * @return the child to play: the most visited, then the one with the highest mean, then the first encountered.  Null
   * if there are no children.
   */
  public SearchTreeNode getBestChild()
  {
    SearchTreeNode lBestChild = null;

    for (SearchTreeNode lChild : mChildren)
    {
      if ((lBestChild == null) ||
          (lChild.mNumVisits > lBestChild.mNumVisits) ||
          ((lChild.mNumVisits == lBestChild.mNumVisits) && (lChild.getMean() > lBestChild.getMean())))
      {
        lBestChild = lChild;
      }
    }

    return lBestChild;
  }

  /**
   * Detach this node from its parent, making it the root of its own tree.  The parent and any siblings become
   * unreachable from this node.
   */
  void detach()
  {
    mParent = null;
  }

  /**
   * @return the number of nodes in the subtree rooted at this node, including this one.
   */
  public int getSubtreeSize()
  {
    int lSize = 0;
    Deque<SearchTreeNode> lStack = new ArrayDeque<>();
    lStack.push(this);
    while (!lStack.isEmpty())
    {
      SearchTreeNode lNode = lStack.pop();
      lSize++;
      for (SearchTreeNode lChild : lNode.mChildren)
      {
        lStack.push(lChild);
      }
    }
    return lSize;
  }

  /**
   * Check the statistics of the subtree rooted at this node.
   *
   * - Every node's visits are the sum of its children's visits and its own direct rollouts.
   * - Every child points back to its parent.
   * - The side credited with each child is the side to move in its parent.
   *
   * @return a description of the first inconsistency found, or null if there is none.
   */
  public String findInconsistency()
  {
    Deque<SearchTreeNode> lStack = new ArrayDeque<>();
    lStack.push(this);
    while (!lStack.isEmpty())
    {
      SearchTreeNode lNode = lStack.pop();
      int lChildVisits = 0;
      for (SearchTreeNode lChild : lNode.mChildren)
      {
        if (lChild.mParent != lNode)
        {
          return "Child " + lChild.mMove + " of " + lNode + " has the wrong parent";
        }
        if (lChild.mMoverIsFirstSide != lNode.mState.isFirstSideToMove())
        {
          return "Child " + lChild.mMove + " of " + lNode + " is credited to the wrong side";
        }
        lChildVisits += lChild.mNumVisits;
        lStack.push(lChild);
      }

      if (lNode.mNumVisits != lChildVisits + lNode.mNumDirectRollouts)
      {
        return lNode + " has " + lNode.mNumVisits + " visits but its children have " + lChildVisits +
               " and it has " + lNode.mNumDirectRollouts + " direct rollouts";
      }
    }
    return null;
  }

  public SearchTreeNode getParent()
  {
    return mParent;
  }

  /**
   * @return the move that led to this node, or null for a root created from a state.
   */
  public GameMove getMove()
  {
    return mMove;
  }

  public GameState getState()
  {
    return mState;
  }

  public boolean isTerminal()
  {
    return mState.isTerminal();
  }

  /**
   * @return whether the value of this node is from the first side's point of view.
   */
  public boolean isMoverFirstSide()
  {
    return mMoverIsFirstSide;
  }

  public boolean hasUntriedMoves()
  {
    return !mUntriedMoves.isEmpty();
  }

  /**
   * @return the moves not yet expanded, in the order they will be expanded.
   */
  public List<GameMove> getUntriedMoves()
  {
    return Collections.unmodifiableList(new ArrayList<>(mUntriedMoves));
  }

  public boolean hasChildren()
  {
    return !mChildren.isEmpty();
  }

  /**
   * @return the children, in the order they were expanded.
   */
  public List<SearchTreeNode> getChildren()
  {
    return Collections.unmodifiableList(mChildren);
  }

  public int getNumVisits()
  {
    return mNumVisits;
  }

  public double getValueSum()
  {
    return mValueSum;
  }

  /**
   * @return the mean value of this node for the side that moved into it, or 0 if it hasn't been visited.
   */
  public double getMean()
  {
    return (mNumVisits == 0) ? 0 : mValueSum / mNumVisits;
  }

  public int getNumDirectRollouts()
  {
    return mNumDirectRollouts;
  }

  @Override
  public String toString()
  {
    return "Node(" + ((mMove == null) ? "root" : mMove) + ", visits=" + mNumVisits + ")";
  }
}
