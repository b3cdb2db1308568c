package org.mcts.base.player.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mcts.base.player.search.MachineSpecificConfiguration.CfgItem;
import org.mcts.base.player.search.rollout.RolloutExecutor;
import org.mcts.base.util.statemachine.GameMove;
import org.mcts.base.util.statemachine.GameState;
import org.mcts.base.util.statemachine.exceptions.IllegalMoveException;
import org.mcts.base.util.stats.SampledStatistic;

/**
 * An MCTS search tree, persisting across the turns of a game.
 *
 * Each iteration selects a frontier node by upper-confidence descent, expands it by one child, rolls out from the new
 * child and propagates the outcome back to the root.
 */
public class SearchTree
{
  private static final Logger LOGGER = LogManager.getLogger();

  private SearchTreeNode                mRoot;
  private final RolloutExecutor         mRolloutExecutor;
  private final double                  mExplorationBias;
  private final SampledStatistic        mIterationMicros = new SampledStatistic();
  private volatile Thread               mOwner = null;

  /**
   * Create a search tree, using the configured exploration bias.
   *
   * @param xiRootState - the state at the root.
   * @param xiRolloutExecutor - the executor for rollouts.
   */
  public SearchTree(GameState xiRootState, RolloutExecutor xiRolloutExecutor)
  {
    this(xiRootState, xiRolloutExecutor, MachineSpecificConfiguration.getCfgDouble(CfgItem.EXPLORATION_BIAS));
  }

  /**
   * Create a search tree.
   *
   * @param xiRootState - the state at the root.
   * @param xiRolloutExecutor - the executor for rollouts.
   * @param xiExplorationBias - the exploration constant for the upper-confidence bound.
   */
  public SearchTree(GameState xiRootState, RolloutExecutor xiRolloutExecutor, double xiExplorationBias)
  {
    if (!(xiExplorationBias >= 0) || Double.isInfinite(xiExplorationBias))
    {
      throw new IllegalArgumentException("Invalid exploration bias: " + xiExplorationBias);
    }

    mRoot = SearchTreeNode.createRoot(xiRootState);
    mRolloutExecutor = xiRolloutExecutor;
    mExplorationBias = xiExplorationBias;
  }

  /**
   * @return whether there is anything to search, i.e. the root isn't terminal and has at least one move.
   */
  public boolean isSearchable()
  {
    return !mRoot.isTerminal() && (mRoot.hasUntriedMoves() || mRoot.hasChildren());
  }

  /**
   * Perform a single MCTS iteration.
   */
  public void grow()
  {
    assert(checkOwnership());

    // Select
    SearchTreeNode lNode = mRoot;
    while (!lNode.isTerminal() && !lNode.hasUntriedMoves() && lNode.hasChildren())
    {
      lNode = lNode.selectChild(mExplorationBias);
    }

    // Expand
    if (!lNode.isTerminal() && lNode.hasUntriedMoves())
    {
      lNode = lNode.expand();
    }

    // Rollout
    double lOutcome = mRolloutExecutor.rollout(lNode.getState());

    // Back-propagate
    lNode.recordDirectRollout();
    lNode.backPropagate(lOutcome);
  }

  /**
   * Perform iterations until either budget is exhausted.  The budgets are checked between iterations.  At least one
   * iteration is always performed, provided the tree is searchable.
   *
   * @param xiMaxIterations - the maximum number of iterations.
   * @param xiMaxSeconds - the maximum wall-clock time, in seconds.  May be infinite.
   *
   * @return the number of iterations performed.
   */
  public int growTree(int xiMaxIterations, double xiMaxSeconds)
  {
    if (!isSearchable())
    {
      return 0;
    }

    mIterationMicros.clear();

    // The cast saturates, so an infinite budget becomes Long.MAX_VALUE.
    long lBudgetNanos = (long)(xiMaxSeconds * 1000000000L);
    long lStartTime = System.nanoTime();
    long lIterationStart = lStartTime;
    int lIterations = 0;

    do
    {
      grow();
      lIterations++;

      long lNow = System.nanoTime();
      mIterationMicros.sample((lNow - lIterationStart) / 1000.0);
      lIterationStart = lNow;
    }
    while ((lIterations < xiMaxIterations) && (lIterationStart - lStartTime < lBudgetNanos));

    assert(mRoot.findInconsistency() == null) : mRoot.findInconsistency();

    LOGGER.debug("Performed " + lIterations + " iterations in " + ((lIterationStart - lStartTime) / 1000000) + "ms");
    return lIterations;
  }

  /**
   * @return the best child of the root, or null if the root has no children.
   */
  public SearchTreeNode getBestChild()
  {
    return mRoot.getBestChild();
  }

  /**
   * Make the specified child of the root the new root, discarding its siblings.
   *
   * @param xiChild - the child.
   */
  public void promote(SearchTreeNode xiChild)
  {
    assert(checkOwnership());
    assert(xiChild.getParent() == mRoot) : xiChild + " isn't a child of the root";

    xiChild.detach();
    mRoot = xiChild;
  }

  /**
   * Advance the root over a move, keeping the subtree below it where possible.
   *
   * - If the move has already been explored, its child becomes the root.
   * - If it's legal but unexplored, the tree is rebuilt from the resulting state.
   *
   * @param xiMove - the move.
   *
   * @throws IllegalMoveException if the move isn't legal in the root state.  The tree is unchanged.
   */
  public void advance(GameMove xiMove) throws IllegalMoveException
  {
    assert(checkOwnership());

    SearchTreeNode lChild = mRoot.findChild(xiMove);
    if (lChild != null)
    {
      LOGGER.debug("Re-using subtree of " + lChild.getSubtreeSize() + " nodes for move " + xiMove);
      promote(lChild);
      return;
    }

    GameState lRootState = mRoot.getState();
    if (!lRootState.isTerminal() && lRootState.getLegalMoves().contains(xiMove))
    {
      LOGGER.info("Move " + xiMove + " hasn't been explored - rebuilding the tree");
      reset(lRootState.applyMove(xiMove));
      return;
    }

    throw new IllegalMoveException(xiMove, lRootState);
  }

  /**
   * Discard the whole tree and start again from the specified state.
   *
   * @param xiRootState - the new root state.
   */
  public void reset(GameState xiRootState)
  {
    assert(checkOwnership());
    mRoot = SearchTreeNode.createRoot(xiRootState);
  }

  /**
   * Check the statistics of the whole tree.
   *
   * @throws IllegalStateException if they're inconsistent.
   */
  public void validate()
  {
    String lProblem = mRoot.findInconsistency();
    if (lProblem != null)
    {
      throw new IllegalStateException("Search tree is inconsistent: " + lProblem);
    }
  }

  /**
   * Take ownership of this tree for the calling thread.  Only the owner may modify the tree.
   *
   * @return true, always.
   */
  boolean takeOwnership()
  {
    assert(mOwner == null) :
       Thread.currentThread().getName() + " can't take tree ownership because it's owned by " + mOwner.getName();
    mOwner = Thread.currentThread();
    return true;
  }

  /**
   * Release ownership of this tree.  Can only be called by the current owner.
   *
   * @return true, always.
   */
  boolean releaseOwnership()
  {
    assert(mOwner == Thread.currentThread()) :
       Thread.currentThread().getName() + " can't release tree ownership because it's owned by " + mOwner;
    mOwner = null;
    return true;
  }

  /**
   * Check that the calling thread may modify the tree.  An unowned tree may be modified by anybody.
   *
   * @return true, always.
   */
  private boolean checkOwnership()
  {
    Thread lOwner = mOwner;
    assert(lOwner == null || lOwner == Thread.currentThread()) :
       Thread.currentThread().getName() + " can't modify tree because it's owned by " + lOwner.getName();
    return true;
  }

  public SearchTreeNode getRoot()
  {
    return mRoot;
  }

  public GameState getCurrentState()
  {
    return mRoot.getState();
  }

  /**
   * @return the number of nodes in the tree.
   */
  public int getSize()
  {
    return mRoot.getSubtreeSize();
  }

  public double getExplorationBias()
  {
    return mExplorationBias;
  }

  public RolloutExecutor getRolloutExecutor()
  {
    return mRolloutExecutor;
  }

  /**
   * @return statistics on the duration of each iteration of the latest search, in microseconds.
   */
  public SampledStatistic getIterationTimeStatistics()
  {
    return mIterationMicros;
  }
}
