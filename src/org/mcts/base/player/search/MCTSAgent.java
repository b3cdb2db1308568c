package org.mcts.base.player.search;

import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.mcts.base.player.search.MachineSpecificConfiguration.CfgItem;
import org.mcts.base.player.search.rollout.RolloutExecutor;
import org.mcts.base.player.search.rollout.RolloutRequest;
import org.mcts.base.util.statemachine.GameMove;
import org.mcts.base.util.statemachine.GameState;
import org.mcts.base.util.statemachine.exceptions.IllegalMoveException;

/**
 * A game-playing agent, driving an MCTS search tree for one side of a game.
 *
 * The agent keeps its tree for the whole game.  On each turn it advances the tree over the opponent's move, searches
 * within its budget, plays the best move found and advances the tree over that move too.  Whatever thread calls
 * {@link #generateMove(GameMove)} is the controlling thread for that turn.  An agent must not be used by two threads
 * at once.
 */
public class MCTSAgent
{
  private static final Logger LOGGER = LogManager.getLogger();
  private static final Logger STATS_LOGGER = LogManager.getLogger("stats");

  /**
   * Iteration budget meaning "no limit".
   */
  public static final int UNLIMITED_ITERATIONS = Integer.MAX_VALUE;

  /**
   * Time budget meaning "no limit".
   */
  public static final double UNLIMITED_TIME = Double.POSITIVE_INFINITY;

  /**
   * The phases of a turn.
   */
  public static enum AgentState
  {
    /**
     * Not in the middle of a turn.
     */
    IDLE,

    /**
     * Running MCTS iterations.
     */
    SEARCHING,

    /**
     * Search complete, about to play the best move.
     */
    READY_TO_COMMIT;
  }

  private static final AtomicInteger sNextAgentIndex = new AtomicInteger();

  private final String          mName;
  private final SearchTree      mTree;
  private final int             mMaxIterations;
  private final double          mMaxSeconds;
  private int                   mTurnCount = 0;

  // Written by the controlling thread, readable from anywhere.
  private volatile AgentState   mAgentState = AgentState.IDLE;
  private volatile int          mLastIterationCount = 0;
  private volatile String       mFeedback = null;

  /**
   * Create an agent with the configured budgets.
   *
   * @param xiState - the state from which the agent will play.
   */
  public MCTSAgent(GameState xiState)
  {
    this(xiState,
         MachineSpecificConfiguration.getCfgInt(CfgItem.MAX_ITERATIONS_PER_TURN),
         MachineSpecificConfiguration.getCfgDouble(CfgItem.MAX_SECONDS_PER_TURN));
  }

  /**
   * Create an agent.
   *
   * @param xiState - the state from which the agent will play.
   * @param xiMaxIterations - the most iterations to perform per turn, or {@link #UNLIMITED_ITERATIONS}.
   * @param xiMaxSeconds - the most wall-clock time to spend per turn, or {@link #UNLIMITED_TIME}.
   */
  public MCTSAgent(GameState xiState, int xiMaxIterations, double xiMaxSeconds)
  {
    if (xiState == null)
    {
      throw new IllegalArgumentException("Initial state must not be null");
    }
    if (xiMaxIterations < 1)
    {
      throw new IllegalArgumentException("Iteration budget must be positive, not " + xiMaxIterations);
    }
    if (!(xiMaxSeconds > 0))
    {
      throw new IllegalArgumentException("Time budget must be positive, not " + xiMaxSeconds);
    }

    mName = "MCTSAgent-" + sNextAgentIndex.getAndIncrement();
    mMaxIterations = xiMaxIterations;
    mMaxSeconds = xiMaxSeconds;

    RolloutStrategy lStrategy;
    String lConfiguredStrategy = MachineSpecificConfiguration.getCfgStr(CfgItem.ROLLOUT_STRATEGY).trim();
    try
    {
      lStrategy = RolloutStrategy.valueOf(lConfiguredStrategy);
    }
    catch (IllegalArgumentException lEx)
    {
      LOGGER.warn("Unknown rollout strategy '" + lConfiguredStrategy + "' - using " + RolloutStrategy.RANDOM);
      lStrategy = RolloutStrategy.RANDOM;
    }

    mTree = new SearchTree(xiState,
                           new RolloutExecutor(lStrategy,
                                               MachineSpecificConfiguration.getCfgDouble(CfgItem.HEURISTIC_RATIO),
                                               mName));

    LOGGER.debug("Created " + mName + " (iterations: " + xiMaxIterations + ", seconds: " + xiMaxSeconds + ")");
  }

  /**
   * Play a move.
   *
   * @param xiOpponentMove - the move the opponent just played, or null if there isn't one (e.g. on the first turn, or
   *                         when the caller has already advanced the game).
   *
   * @return the move to play, or null if the game is over or there are no legal moves.
   *
   * @throws IllegalMoveException if the opponent's move isn't legal.  The agent is unchanged.
   */
  public GameMove generateMove(GameMove xiOpponentMove) throws IllegalMoveException
  {
    String lPreviousLogName = ThreadContext.get(RolloutRequest.LOG_CONTEXT_KEY);
    ThreadContext.put(RolloutRequest.LOG_CONTEXT_KEY, mName);
    assert(mTree.takeOwnership());
    try
    {
      if (xiOpponentMove != null)
      {
        mTree.advance(xiOpponentMove);
      }

      if (!mTree.isSearchable())
      {
        LOGGER.info("No move to play from " + mTree.getCurrentState());
        return null;
      }

      mTurnCount++;
      mAgentState = AgentState.SEARCHING;
      long lStartTime = System.nanoTime();
      int lIterations = mTree.growTree(mMaxIterations, mMaxSeconds);
      long lElapsedMillis = (System.nanoTime() - lStartTime) / 1000000;
      mLastIterationCount = lIterations;

      mAgentState = AgentState.READY_TO_COMMIT;
      SearchTreeNode lBestChild = mTree.getBestChild();
      assert(lBestChild != null) : "No child after " + lIterations + " iterations";

      recordFeedback(lBestChild, lIterations, lElapsedMillis);

      mTree.promote(lBestChild);
      LOGGER.info("Turn " + mTurnCount + ": playing " + lBestChild.getMove() + " after " + lIterations +
                  " iterations");
      return lBestChild.getMove();
    }
    finally
    {
      mAgentState = AgentState.IDLE;
      assert(mTree.releaseOwnership());
      if (lPreviousLogName == null)
      {
        ThreadContext.remove(RolloutRequest.LOG_CONTEXT_KEY);
      }
      else
      {
        ThreadContext.put(RolloutRequest.LOG_CONTEXT_KEY, lPreviousLogName);
      }
    }
  }

  /**
   * Record the outcome of the search, before the best child is promoted.
   */
  private void recordFeedback(SearchTreeNode xiBestChild, int xiIterations, long xiElapsedMillis)
  {
    StringBuilder lLogBuf = new StringBuilder(1024);
    lLogBuf.append("Turn ");
    lLogBuf.append(mTurnCount);
    lLogBuf.append(": ");
    lLogBuf.append(xiIterations);
    lLogBuf.append(" iterations in ");
    lLogBuf.append(xiElapsedMillis);
    lLogBuf.append("ms, tree size ");
    lLogBuf.append(mTree.getSize());
    lLogBuf.append(", rollout outcome ");
    lLogBuf.append(mTree.getRolloutExecutor().getOutcomeStatistics());
    STATS_LOGGER.info(lLogBuf.toString());

    // The moves are rendered by game code, which we don't trust not to throw.
    String lFeedback;
    try
    {
      lFeedback = buildFeedback(xiBestChild, xiIterations, xiElapsedMillis);
    }
    catch (RuntimeException lEx)
    {
      LOGGER.warn("Failed to build search feedback", lEx);
      lFeedback = "Turn " + mTurnCount + ": " + xiIterations + " iterations (no details available)";
    }
    mFeedback = lFeedback;
  }

  private String buildFeedback(SearchTreeNode xiBestChild, int xiIterations, long xiElapsedMillis)
  {
    SearchTreeNode lRoot = mTree.getRoot();

    StringBuilder lBuf = new StringBuilder(1024);
    lBuf.append("Turn ").append(mTurnCount).append(": ");
    lBuf.append(xiIterations).append(" iterations in ").append(xiElapsedMillis).append("ms, ");
    lBuf.append(lRoot.getSubtreeSize()).append(" nodes, playing ").append(xiBestChild.getMove());
    lBuf.append(" (win rate ").append(String.format("%.3f", xiBestChild.getMean())).append(")\n");

    lBuf.append(StringUtils.rightPad("Move", 20));
    lBuf.append(StringUtils.leftPad("Visits", 10));
    lBuf.append(StringUtils.leftPad("Mean", 10));
    lBuf.append('\n');
    for (SearchTreeNode lChild : lRoot.getChildren())
    {
      lBuf.append(StringUtils.rightPad(StringUtils.abbreviate(String.valueOf(lChild.getMove()), 19), 20));
      lBuf.append(StringUtils.leftPad(Integer.toString(lChild.getNumVisits()), 10));
      lBuf.append(StringUtils.leftPad(String.format("%.3f", lChild.getMean()), 10));
      lBuf.append((lChild == xiBestChild) ? " *" : "");
      lBuf.append('\n');
    }

    return lBuf.toString();
  }

  /**
   * @return a human-readable summary of the most recent search.  Safe to call at any time, from any thread.
   */
  public String getFeedback()
  {
    String lFeedback = mFeedback;
    String lPrefix = mName + " [" + mAgentState + "] ";
    if (lFeedback == null)
    {
      return lPrefix + "No search performed yet";
    }
    return lPrefix + lFeedback;
  }

  /**
   * Write the summary of the most recent search to the log.
   */
  public void logFeedback()
  {
    LOGGER.info(getFeedback());
  }

  /**
   * @return the state at the root of the tree, i.e. the current game position as far as the agent knows.
   */
  public GameState getCurrentState()
  {
    return mTree.getCurrentState();
  }

  /**
   * @return the number of nodes in the tree.
   */
  public int getTreeSize()
  {
    return mTree.getSize();
  }

  /**
   * @return the number of iterations performed in the most recent search.
   */
  public int getLastIterationCount()
  {
    return mLastIterationCount;
  }

  public AgentState getAgentState()
  {
    return mAgentState;
  }

  public String getName()
  {
    return mName;
  }

  public RolloutStrategy getRolloutStrategy()
  {
    return mTree.getRolloutExecutor().getStrategy();
  }

  public void setRolloutStrategy(RolloutStrategy xiStrategy)
  {
    mTree.getRolloutExecutor().setStrategy(xiStrategy);
  }

  public double getHeuristicRatio()
  {
    return mTree.getRolloutExecutor().getHeuristicRatio();
  }

  /**
   * @param xiRatio - the probability of a heuristic playout under {@link RolloutStrategy#MIXED}, in [0, 1].
   */
  public void setHeuristicRatio(double xiRatio)
  {
    mTree.getRolloutExecutor().setHeuristicRatio(xiRatio);
  }

  /**
   * UT-only access to the search tree.
   */
  SearchTree getTree()
  {
    return mTree;
  }
}
