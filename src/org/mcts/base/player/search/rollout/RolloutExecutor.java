package org.mcts.base.player.search.rollout;

import java.util.ArrayList;
import java.util.List;

import org.mcts.base.player.search.RolloutStrategy;
import org.mcts.base.util.statemachine.GameState;
import org.mcts.base.util.stats.SampledStatistic;

/**
 * Performs the rollouts for one search tree.
 *
 * Each call runs one playout per configured rollout thread and reduces them to their mean.  With a single thread the
 * playout runs on the calling (controlling) thread.  Otherwise, the playouts are spread over the shared
 * {@link RolloutProcessorPool} and the caller blocks until they have all finished.
 *
 * Not thread-safe.  Only the owning tree's controlling thread may call {@link #rollout(GameState)}.
 */
public class RolloutExecutor
{
  private final String           mLogName;
  private RolloutStrategy        mStrategy;
  private double                 mHeuristicRatio;
  private final SampledStatistic mOutcomes = new SampledStatistic();
  private long                   mNumPlayouts = 0;

  /**
   * Create a rollout executor.
   *
   * @param xiStrategy - the initial rollout strategy.
   * @param xiHeuristicRatio - the initial heuristic ratio for {@link RolloutStrategy#MIXED}.
   * @param xiLogName - name of the owning agent, for logging.
   */
  public RolloutExecutor(RolloutStrategy xiStrategy, double xiHeuristicRatio, String xiLogName)
  {
    setStrategy(xiStrategy);
    setHeuristicRatio(xiHeuristicRatio);
    mLogName = xiLogName;
  }

  /**
   * Roll out from the specified state.
   *
   * @param xiState - the state, which may be owned by a tree node.  Every playout works on its own deep copy.
   *
   * @return the mean outcome for the first side, in [0.0, 1.0].
   */
  public double rollout(GameState xiState)
  {
    int lNumRollouts = ThreadControl.getRolloutThreads();
    double lOutcome;

    if (lNumRollouts == 1)
    {
      lOutcome = createRequest(xiState).call();
    }
    else
    {
      List<RolloutRequest> lRequests = new ArrayList<>(lNumRollouts);
      for (int lii = 0; lii < lNumRollouts; lii++)
      {
        lRequests.add(createRequest(xiState));
      }

      // Sum then divide.  The outcomes come back in request order, so the result doesn't depend on which processor
      // finished first.
      double lTotal = 0;
      for (double lResult : RolloutProcessorPool.processAll(lRequests))
      {
        lTotal += lResult;
      }
      lOutcome = lTotal / lNumRollouts;
    }

    mNumPlayouts += lNumRollouts;
    mOutcomes.sample(lOutcome);
    return lOutcome;
  }

  private RolloutRequest createRequest(GameState xiState)
  {
    GameState lCopy = xiState.deepCopy();
    assert(lCopy != xiState) : "deepCopy() returned the tree-owned state itself";
    return new RolloutRequest(lCopy, mStrategy, mHeuristicRatio, mLogName);
  }

  public RolloutStrategy getStrategy()
  {
    return mStrategy;
  }

  /**
   * @param xiStrategy - the rollout strategy for subsequent rollouts.
   */
  public void setStrategy(RolloutStrategy xiStrategy)
  {
    if (xiStrategy == null)
    {
      throw new IllegalArgumentException("Rollout strategy must not be null");
    }
    mStrategy = xiStrategy;
  }

  public double getHeuristicRatio()
  {
    return mHeuristicRatio;
  }

  /**
   * @param xiRatio - the probability of a heuristic playout under {@link RolloutStrategy#MIXED}, in [0, 1].
   */
  public void setHeuristicRatio(double xiRatio)
  {
    if (!(xiRatio >= 0.0 && xiRatio <= 1.0))
    {
      throw new IllegalArgumentException("Heuristic ratio must be in [0, 1], not " + xiRatio);
    }
    mHeuristicRatio = xiRatio;
  }

  /**
   * @return statistics on the (reduced) outcome of each call to {@link #rollout(GameState)}.
   */
  public SampledStatistic getOutcomeStatistics()
  {
    return mOutcomes;
  }

  /**
   * @return the total number of individual playouts performed.
   */
  public long getNumPlayouts()
  {
    return mNumPlayouts;
  }
}
