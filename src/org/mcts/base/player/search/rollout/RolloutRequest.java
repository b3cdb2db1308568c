package org.mcts.base.player.search.rollout;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

import org.apache.logging.log4j.ThreadContext;
import org.mcts.base.player.search.RolloutStrategy;
import org.mcts.base.util.statemachine.GameState;

/**
 * Request object holding all the information about a single rollout.
 *
 * A request owns its state outright: it is always given a fresh copy, never a state that is stored in a tree node, so
 * it may be processed on any thread.
 */
public class RolloutRequest implements Callable<Double>
{
  /**
   * Logging context key under which the name of the agent doing the work is recorded.
   */
  public static final String LOG_CONTEXT_KEY = "agentID";

  private final GameState       mState;
  private final RolloutStrategy mStrategy;
  private final double          mHeuristicRatio;
  private final String          mLogName;

  /**
   * Create a rollout request.
   *
   * @param xiState - the state to roll out from.  Must not be shared with anything else.
   * @param xiStrategy - the rollout strategy.
   * @param xiHeuristicRatio - the probability of a heuristic playout under {@link RolloutStrategy#MIXED}.
   * @param xiLogName - name of the requesting agent, for logging.
   */
  public RolloutRequest(GameState xiState,
                        RolloutStrategy xiStrategy,
                        double xiHeuristicRatio,
                        String xiLogName)
  {
    mState = xiState;
    mStrategy = xiStrategy;
    mHeuristicRatio = xiHeuristicRatio;
    mLogName = xiLogName;
  }

  /**
   * Process this rollout request.
   *
   * @return the outcome for the first side, in [0.0, 1.0].
   */
  @Override
  public Double call()
  {
    String lPreviousLogName = ThreadContext.get(LOG_CONTEXT_KEY);
    ThreadContext.put(LOG_CONTEXT_KEY, mLogName);
    try
    {
      return process();
    }
    finally
    {
      if (lPreviousLogName == null)
      {
        ThreadContext.remove(LOG_CONTEXT_KEY);
      }
      else
      {
        ThreadContext.put(LOG_CONTEXT_KEY, lPreviousLogName);
      }
    }
  }

  private double process()
  {
    double lOutcome;
    switch (mStrategy)
    {
      case HEURISTIC:
      case HEAVY:
        lOutcome = mState.heuristicPlayout();
        break;

      case MIXED:
        if (ThreadLocalRandom.current().nextDouble() < mHeuristicRatio)
        {
          lOutcome = mState.heuristicPlayout();
        }
        else
        {
          lOutcome = mState.playout();
        }
        break;

      case RANDOM:
      default:
        lOutcome = mState.playout();
        break;
    }

    // NaN fails both comparisons, so is rejected too.
    if (!(lOutcome >= 0.0 && lOutcome <= 1.0))
    {
      throw new IllegalStateException("Playout from " + mState + " returned " + lOutcome +
                                      ", which is outside the range [0, 1]");
    }

    return lOutcome;
  }
}
