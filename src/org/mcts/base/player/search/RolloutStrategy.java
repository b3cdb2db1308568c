package org.mcts.base.player.search;

/**
 * The kind of playout performed from a frontier node.
 */
public enum RolloutStrategy
{
  /**
   * Purely random playouts, via {@link org.mcts.base.util.statemachine.GameState#playout()}.
   */
  RANDOM,

  /**
   * Heuristically guided playouts, via {@link org.mcts.base.util.statemachine.GameState#heuristicPlayout()}.
   */
  HEURISTIC,

  /**
   * Deeper heuristic evaluation.  Games have a single heuristic playout, so this behaves exactly as
   * {@link #HEURISTIC}.
   */
  HEAVY,

  /**
   * A heuristic playout with a configurable probability, otherwise a random one.
   */
  MIXED;
}
