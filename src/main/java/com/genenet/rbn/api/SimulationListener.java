package com.genenet.rbn.api;

/**
 * Observability hook for trajectory simulation.
 *
 * Callbacks run inside the simulation loop of the
 * {@link com.genenet.rbn.engine.DynamicsEngine}, once per step. Keep them
 * cheap: anything slow here slows every simulated trajectory.
 */
public interface SimulationListener {

    /**
     * Called after the initial state has been drawn.
     *
     * @param run     sequence number of the trajectory within the engine.
     * @param scheme  update scheme of the trajectory.
     * @param initial the random initial state.
     */
    void onTrajectoryStart(long run, UpdateScheme scheme, State initial);

    /**
     * Called after every update step.
     *
     * @param run      trajectory sequence number.
     * @param step     step number, starting at 1.
     * @param previous state before the step.
     * @param next     state after the step.
     */
    void onStep(long run, int step, State previous, State next);

    /**
     * Called when a listener callback or rule evaluation threw.
     *
     * @param run   trajectory sequence number.
     * @param step  step during which the error occurred.
     * @param error the exception.
     */
    void onError(long run, int step, Throwable error);

    /**
     * Called once the trajectory is complete.
     *
     * @param run        trajectory sequence number.
     * @param trajectory the finished trajectory.
     */
    void onTrajectoryEnd(long run, Trajectory trajectory);
}
