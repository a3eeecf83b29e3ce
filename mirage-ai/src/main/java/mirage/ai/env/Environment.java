package mirage.ai.env;

/**
 * Reward-driven state machine: FRESH --reset--> ACTIVE --step*--> TERMINATED,
 * and TERMINATED --reset--> ACTIVE. Single owner; not thread-safe.
 */
public interface Environment {

    int getStateDim();

    int getActionDim();

    ActionCatalog getCatalog();

    Phase getPhase();

    /** Number of participants taking turns (1 or 2). */
    int getParticipantCount();

    /** Participant whose turn it is. */
    int getActiveIndex();

    /**
     * Reinitialize episodic state from the profile baselines.
     *
     * @return observation for the first actor
     */
    double[] reset();

    /**
     * @throws InvalidStateException     if not ACTIVE
     * @throws OutOfRangeActionException if {@code action} is not a legal index
     */
    StepResult step(int action);

    /** Copy of a participant's current episodic state. */
    EpisodicState snapshot(int participant);
}
