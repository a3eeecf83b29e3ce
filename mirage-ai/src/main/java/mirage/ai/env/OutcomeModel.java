package mirage.ai.env;

import java.util.Random;

/**
 * Success-probability model and own-state transition rules shared by all
 * environment variants.
 */
public final class OutcomeModel {

    public static final double BASE_PROBABILITY = 0.5;
    public static final double MIN_PROBABILITY = 0.1;
    public static final double MAX_PROBABILITY = 0.9;

    private OutcomeModel() { }

    public static double successProbability(ActionSpec action, CharacterProfile profile, EpisodicState state) {
        double p = BASE_PROBABILITY + action.adjustment(profile, state);
        return EpisodicState.clamp(p, MIN_PROBABILITY, MAX_PROBABILITY);
    }

    /**
     * Draw exactly one uniform from {@code rng} and resolve the action.
     */
    public static Outcome resolve(ActionSpec action, CharacterProfile profile, EpisodicState state, Random rng) {
        double p = successProbability(action, profile, state);
        boolean success = rng.nextDouble() < p;
        double reward = (success ? action.getSuccessReward() : action.getFailureReward())
                + action.rewardBias(profile);
        return new Outcome(action, success, p, reward);
    }

    /**
     * Apply the actor's own consequences: generic success/failure shifts,
     * then the outcome's targeted effects.
     */
    public static void applyToActor(Outcome outcome, EpisodicState state) {
        if (outcome.isSuccess()) {
            state.adjustHappiness(0.1);
            state.adjustReputation(0.05);
            state.adjustStress(-0.05);
            state.adjustEmotion(Emotion.JOY, 0.1);
            state.adjustEmotion(Emotion.FEAR, -0.05);
        } else {
            state.adjustEnergy(-0.1);
            state.adjustHappiness(-0.1);
            state.adjustStress(0.1);
            state.adjustEmotion(Emotion.SADNESS, 0.1);
            state.adjustEmotion(Emotion.JOY, -0.05);
        }
        for (Effect e : outcome.getEffects()) {
            e.apply(state);
        }
    }

    /**
     * One step of the pressure walk. Always draws exactly three uniforms, so
     * the random stream stays aligned across outcomes.
     */
    public static void driftPressures(EpisodicState state, Random rng) {
        for (Pressure p : new Pressure[] {Pressure.THREAT, Pressure.OPPORTUNITY, Pressure.SOCIAL}) {
            double delta = (rng.nextDouble() * 2.0 - 1.0) * Pressure.WALK_STEP;
            state.setPressure(p, state.pressure(p) + delta);
        }
        state.setPressure(Pressure.TIME, state.pressure(Pressure.TIME) + Pressure.TIME_INCREMENT);
    }
}
