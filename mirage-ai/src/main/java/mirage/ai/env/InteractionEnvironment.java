package mirage.ai.env;

import java.util.Arrays;
import java.util.Random;

/**
 * Two characters taking turns, 12 actions, 20-feature observations.
 * Prosocial actions are rewarded according to how the partner tends to
 * respond: x1.2 with an agreeable partner (A above 0.6), x0.8 with a
 * disagreeable one (A below 0.3). Partner state changes follow
 * {@link InteractionCoupling}.
 */
public class InteractionEnvironment extends AbstractEnvironment {

    public static final double WARM_PARTNER = 0.6;
    public static final double COLD_PARTNER = 0.3;

    private final Coupling coupling = new InteractionCoupling();

    public InteractionEnvironment(CharacterProfile first, CharacterProfile second, int maxSteps, long seed) {
        this(first, second, maxSteps, new Random(seed));
    }

    public InteractionEnvironment(CharacterProfile first, CharacterProfile second, int maxSteps, Random rng) {
        super(Arrays.asList(first, second), new EpisodicStateEncoder(), ActionCatalog.INTERACTION, maxSteps, rng);
    }

    @Override
    protected Coupling coupling() {
        return coupling;
    }

    @Override
    protected Outcome adjustOutcome(int actor, Outcome outcome) {
        if (!outcome.getAction().isProsocial()) {
            return outcome;
        }
        double partnerA = getProfile(1 - actor).agreeableness();
        if (partnerA > WARM_PARTNER) {
            return outcome.withReward(outcome.getReward() * 1.2);
        }
        if (partnerA < COLD_PARTNER) {
            return outcome.withReward(outcome.getReward() * 0.8);
        }
        return outcome;
    }
}
