package mirage.ai.env;

import java.util.Arrays;
import java.util.Random;

/**
 * Adversarial arena: two characters alternate among 5 actions, observing
 * the 18-feature profile encoding. Ends at {@code maxSteps} or when either
 * side's health reaches zero. Partner state changes follow {@link DuelCoupling}.
 */
public class DuelEnvironment extends AbstractEnvironment {

    private final Coupling coupling = new DuelCoupling();

    public DuelEnvironment(CharacterProfile first, CharacterProfile second, int maxSteps, long seed) {
        this(first, second, maxSteps, new Random(seed));
    }

    public DuelEnvironment(CharacterProfile first, CharacterProfile second, int maxSteps, Random rng) {
        super(Arrays.asList(first, second), new ProfileStateEncoder(), ActionCatalog.DUEL, maxSteps, rng);
    }

    @Override
    protected Coupling coupling() {
        return coupling;
    }
}
