package mirage.ai.env;

import java.util.Collections;
import java.util.Random;

/**
 * One character acting alone against a drifting world: 10 actions,
 * 20-feature observation. Terminates at {@code maxSteps} or when health
 * reaches zero.
 */
public class CharacterEnvironment extends AbstractEnvironment {

    public CharacterEnvironment(CharacterProfile profile, int maxSteps, long seed) {
        this(profile, maxSteps, new Random(seed));
    }

    public CharacterEnvironment(CharacterProfile profile, int maxSteps, Random rng) {
        super(Collections.singletonList(profile), new EpisodicStateEncoder(), ActionCatalog.CHARACTER, maxSteps, rng);
    }

    public CharacterProfile getProfile() {
        return getProfile(0);
    }
}
