package mirage.ai.env;

/**
 * Deterministic mapping from profile + episodic state to a fixed-length
 * feature vector. Must not mutate its inputs.
 */
public interface StateEncoder {

    int dimension();

    double[] encode(CharacterProfile profile, EpisodicState state);
}
