package mirage.ai.env;

import org.apache.commons.lang3.tuple.Pair;

/**
 * How one participant's action changes the other participant's state in a
 * two-party environment. Implementations never mutate their arguments; they
 * return updated copies of both states (actor left, partner right).
 */
@FunctionalInterface
public interface Coupling {

    Pair<EpisodicState, EpisodicState> apply(Outcome outcome, EpisodicState actor, EpisodicState partner);
}
