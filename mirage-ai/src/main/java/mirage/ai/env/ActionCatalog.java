package mirage.ai.env;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Fixed action sets of the environment variants. The index of an action in
 * its catalog is the policy's action index.
 */
public final class ActionCatalog {

    private static final double PROSOCIAL_BIAS = 0.5;

    /** Solo character environment, 10 actions. */
    public static final ActionCatalog CHARACTER = new ActionCatalog("character", ImmutableList.of(
            ActionSpec.builder("cooperate")
                    .odds((p, s) -> 0.2 * p.agreeableness() - 0.1 * p.neuroticism()
                            + (s.pressure(Pressure.OPPORTUNITY) > 0.5 ? 0.1 : -0.1))
                    .success("built a working partnership", 1.5, Effect.BOND)
                    .failure("cooperation was rebuffed", -0.5)
                    .bias(p -> (p.agreeableness() - 0.5) * PROSOCIAL_BIAS)
                    .prosocial()
                    .build(),
            ActionSpec.builder("compete")
                    .odds((p, s) -> 0.2 * p.conscientiousness() - 0.1 * p.agreeableness()
                            - (s.pressure(Pressure.THREAT) > 0.5 ? 0.1 : 0.0))
                    .success("won the contest", 2.0)
                    .failure("lost the contest", -1.0)
                    .bias(p -> ((1 - p.agreeableness()) - 0.5) * PROSOCIAL_BIAS)
                    .build(),
            ActionSpec.builder("venture")
                    .odds((p, s) -> 0.3 * p.openness() - 0.2 * p.conscientiousness()
                            + (s.pressure(Pressure.OPPORTUNITY) > 0.7 ? 0.2 : -0.1))
                    .success("the venture paid off", 2.5, Effect.WINDFALL)
                    .failure("the venture failed with heavy losses", -2.0, Effect.LOSS)
                    .bias(p -> (p.openness() - 0.5) * PROSOCIAL_BIAS)
                    .build(),
            ActionSpec.builder("conserve")
                    .odds((p, s) -> 0.2 * p.conscientiousness() - 0.1 * p.openness()
                            + (s.pressure(Pressure.THREAT) > 0.5 ? 0.1 : -0.1))
                    .success("played it safe and avoided risk", 0.5)
                    .failure("too cautious, missed the opportunity", -0.5)
                    .build(),
            ActionSpec.builder("persuade")
                    .odds((p, s) -> 0.3 * p.extraversion() + 0.1 * p.agreeableness())
                    .success("talked the other side around", 1.0)
                    .failure("failed to persuade", -0.5)
                    .build(),
            ActionSpec.builder("threaten")
                    .odds((p, s) -> 0.2 * (1 - p.agreeableness()) - 0.1 * p.extraversion())
                    .success("the threat worked and the other side gave in", 1.0)
                    .failure("the threat backfired and relations soured", -1.5)
                    .build(),
            ActionSpec.builder("evade")
                    .odds((p, s) -> 0.3 * p.neuroticism() - 0.1 * p.conscientiousness()
                            + (s.pressure(Pressure.THREAT) > 0.7 ? 0.2 : 0.0))
                    .success("slipped away from danger", 0.5, Effect.DANGER)
                    .failure("could not escape and had to face it", -1.0)
                    .build(),
            ActionSpec.builder("confront")
                    .odds((p, s) -> 0.2 * (1 - p.agreeableness()) + 0.1 * p.conscientiousness())
                    .success("defeated the opponent", 1.5)
                    .failure("the confrontation failed and drew a counterblow", -1.5, Effect.CONFLICT)
                    .build(),
            ActionSpec.builder("yield")
                    .odds((p, s) -> 0.3 * p.agreeableness())
                    .success("giving way earned respect", 0.5)
                    .failure("giving way was read as weakness", -0.5)
                    .bias(p -> (p.agreeableness() - 0.5) * PROSOCIAL_BIAS)
                    .build(),
            ActionSpec.builder("stand_firm")
                    .odds((p, s) -> 0.2 * (1 - p.agreeableness()) + 0.1 * p.neuroticism())
                    .success("the firm stance got results", 1.0)
                    .failure("the firm stance sparked open conflict", -1.0, Effect.CONFLICT)
                    .bias(p -> ((1 - p.agreeableness()) - 0.5) * PROSOCIAL_BIAS)
                    .build()));

    /** Two characters taking turns, 12 actions. */
    public static final ActionCatalog INTERACTION = new ActionCatalog("interaction", ImmutableList.of(
            CHARACTER.get(0),
            CHARACTER.get(1),
            ActionSpec.builder("compromise")
                    .odds((p, s) -> 0.2 * p.agreeableness() + 0.1 * p.conscientiousness() - 0.05 * p.neuroticism())
                    .success("met halfway", 0.8)
                    .failure("the compromise satisfied no one", -0.3)
                    .build(),
            ActionSpec.builder("avoid")
                    .odds((p, s) -> 0.2 * p.neuroticism() - 0.1 * p.extraversion()
                            + (s.pressure(Pressure.THREAT) > 0.5 ? 0.1 : 0.0))
                    .success("kept out of the way", 0.3)
                    .failure("avoidance only delayed the problem", -0.5)
                    .build(),
            ActionSpec.builder("share")
                    .odds((p, s) -> 0.2 * p.agreeableness() + 0.1 * p.openness())
                    .success("sharing was welcomed", 1.0)
                    .failure("the offer was ignored", -0.5)
                    .prosocial()
                    .build(),
            ActionSpec.builder("withhold")
                    .odds((p, s) -> 0.2 * p.conscientiousness() - 0.1 * p.agreeableness())
                    .success("kept the advantage", 0.5)
                    .failure("holding back looked petty", -0.5)
                    .build(),
            ActionSpec.builder("attack")
                    .odds((p, s) -> 0.2 * (1 - p.agreeableness()) + 0.1 * p.extraversion()
                            - (s.pressure(Pressure.THREAT) > 0.5 ? 0.1 : 0.0))
                    .success("the attack landed", 1.5)
                    .failure("the attack was repelled with a counterblow", -1.5, Effect.CONFLICT)
                    .build(),
            ActionSpec.builder("defend")
                    .odds((p, s) -> 0.2 * p.conscientiousness() + 0.1 * p.neuroticism()
                            + (s.pressure(Pressure.THREAT) > 0.5 ? 0.1 : 0.0))
                    .success("held the line", 0.8)
                    .failure("the defence crumbled", -0.8)
                    .build(),
            CHARACTER.get(4),
            ActionSpec.builder("refuse")
                    .odds((p, s) -> 0.2 * (1 - p.agreeableness()) + 0.1 * p.conscientiousness())
                    .success("the refusal stood", 0.5)
                    .failure("the refusal sparked open conflict", -0.8, Effect.CONFLICT)
                    .build(),
            ActionSpec.builder("help")
                    .odds((p, s) -> 0.3 * p.agreeableness() + 0.05 * p.extraversion())
                    .success("the help made a difference", 1.0, Effect.BOND)
                    .failure("the help was not wanted", -0.3)
                    .prosocial()
                    .build(),
            ActionSpec.builder("ignore")
                    .odds((p, s) -> 0.1 * (1 - p.extraversion()))
                    .success("let it pass", 0.2)
                    .failure("ignoring it made things worse", -0.5)
                    .build()));

    /** Adversarial duel, 5 actions. */
    public static final ActionCatalog DUEL = new ActionCatalog("duel", ImmutableList.of(
            ActionSpec.builder("compromise")
                    .odds((p, s) -> 0.2 * p.agreeableness() + 0.1 * p.conscientiousness())
                    .success("offered terms that were accepted", 0.8)
                    .failure("the offer of terms was spurned", -0.5)
                    .build(),
            ActionSpec.builder("clash")
                    .odds((p, s) -> 0.2 * (1 - p.agreeableness()) + 0.1 * p.extraversion() - 0.1 * p.neuroticism())
                    .success("struck the opponent hard", 1.5)
                    .failure("the clash went badly and drew a counterblow", -1.5, Effect.CONFLICT)
                    .build(),
            ActionSpec.builder("cold_shoulder")
                    .odds((p, s) -> 0.2 * p.conscientiousness() - 0.1 * p.extraversion())
                    .success("the silence unsettled the opponent", 0.5)
                    .failure("the silence was shrugged off", -0.5)
                    .build(),
            ActionSpec.builder("threaten")
                    .odds((p, s) -> 0.2 * (1 - p.agreeableness()) + 0.1 * p.conscientiousness())
                    .success("the threat shook the opponent", 1.0)
                    .failure("the threat provoked open conflict", -1.0, Effect.CONFLICT)
                    .build(),
            ActionSpec.builder("plead")
                    .odds((p, s) -> 0.2 * p.extraversion() + 0.1 * p.neuroticism())
                    .success("the plea won sympathy", 0.6)
                    .failure("the plea fell on deaf ears", -0.8)
                    .build()));

    private final String name;
    private final ImmutableList<ActionSpec> actions;

    private ActionCatalog(String name, ImmutableList<ActionSpec> actions) {
        this.name = name;
        this.actions = actions;
    }

    public String getName() {
        return name;
    }

    public int size() {
        return actions.size();
    }

    public ActionSpec get(int index) {
        return actions.get(index);
    }

    public List<ActionSpec> getActions() {
        return actions;
    }

    /** Index of the action with the given label, or -1. */
    public int indexOf(String label) {
        for (int i = 0; i < actions.size(); i++) {
            if (actions.get(i).getLabel().equalsIgnoreCase(label)) {
                return i;
            }
        }
        return -1;
    }

    public String[] labels() {
        String[] out = new String[actions.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = actions.get(i).getLabel();
        }
        return out;
    }
}
