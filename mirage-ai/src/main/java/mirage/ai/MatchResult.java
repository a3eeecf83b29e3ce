package mirage.ai;

import java.util.List;

import mirage.ai.env.EpisodicState;
import mirage.ai.env.StepResult;
import mirage.ai.training.MatchRunner;
import mirage.ai.training.RelationshipChange;
import mirage.ai.training.Verdict;

/**
 * Outcome of an interaction or a duel between two characters.
 */
public final class MatchResult {

    public enum Kind { INTERACTION, DUEL }

    private final Kind kind;
    private final String[] keys;
    private final MatchRunner.Match match;
    private final EpisodicState[] finalStates;

    MatchResult(Kind kind, String firstKey, String secondKey, MatchRunner.Match match,
                EpisodicState firstState, EpisodicState secondState) {
        this.kind = kind;
        this.keys = new String[] {firstKey, secondKey};
        this.match = match;
        this.finalStates = new EpisodicState[] {firstState, secondState};
    }

    public Kind getKind() { return kind; }
    public String getKey(int participant) { return keys[participant]; }
    public List<StepResult> getLog(int participant) { return match.getLog(participant); }
    public double getTotal(int participant) { return match.getTotal(participant); }
    public EpisodicState getFinalState(int participant) { return finalStates[participant]; }
    public int getTurns() { return match.getTurns(); }
    public Verdict getVerdict() { return match.getVerdict(); }
    public RelationshipChange getRelationshipChange() { return match.getRelationshipChange(); }

    /** Index of the winning participant, or -1 on a tie. */
    public int getWinner() {
        return match.getWinner();
    }
}
