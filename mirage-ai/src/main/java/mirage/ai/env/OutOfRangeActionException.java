package mirage.ai.env;

/**
 * Action index outside the environment's action set. The environment is
 * left untouched.
 */
public class OutOfRangeActionException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int action;
    private final int actionDim;

    public OutOfRangeActionException(int action, int actionDim) {
        super("Action index " + action + " is outside [0, " + actionDim + ")");
        this.action = action;
        this.actionDim = actionDim;
    }

    public int getAction() {
        return action;
    }

    public int getActionDim() {
        return actionDim;
    }
}
