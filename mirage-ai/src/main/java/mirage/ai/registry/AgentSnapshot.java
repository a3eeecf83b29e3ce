package mirage.ai.registry;

import mirage.ai.config.ConfigurationException;
import mirage.ai.nn.ActorCriticNetwork;
import mirage.ai.nn.AdamOptimizer;

/**
 * Persisted form of an agent: the network layout, its flat parameters and
 * the optimizer state. Field names are the on-disk JSON keys.
 */
public class AgentSnapshot {
    public String key;
    public int stateDim;
    public int actionDim;
    public int hiddenDim;
    public double probabilityFloor;
    public double[] policy;
    public AdamOptimizer.State optimizer;

    static AgentSnapshot of(ActorCriticNetwork network, AdamOptimizer optimizer) {
        AgentSnapshot s = new AgentSnapshot();
        s.stateDim = network.getStateDim();
        s.actionDim = network.getActionDim();
        s.hiddenDim = network.getHiddenDim();
        s.probabilityFloor = network.getProbabilityFloor();
        s.policy = network.copyParameters();
        s.optimizer = optimizer.snapshot();
        return s;
    }

    /**
     * Rebuild a live agent. A blob whose arrays do not fit its declared
     * layout is a configuration error.
     */
    public Agent toAgent(String key) {
        if (policy == null || optimizer == null) {
            throw new ConfigurationException("stored agent '" + key + "' is missing policy or optimizer state");
        }
        int expected = ActorCriticNetwork.parameterCount(stateDim, hiddenDim, actionDim);
        if (policy.length != expected || optimizer.m == null || optimizer.m.length != expected) {
            throw new ConfigurationException("stored agent '" + key + "' has " + policy.length
                    + " parameters, layout " + stateDim + "x" + hiddenDim + "x" + actionDim
                    + " needs " + expected);
        }
        ActorCriticNetwork network = ActorCriticNetwork.fromParameters(stateDim, hiddenDim, actionDim,
                probabilityFloor, policy);
        return new Agent(key, network, AdamOptimizer.restore(optimizer));
    }
}
