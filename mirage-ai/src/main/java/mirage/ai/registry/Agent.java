package mirage.ai.registry;

import java.util.Random;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import mirage.ai.nn.ActionChoice;
import mirage.ai.nn.ActorCriticNetwork;
import mirage.ai.nn.AdamOptimizer;
import mirage.ai.nn.Evaluation;

/**
 * One character's policy network plus its optimizer state.
 *
 * <p>Inference ({@link #selectAction}, {@link #evaluate}) takes the read lock
 * and may run concurrently. Parameter updates go through {@link #update},
 * which holds the write lock for their whole duration, so readers and
 * snapshots only ever see committed parameters.
 */
public final class Agent {
    private final String key;
    private final ActorCriticNetwork network;
    private final AdamOptimizer optimizer;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean unstable;

    public Agent(String key, ActorCriticNetwork network, AdamOptimizer optimizer) {
        this.key = key;
        this.network = network;
        this.optimizer = optimizer;
    }

    public String getKey() {
        return key;
    }

    public int getStateDim() {
        return network.getStateDim();
    }

    public int getActionDim() {
        return network.getActionDim();
    }

    public ActionChoice selectAction(double[] state, boolean deterministic, Random rng) {
        lock.readLock().lock();
        try {
            return network.selectAction(state, deterministic, rng);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Evaluation evaluate(double[] state) {
        lock.readLock().lock();
        try {
            return network.forward(state);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Run {@code body} with exclusive access to the network and optimizer.
     */
    public <T> T update(UpdateBody<T> body) {
        lock.writeLock().lock();
        try {
            return body.apply(network, optimizer);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Point-in-time copy of parameters and optimizer state.
     */
    public AgentSnapshot snapshot() {
        AgentSnapshot s = read(() -> AgentSnapshot.of(network, optimizer));
        s.key = key;
        return s;
    }

    private <T> T read(Supplier<T> body) {
        lock.readLock().lock();
        try {
            return body.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Set when an update step was skipped for non-finite values. */
    public boolean isUnstable() {
        return unstable;
    }

    public void markUnstable() {
        unstable = true;
    }

    public void clearUnstable() {
        unstable = false;
    }

    public long getUpdateCount() {
        return read(optimizer::getStepCount);
    }

    @Override
    public String toString() {
        return "Agent{" + key + ", dims=" + getStateDim() + "x" + getActionDim()
                + (unstable ? ", unstable" : "") + "}";
    }

    @FunctionalInterface
    public interface UpdateBody<T> {
        T apply(ActorCriticNetwork network, AdamOptimizer optimizer);
    }
}
