package ai.pipestream.supervisor.health;

/**
 * In-process observer of health transitions.
 * Called while the monitor holds its write lock, so implementations must not block.
 */
@FunctionalInterface
public interface HealthTransitionListener {

    void onHealthChanged(HealthUpdate update);
}
