package io.zonemaster.master.instance;

/**
 * Represents the lifecycle status of a world instance.
 */
public enum InstanceStatus {
    /**
     * Instance is registered but its worker has not reported ready.
     * Transfers to it are queued.
     */
    STARTING,

    /**
     * Worker reported ready; transfers go straight to affirmation.
     */
    READY,

    /**
     * Worker was told to shut down and has not confirmed yet.
     * No new transfers are routed to it.
     */
    SHUTTING_DOWN,

    /**
     * Worker confirmed its shutdown. The instance is swept on the next tick.
     */
    SHUTDOWN_COMPLETE;

    /**
     * Check if the instance accepts transfers right away.
     *
     * @return true if ready
     */
    public boolean isReady() {
        return this == READY;
    }

    /**
     * Check if the instance is on its way out.
     *
     * @return true if shutting down or already shut down
     */
    public boolean isShuttingDown() {
        return this == SHUTTING_DOWN || this == SHUTDOWN_COMPLETE;
    }

    /**
     * Check if the instance is in a terminal state.
     *
     * @return true if the worker confirmed its shutdown
     */
    public boolean isTerminal() {
        return this == SHUTDOWN_COMPLETE;
    }
}
