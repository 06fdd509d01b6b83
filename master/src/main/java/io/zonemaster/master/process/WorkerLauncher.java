package io.zonemaster.master.process;

import io.zonemaster.master.instance.Instance;

import javax.annotation.Nonnull;

/**
 * Starts and releases the worker processes the master depends on.
 *
 * <p>Launching is best effort: a failure is logged by the implementation and
 * the affected instance simply never reports ready.</p>
 */
public interface WorkerLauncher {

    /**
     * Start the world worker that will serve an instance.
     *
     * @param instance the freshly registered instance
     */
    void launchWorld(@Nonnull Instance instance);

    /**
     * Start (or restart) the chat service worker.
     */
    void launchChat();

    /**
     * Start the authentication worker.
     */
    void launchAuth();

    /**
     * Let go of the process behind an instance that left the registry.
     *
     * <p>Must not block the caller.</p>
     *
     * @param instance the removed instance
     */
    void release(@Nonnull Instance instance);
}
