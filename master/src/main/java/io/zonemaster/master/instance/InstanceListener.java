package io.zonemaster.master.instance;

import javax.annotation.Nonnull;

/**
 * Callback invoked by the {@link InstanceRegistry} before an instance leaves it.
 *
 * <p>On {@link InstanceRegistry#remove(Instance)} the instance is still
 * registered while the callback runs, so any work it held can be moved to
 * another instance first. A stale instance discarded by an announcement has
 * already given up its port and identity to the announced instance.</p>
 */
@FunctionalInterface
public interface InstanceListener {

    /**
     * Called before the instance leaves the registry for good.
     *
     * @param instance the instance being removed
     */
    void onInstanceRemoving(@Nonnull Instance instance);
}
