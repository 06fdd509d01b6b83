package io.zonemaster.master.support;

import io.zonemaster.master.instance.Instance;
import io.zonemaster.master.process.WorkerLauncher;

import java.util.ArrayList;
import java.util.List;

/**
 * Worker launcher that only records what it was asked to do.
 */
public final class RecordingLauncher implements WorkerLauncher {

    private final List<Instance> launchedWorlds = new ArrayList<>();
    private final List<Instance> released = new ArrayList<>();
    private int chatLaunches;
    private int authLaunches;

    @Override
    public void launchWorld(Instance instance) {
        launchedWorlds.add(instance);
    }

    @Override
    public void launchChat() {
        chatLaunches++;
    }

    @Override
    public void launchAuth() {
        authLaunches++;
    }

    @Override
    public void release(Instance instance) {
        released.add(instance);
    }

    public List<Instance> launchedWorlds() {
        return launchedWorlds;
    }

    public List<Instance> released() {
        return released;
    }

    public int chatLaunches() {
        return chatLaunches;
    }

    public int authLaunches() {
        return authLaunches;
    }
}
