/**
 * Master server of a world-zone game cluster.
 *
 * <p>The master tracks every running world instance, brokers zone transfers
 * between workers, hands out persistent object ids, keeps one session key
 * per account and shuts the whole cluster down in order.</p>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link io.zonemaster.master.MasterServer} - Wiring and lifecycle</li>
 *   <li>{@link io.zonemaster.master.instance.InstanceRegistry} - Live world instances</li>
 *   <li>{@link io.zonemaster.master.affirmation.AffirmationEngine} - Zone transfer handshake</li>
 *   <li>{@link io.zonemaster.master.protocol.ControlDispatcher} - Control protocol</li>
 *   <li>{@link io.zonemaster.master.tick.ClusterTickLoop} - Main loop and teardown</li>
 *   <li>{@link io.zonemaster.master.process.ProcessManager} - Worker processes</li>
 * </ul>
 *
 * @see io.zonemaster.master.MasterServer
 */
package io.zonemaster.master;
