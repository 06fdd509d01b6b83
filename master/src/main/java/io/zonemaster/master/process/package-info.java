/**
 * Native worker processes: world instances, the chat service and the
 * authentication service.
 *
 * @see io.zonemaster.master.process.WorkerLauncher
 * @see io.zonemaster.master.process.ProcessManager
 */
package io.zonemaster.master.process;
