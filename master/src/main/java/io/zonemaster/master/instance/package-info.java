/**
 * World instances and the registry that owns them.
 *
 * <p>This package tracks every running world worker, its transfer queues and
 * its player count, and guarantees that ports and instance identities stay
 * unique among live instances.</p>
 *
 * @see io.zonemaster.master.instance.Instance
 * @see io.zonemaster.master.instance.InstanceRegistry
 */
package io.zonemaster.master.instance;
