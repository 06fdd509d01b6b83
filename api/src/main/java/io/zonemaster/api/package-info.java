/**
 * Public API of the Zonemaster cluster master.
 *
 * <p>Provides the read-only cluster view for embedders, and in the
 * sub-packages the collaborator contracts the master consumes: the packet
 * transport and the storage services.</p>
 *
 * @see io.zonemaster.api.ClusterAPI
 */
package io.zonemaster.api;
