/**
 * Boundary between the master and the packet transport it runs on.
 *
 * @see io.zonemaster.api.transport.ControlTransport
 */
package io.zonemaster.api.transport;
