/**
 * Implementation of the read-only {@link io.zonemaster.api.ClusterAPI}.
 */
package io.zonemaster.master.api;
