/**
 * Storage collaborators consumed by the master: the persistent object id
 * allocator and the storage keep-alive.
 */
package io.zonemaster.api.storage;
