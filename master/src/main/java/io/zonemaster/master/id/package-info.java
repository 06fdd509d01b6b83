/**
 * Persistent object id allocation.
 *
 * @see io.zonemaster.master.id.FileObjectIdAllocator
 */
package io.zonemaster.master.id;
