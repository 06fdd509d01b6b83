/**
 * The master's main loop and its shutdown sequence.
 */
package io.zonemaster.master.tick;
