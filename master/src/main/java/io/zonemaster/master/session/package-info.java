/**
 * Single-session-per-account key registry.
 */
package io.zonemaster.master.session;
