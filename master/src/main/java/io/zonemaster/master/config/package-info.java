/**
 * YAML configuration of the master server.
 */
package io.zonemaster.master.config;
