/**
 * The zone-transfer affirmation handshake and its timeout escalation.
 *
 * @see io.zonemaster.master.affirmation.AffirmationEngine
 */
package io.zonemaster.master.affirmation;
