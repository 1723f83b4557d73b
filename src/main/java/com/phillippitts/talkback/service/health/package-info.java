/**
 * Actuator health contributions.
 */
package com.phillippitts.talkback.service.health;
