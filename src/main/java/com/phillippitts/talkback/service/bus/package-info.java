/**
 * The per-session frame bus: stages, their serial lanes, and the emitter they write to.
 */
package com.phillippitts.talkback.service.bus;
