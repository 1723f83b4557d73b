/**
 * Bot personalities: system prompts loaded from text files.
 */
package com.phillippitts.talkback.service.bot;
