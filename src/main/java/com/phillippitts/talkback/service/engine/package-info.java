/**
 * Shared plumbing for inference engines: the cancellation token, the blocking stream adapter
 * over reactive HTTP responses, and engine health tracking.
 */
package com.phillippitts.talkback.service.engine;
