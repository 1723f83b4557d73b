/**
 * Session orchestration: the pipeline lifecycle state machine, the runner that owns one
 * session's stages, the transport seam, and the factory that wires a session per connection.
 */
package com.phillippitts.talkback.service.pipeline;
