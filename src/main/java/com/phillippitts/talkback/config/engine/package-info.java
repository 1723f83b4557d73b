/**
 * Inference engine configuration: endpoint properties, HTTP clients and startup validation.
 */
package com.phillippitts.talkback.config.engine;
