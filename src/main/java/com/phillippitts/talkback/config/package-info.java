/**
 * Spring configuration: executors, typed properties and engine clients.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - pipeline, thread pool and bot properties</li>
 *   <li>{@code config.engine} - per-engine endpoint settings and their WebClients</li>
 * </ul>
 */
package com.phillippitts.talkback.config;
