/**
 * Application configuration: Spring-bound defaults and the per-run configuration document.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.dialoguetts.config.SynthesisExecutorFactory} - Per-run synthesis
 *       thread pool with ThreadContext propagation</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code @ConfigurationProperties} bound from
 *       {@code application.properties} (engine, orchestration, thread pool)</li>
 *   <li>{@code config.run} - JSON character configuration loaded for each run</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.dialoguetts.config;
