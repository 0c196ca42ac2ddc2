/**
 * Concurrent synthesis of dialogue segments.
 *
 * <p>{@link com.phillippitts.dialoguetts.service.orchestration.SynthesisOrchestrator} splits
 * segments into chunk tasks, fans them out to worker loops over a shared queue and fans results
 * back in over a completion queue.
 *
 * <p>Design Patterns:
 * <ul>
 *   <li><b>Worker-owned handles:</b> every worker loop opens its own synthesizer, so no handle is
 *       shared between threads</li>
 *   <li><b>Failure isolation:</b> chunk errors and timeouts are captured as
 *       {@link com.phillippitts.dialoguetts.service.orchestration.SegmentResult}s instead of
 *       propagating</li>
 *   <li><b>Deterministic order:</b> results are sorted by segment index, never by completion
 *       time</li>
 * </ul>
 *
 * @see com.phillippitts.dialoguetts.service.synthesis
 * @since 1.0
 */
package com.phillippitts.dialoguetts.service.orchestration;
