/**
 * PCM audio handling: WAV decoding and encoding, and assembly of per-segment audio into the
 * final track.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@link com.phillippitts.dialoguetts.service.audio.AudioAssembler} - Ordered
 *       concatenation with speaker-change pauses</li>
 *   <li>{@link com.phillippitts.dialoguetts.service.audio.WavReader} - Chunk-walking PCM WAV
 *       decoder</li>
 *   <li>{@link com.phillippitts.dialoguetts.service.audio.WavWriter} - Canonical PCM WAV
 *       encoder</li>
 * </ul>
 */
package com.phillippitts.dialoguetts.service.audio;
