/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.dialoguetts.exception.DialogueTtsException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.dialoguetts.exception.ConfigurationException} - Character
 *       configuration is missing, malformed, or has no usable voice (fatal)</li>
 *   <li>{@link com.phillippitts.dialoguetts.exception.SynthesisException} - A chunk or segment
 *       failed to synthesize (isolated to that segment)</li>
 *   <li>{@link com.phillippitts.dialoguetts.exception.SynthesisTimeoutException} - A segment did
 *       not finish within the per-task timeout (isolated to that segment)</li>
 *   <li>{@link com.phillippitts.dialoguetts.exception.FormatMismatchException} - Fragments with
 *       different PCM formats were combined (fatal at assembly)</li>
 *   <li>{@link com.phillippitts.dialoguetts.exception.InvalidAudioException} - WAV bytes from the
 *       synthesis tool could not be decoded (fails the chunk)</li>
 *   <li>{@link com.phillippitts.dialoguetts.exception.DialogueIoException} - Reading input or
 *       writing output failed (fatal)</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining via {@code cause}.
 *
 * @see com.phillippitts.dialoguetts.exception.DialogueTtsException
 * @since 1.0
 */
package com.phillippitts.dialoguetts.exception;
