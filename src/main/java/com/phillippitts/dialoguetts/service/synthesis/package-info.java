/**
 * Speech synthesis abstraction.
 *
 * <p>{@link com.phillippitts.dialoguetts.service.synthesis.SpeechSynthesizer} is the seam to the
 * external engine; the production adapter in {@code synthesis.process} runs the PaddleSpeech
 * CLI as a subprocess.
 */
package com.phillippitts.dialoguetts.service.synthesis;
