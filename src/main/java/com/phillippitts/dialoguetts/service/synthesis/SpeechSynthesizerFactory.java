package com.phillippitts.dialoguetts.service.synthesis;

/**
 * Creates independent {@link SpeechSynthesizer} handles, one per worker loop.
 */
@FunctionalInterface
public interface SpeechSynthesizerFactory {

    /**
     * @return a new handle owned by the caller
     * @throws com.phillippitts.dialoguetts.exception.SynthesisException if the engine cannot be opened
     */
    SpeechSynthesizer create();
}
