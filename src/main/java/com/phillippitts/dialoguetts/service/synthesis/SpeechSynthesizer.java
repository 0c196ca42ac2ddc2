package com.phillippitts.dialoguetts.service.synthesis;

import com.phillippitts.dialoguetts.domain.AudioFragment;
import com.phillippitts.dialoguetts.domain.VoiceProfile;
import com.phillippitts.dialoguetts.exception.SynthesisException;

/**
 * Contract for text-to-speech backends.
 * Implementations adapt a concrete engine (an external CLI, a library, a test double) to a
 * single call that turns one chunk of text into PCM audio.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>A handle is obtained from a {@link SpeechSynthesizerFactory}</li>
 *   <li>{@link #synthesize(String, VoiceProfile)} is called any number of times</li>
 *   <li>{@link #close()} releases the handle's resources</li>
 * </ol>
 *
 * <p>Thread Safety: a handle is used by one worker thread at a time. Concurrency comes from
 * independent handles, never from sharing one.
 */
public interface SpeechSynthesizer extends AutoCloseable {

    /**
     * Renders text with the given voice.
     *
     * @param text  non-empty text chunk
     * @param voice voice to render with
     * @return PCM audio for the whole chunk
     * @throws SynthesisException if the engine fails
     */
    AudioFragment synthesize(String text, VoiceProfile voice);

    /**
     * Releases resources held by this handle. Must be idempotent.
     */
    @Override
    void close();
}
