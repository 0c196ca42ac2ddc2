package com.phillippitts.dialoguetts.domain;

/**
 * Format descriptor for signed little-endian PCM audio.
 *
 * @param sampleRate    frames per second (Hz)
 * @param channels      number of interleaved channels
 * @param bitsPerSample bit depth of one sample (multiple of 8)
 */
public record PcmFormat(int sampleRate, int channels, int bitsPerSample) {

    /** Default output of the PaddleSpeech AISHELL-3 voices: 24 kHz, mono, 16-bit. */
    public static final PcmFormat PADDLESPEECH_DEFAULT = new PcmFormat(24_000, 1, 16);

    public PcmFormat {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive, got: " + channels);
        }
        if (bitsPerSample <= 0 || bitsPerSample % 8 != 0) {
            throw new IllegalArgumentException("bitsPerSample must be a positive multiple of 8, got: "
                    + bitsPerSample);
        }
    }

    /** Bytes per frame (one sample for every channel). */
    public int blockAlign() {
        return (bitsPerSample / 8) * channels;
    }

    /** Bytes per second of audio. */
    public int byteRate() {
        return sampleRate * blockAlign();
    }

    @Override
    public String toString() {
        return sampleRate + "Hz/" + channels + "ch/" + bitsPerSample + "bit";
    }
}
