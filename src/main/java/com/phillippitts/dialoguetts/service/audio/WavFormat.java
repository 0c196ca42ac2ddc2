package com.phillippitts.dialoguetts.service.audio;

/**
 * Structural constants of the RIFF/WAVE container, shared by {@link WavReader} and
 * {@link WavWriter}.
 *
 * <p><b>Canonical layout written by {@link WavWriter}:</b>
 * <pre>
 * ┌─────────────────────────────────────┐
 * │ RIFF Header (12 bytes)              │  RIFF_HEADER_SIZE
 * ├─────────────────────────────────────┤
 * │ fmt chunk:                          │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - Chunk Data (16 bytes)           │  FMT_CHUNK_MIN_SIZE
 * ├─────────────────────────────────────┤
 * │ data chunk:                         │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - PCM Audio Data (variable)       │
 * └─────────────────────────────────────┘
 * </pre>
 * Files produced by other tools may carry extra chunks (LIST, fact) or an extended fmt chunk;
 * {@link WavReader} skips those.
 */
public final class WavFormat {

    /** "RIFF" + size + "WAVE". */
    public static final int RIFF_HEADER_SIZE = 12;

    /** Chunk ID + chunk size. */
    public static final int CHUNK_HEADER_SIZE = 8;

    /** Minimum PCM fmt chunk payload. */
    public static final int FMT_CHUNK_MIN_SIZE = 16;

    /** Total header size of a canonical PCM file. */
    public static final int CANONICAL_HEADER_SIZE =
            RIFF_HEADER_SIZE + CHUNK_HEADER_SIZE + FMT_CHUNK_MIN_SIZE + CHUNK_HEADER_SIZE;

    /** fmt audio format code for uncompressed PCM. */
    public static final int AUDIO_FORMAT_PCM = 1;

    /** fmt audio format code for WAVE_FORMAT_EXTENSIBLE; accepted when the sub-format is PCM. */
    public static final int AUDIO_FORMAT_EXTENSIBLE = 0xFFFE;

    private WavFormat() {
        // Utility class - prevent instantiation
    }
}
