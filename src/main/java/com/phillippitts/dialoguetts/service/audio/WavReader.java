package com.phillippitts.dialoguetts.service.audio;

import com.phillippitts.dialoguetts.domain.AudioFragment;
import com.phillippitts.dialoguetts.domain.PcmFormat;
import com.phillippitts.dialoguetts.exception.DialogueIoException;
import com.phillippitts.dialoguetts.exception.InvalidAudioException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * Decodes PCM WAV files into {@link AudioFragment}s.
 *
 * <p>Walks the chunk list to locate fmt and data, so files with additional chunks or an
 * extended fmt chunk are accepted. Only integer PCM is supported.
 */
public final class WavReader {

    private WavReader() {}

    /**
     * Reads a WAV file.
     *
     * @throws DialogueIoException   if the file cannot be read
     * @throws InvalidAudioException if the content is not decodable PCM WAV
     */
    public static AudioFragment read(Path wavPath) {
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(wavPath);
        } catch (IOException e) {
            throw new DialogueIoException("Failed to read WAV file", wavPath, e);
        }
        return decode(bytes);
    }

    /**
     * Decodes WAV bytes.
     *
     * @throws InvalidAudioException if the content is not decodable PCM WAV
     */
    public static AudioFragment decode(byte[] wav) {
        Objects.requireNonNull(wav, "wav must not be null");
        if (!isWav(wav)) {
            throw new InvalidAudioException("missing RIFF/WAVE header (" + wav.length + " bytes)");
        }

        PcmFormat format = null;
        int offset = WavFormat.RIFF_HEADER_SIZE;
        while (offset + WavFormat.CHUNK_HEADER_SIZE <= wav.length) {
            String chunkId = readChunkId(wav, offset);
            int chunkSize = readLEInt(wav, offset + 4);
            int body = offset + WavFormat.CHUNK_HEADER_SIZE;

            if ("fmt ".equals(chunkId)) {
                requireInBounds(wav, chunkSize, body, chunkId);
                format = parseFmt(wav, body, chunkSize);
            } else if ("data".equals(chunkId)) {
                if (format == null) {
                    throw new InvalidAudioException("data chunk precedes fmt chunk");
                }
                // Streaming writers may leave the size as 0 or 0xFFFFFFFF; take what is there
                int available = wav.length - body;
                int size = chunkSize <= 0 || chunkSize > available ? available : chunkSize;
                size -= size % format.blockAlign();
                return new AudioFragment(Arrays.copyOfRange(wav, body, body + size), format);
            } else {
                requireInBounds(wav, chunkSize, body, chunkId);
            }

            long next = (long) body + chunkSize + (chunkSize % 2);
            if (next > wav.length) {
                break;
            }
            offset = (int) next;
        }
        throw new InvalidAudioException(format == null ? "missing fmt chunk" : "missing data chunk");
    }

    private static PcmFormat parseFmt(byte[] wav, int offset, int size) {
        if (size < WavFormat.FMT_CHUNK_MIN_SIZE) {
            throw new InvalidAudioException("fmt chunk too small: " + size + " bytes");
        }
        int audioFormat = readLEShort(wav, offset);
        int channels = readLEShort(wav, offset + 2);
        int sampleRate = readLEInt(wav, offset + 4);
        int bitsPerSample = readLEShort(wav, offset + 14);

        if (audioFormat != WavFormat.AUDIO_FORMAT_PCM && audioFormat != WavFormat.AUDIO_FORMAT_EXTENSIBLE) {
            throw new InvalidAudioException("unsupported audio format " + audioFormat + " (PCM only)");
        }
        try {
            return new PcmFormat(sampleRate, channels, bitsPerSample);
        } catch (IllegalArgumentException e) {
            throw new InvalidAudioException(e.getMessage());
        }
    }

    private static boolean isWav(byte[] a) {
        return a.length >= WavFormat.RIFF_HEADER_SIZE
                && a[0] == 'R' && a[1] == 'I' && a[2] == 'F' && a[3] == 'F'
                && a[8] == 'W' && a[9] == 'A' && a[10] == 'V' && a[11] == 'E';
    }

    private static void requireInBounds(byte[] wav, int chunkSize, int body, String chunkId) {
        if (chunkSize < 0 || chunkSize > wav.length - body) {
            throw new InvalidAudioException("invalid size " + chunkSize + " for chunk '" + chunkId + "'");
        }
    }

    private static String readChunkId(byte[] wav, int offset) {
        return new String(wav, offset, 4, StandardCharsets.US_ASCII);
    }

    private static int readLEShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    private static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
             | ((a[off + 1] & 0xFF) << 8)
             | ((a[off + 2] & 0xFF) << 16)
             | ((a[off + 3] & 0xFF) << 24);
    }
}
