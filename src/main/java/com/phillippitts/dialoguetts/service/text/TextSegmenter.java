package com.phillippitts.dialoguetts.service.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into length-bounded chunks suitable for one synthesis call each.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Collapse whitespace runs to one space and trim</li>
 *   <li>Split into sentences after terminal punctuation ({@code 。！？!?.}), keeping the
 *       terminator on its sentence</li>
 *   <li>Greedily pack sentences into chunks of at most {@code maxLength} characters</li>
 *   <li>A sentence longer than {@code maxLength} is split after clause punctuation
 *       ({@code ，,；;}) and its clauses packed the same way; a clause that is still too long
 *       is cut into fixed-width slices</li>
 * </ol>
 *
 * <p>Pieces packed into one chunk are joined with a single space only where the normalized
 * input had whitespace between them, so no characters are invented or lost. Output is
 * deterministic: the same input always yields the same chunks.
 *
 * <p>Lengths are counted in code points, and slices never separate a surrogate pair.
 */
public final class TextSegmenter {

    private static final String SENTENCE_TERMINATORS = "。！？!?.";
    private static final String CLAUSE_DELIMITERS = "，,；;";

    private TextSegmenter() {}

    /**
     * Segments text into chunks of at most {@code maxLength} characters.
     *
     * @param text      raw text (may be null)
     * @param maxLength maximum chunk length in characters
     * @return ordered non-empty chunks; empty for null, empty or whitespace-only input
     * @throws IllegalArgumentException if maxLength is not positive
     */
    public static List<String> segment(String text, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive, got: " + maxLength);
        }
        String normalized = normalizeWhitespace(text);
        if (normalized.isEmpty()) {
            return List.of();
        }

        Packer packer = new Packer(maxLength);
        for (Piece sentence : splitAfter(normalized, SENTENCE_TERMINATORS)) {
            if (length(sentence.text()) <= maxLength) {
                packer.add(sentence);
                continue;
            }
            // Over-long sentence: pack its clauses instead
            List<Piece> clauses = splitAfter(sentence.text(), CLAUSE_DELIMITERS);
            for (int i = 0; i < clauses.size(); i++) {
                Piece clause = clauses.get(i);
                boolean spaced = i == 0 ? sentence.spaced() : clause.spaced();
                if (length(clause.text()) <= maxLength) {
                    packer.add(new Piece(clause.text(), spaced));
                } else {
                    packer.addSlices(clause.text(), spaced);
                }
            }
        }
        return packer.finish();
    }

    /**
     * Length in code points.
     */
    static int length(String text) {
        return text.codePointCount(0, text.length());
    }

    /**
     * Collapses runs of whitespace to a single space and trims.
     */
    public static String normalizeWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    /**
     * Splits after every delimiter character. Leading spaces are stripped from each piece and
     * remembered in {@link Piece#spaced()}.
     */
    private static List<Piece> splitAfter(String text, String delimiters) {
        List<Piece> pieces = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (delimiters.indexOf(text.charAt(i)) >= 0) {
                addPiece(pieces, text, start, i + 1);
                start = i + 1;
            }
        }
        addPiece(pieces, text, start, text.length());
        return pieces;
    }

    private static void addPiece(List<Piece> pieces, String text, int start, int end) {
        if (start >= end) {
            return;
        }
        String raw = text.substring(start, end);
        String trimmed = raw.strip();
        if (trimmed.isEmpty()) {
            return;
        }
        boolean spaced = !pieces.isEmpty() && raw.charAt(0) == ' ';
        pieces.add(new Piece(trimmed, spaced));
    }

    /**
     * A sentence, clause or slice plus whether whitespace preceded it in the source.
     */
    private record Piece(String text, boolean spaced) {}

    /**
     * Greedy accumulator: appends pieces to the running chunk while the result fits.
     */
    private static final class Packer {
        private final int maxLength;
        private final List<String> chunks = new ArrayList<>();
        private final StringBuilder current = new StringBuilder();
        private int currentLength;

        Packer(int maxLength) {
            this.maxLength = maxLength;
        }

        void add(Piece piece) {
            String joiner = current.length() > 0 && piece.spaced() ? " " : "";
            int pieceLength = length(piece.text());
            if (currentLength + joiner.length() + pieceLength <= maxLength) {
                current.append(joiner).append(piece.text());
                currentLength += joiner.length() + pieceLength;
                return;
            }
            flush();
            current.append(piece.text());
            currentLength = pieceLength;
        }

        void addSlices(String text, boolean spaced) {
            int remaining = length(text);
            int start = 0;
            while (remaining > 0) {
                int step = Math.min(maxLength, remaining);
                int end = text.offsetByCodePoints(start, step);
                String slice = text.substring(start, end).strip();
                if (!slice.isEmpty()) {
                    add(new Piece(slice, start == 0 && spaced));
                }
                start = end;
                remaining -= step;
            }
        }

        List<String> finish() {
            flush();
            return List.copyOf(chunks);
        }

        private void flush() {
            if (current.length() > 0) {
                chunks.add(current.toString());
                current.setLength(0);
                currentLength = 0;
            }
        }
    }
}
