package com.phillippitts.dialoguetts.service.dialogue;

import com.phillippitts.dialoguetts.domain.DialogueSegment;
import com.phillippitts.dialoguetts.service.text.TextSegmenter;
import com.phillippitts.dialoguetts.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a dialogue script into speaker-attributed segments.
 *
 * <p>Expected format, with either an ASCII or a full-width colon:
 * <pre>
 * 娜奥米：你好，这是一个对话。
 * 基翁：是的，这是一个测试。
 * </pre>
 *
 * <p>A speaker label starts at the beginning of a line, or directly after a full-width sentence
 * terminator ({@code 。！？}) so unbroken CJK scripts such as {@code A：你好。B：再见。} split
 * correctly. A label is 1-40 characters with no colon, newline or full-width terminator.
 * Text before the first label is attributed to {@value #NARRATOR_LABEL}.
 *
 * <p>Segments whose text is empty are dropped; indexes are contiguous from 0 in document order.
 */
public final class DialogueParser {

    private static final Logger LOG = LogManager.getLogger(DialogueParser.class);

    /** Speaker label given to unattributed text before the first label. */
    public static final String NARRATOR_LABEL = "Narrator";

    private static final int MAX_LABEL_LENGTH = 40;
    private static final int PREVIEW_CHARS = 50;

    private static final Pattern LABEL = Pattern.compile(
            "(?m)(?:^|(?<=[。！？]))[ \\t]*([^:：\\n。！？]{1," + MAX_LABEL_LENGTH + "})[:：]");

    private DialogueParser() {}

    /**
     * Parses a script into ordered segments.
     *
     * @param script full script text (may be null)
     * @return segments indexed 0..N-1; empty if no speaker label occurs anywhere
     */
    public static List<DialogueSegment> parse(String script) {
        if (script == null || script.isBlank()) {
            return List.of();
        }

        List<Label> labels = findLabels(script);
        if (labels.isEmpty()) {
            LOG.warn("No speaker labels found; expected 'Speaker：text' lines");
            return List.of();
        }

        List<Unit> units = new ArrayList<>();
        String intro = TextSegmenter.normalizeWhitespace(script.substring(0, labels.get(0).start()));
        if (!intro.isEmpty()) {
            units.add(new Unit(NARRATOR_LABEL, intro));
            LOG.debug("Leading narration: {}", LogSanitizer.preview(intro, PREVIEW_CHARS));
        }
        for (int i = 0; i < labels.size(); i++) {
            Label label = labels.get(i);
            int end = i + 1 < labels.size() ? labels.get(i + 1).start() : script.length();
            String text = TextSegmenter.normalizeWhitespace(script.substring(label.textStart(), end));
            if (!text.isEmpty()) {
                units.add(new Unit(label.speaker(), text));
            }
        }

        List<DialogueSegment> segments = new ArrayList<>(units.size());
        for (Unit unit : units) {
            DialogueSegment segment = new DialogueSegment(segments.size(), unit.speaker(), unit.text());
            segments.add(segment);
            LOG.debug("Parsed segment [{}] {} -> {}", segment.index(), segment.speaker(),
                    LogSanitizer.preview(segment.text(), PREVIEW_CHARS));
        }
        LOG.info("Parsed {} dialogue segments", segments.size());
        return List.copyOf(segments);
    }

    private static List<Label> findLabels(String script) {
        List<Label> labels = new ArrayList<>();
        Matcher m = LABEL.matcher(script);
        while (m.find()) {
            String speaker = m.group(1).strip();
            if (!speaker.isEmpty()) {
                labels.add(new Label(m.start(), m.end(), speaker));
            }
        }
        return labels;
    }

    /**
     * Position of a label token in the script.
     *
     * @param start     offset where the label token begins (end of the previous unit)
     * @param textStart offset just past the colon
     * @param speaker   trimmed label
     */
    private record Label(int start, int textStart, String speaker) {}

    private record Unit(String speaker, String text) {}
}
