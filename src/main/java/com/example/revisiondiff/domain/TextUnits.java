package com.example.revisiondiff.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Splitting of text into the units compared at each {@link Granularity}.
 */
public final class TextUnits {
    private TextUnits() {}

    /**
     * Lines with their terminators kept, so that joining the result gives back {@code text}.
     * Recognized terminators: {@code \r\n}, {@code \n}, {@code \r}, vertical tab, form feed,
     * the file/group/record separators, NEL, and the Unicode line and paragraph separators.
     */
    public static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int length = text.length();
        int i = 0;
        while (i < length) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                lines.add(text.substring(start, i + 2));
                i += 2;
                start = i;
            } else if (isLineTerminator(c)) {
                lines.add(text.substring(start, i + 1));
                i++;
                start = i;
            } else {
                i++;
            }
        }
        if (start < length) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    /**
     * Lines of {@code text} without their terminators; empty for an empty text.
     */
    public static List<String> splitLinesWithoutTerminators(String text) {
        List<String> lines = splitLines(text);
        List<String> stripped = new ArrayList<>(lines.size());
        for (String line : lines) {
            stripped.add(stripTerminator(line));
        }
        return stripped;
    }

    static String stripTerminator(String line) {
        if (line.endsWith("\r\n")) {
            return line.substring(0, line.length() - 2);
        }
        if (!line.isEmpty() && isLineTerminator(line.charAt(line.length() - 1))) {
            return line.substring(0, line.length() - 1);
        }
        return line;
    }

    public static int length(String text) {
        return text.codePointCount(0, text.length());
    }

    private static boolean isLineTerminator(char c) {
        return switch (c) {
            case '\n', '\r', '\u000B', '\u000C', '\u001C', '\u001D', '\u001E', '\u0085', '\u2028',
                    '\u2029' -> true;
            default -> false;
        };
    }
}
