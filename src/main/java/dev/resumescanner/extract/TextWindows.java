package dev.resumescanner.extract;

import java.util.List;

/**
 * Character and line windows around a match, used for context checks.
 */
public final class TextWindows {

    private TextWindows() {
    }

    /**
     * Text from {@code radius} characters before {@code start} to {@code radius} characters after {@code end}.
     */
    public static String around(String text, int start, int end, int radius) {
        int from = Math.max(0, start - radius);
        int to = Math.min(text.length(), end + radius);
        return from >= to ? "" : text.substring(from, to);
    }

    /**
     * The full line containing the given offset, without its line terminator.
     */
    public static String lineAt(String text, int position) {
        int pos = Math.max(0, Math.min(position, text.length()));
        int lineStart = text.lastIndexOf('\n', pos - 1) + 1;
        int lineEnd = text.indexOf('\n', pos);
        return text.substring(lineStart, lineEnd < 0 ? text.length() : lineEnd);
    }

    /**
     * The line containing the offset plus up to {@code lines} lines on each side.
     */
    public static String linesAround(String text, int position, int lines) {
        int pos = Math.max(0, Math.min(position, text.length()));
        int from = text.lastIndexOf('\n', pos - 1) + 1;
        for (int i = 0; i < lines && from > 0; i++) {
            from = text.lastIndexOf('\n', from - 2) + 1;
        }
        int to = text.indexOf('\n', pos);
        for (int i = 0; i < lines && to >= 0; i++) {
            to = text.indexOf('\n', to + 1);
        }
        return text.substring(from, to < 0 ? text.length() : to);
    }

    /**
     * Whether [start, end) intersects any of the given [start, end) spans.
     */
    public static boolean overlapsAny(int start, int end, List<int[]> spans) {
        for (int[] span : spans) {
            if (start < span[1] && span[0] < end) {
                return true;
            }
        }
        return false;
    }
}
