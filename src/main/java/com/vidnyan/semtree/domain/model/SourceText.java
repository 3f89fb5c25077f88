package com.vidnyan.semtree.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Original source of one file. Parsers report byte offsets into the UTF-8 encoding,
 * adapters built on Java parsers report character offsets; this class converts between them.
 */
public final class SourceText {

    private final String text;
    private final byte[] utf8;
    private final int[] lineStarts;
    private int[] charToByte;

    public SourceText(String text) {
        this.text = text;
        this.utf8 = text.getBytes(StandardCharsets.UTF_8);
        this.lineStarts = computeLineStarts(text);
    }

    public static SourceText of(String text) {
        return new SourceText(text);
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public int byteLength() {
        return utf8.length;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Verbatim text between two byte offsets.
     */
    public String slice(int startByte, int endByte) {
        int start = clampByte(startByte);
        int end = clampByte(endByte);
        if (end <= start) {
            return "";
        }
        return new String(utf8, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * True when the byte range contains at least one whitespace character.
     */
    public boolean hasWhitespace(int startByte, int endByte) {
        int start = clampByte(startByte);
        int end = clampByte(endByte);
        for (int i = start; i < end; i++) {
            byte b = utf8[i];
            if (b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == '\f' || b == 0x0B) {
                return true;
            }
        }
        return false;
    }

    public int byteOffset(int charOffset) {
        if (isAscii()) {
            return Math.min(Math.max(charOffset, 0), utf8.length);
        }
        int[] table = charToByteTable();
        return table[Math.min(Math.max(charOffset, 0), text.length())];
    }

    /**
     * Position of a character offset.
     */
    public Position positionAt(int charOffset) {
        int offset = Math.min(Math.max(charOffset, 0), text.length());
        int row = rowOf(offset);
        return new Position(row, offset - lineStarts[row], byteOffset(offset));
    }

    /**
     * Position of a zero-based row and character column.
     */
    public Position positionAt(int row, int column) {
        return positionAt(charOffset(row, column));
    }

    public int charOffset(int row, int column) {
        if (row >= lineStarts.length) {
            return text.length();
        }
        return Math.min(lineStarts[Math.max(row, 0)] + Math.max(column, 0), text.length());
    }

    /**
     * Character offset of a code point index, for parsers that count code points.
     */
    public int charOffsetOfCodePoint(int codePointIndex) {
        if (isAscii()) {
            return Math.min(codePointIndex, text.length());
        }
        int available = text.codePointCount(0, text.length());
        return text.offsetByCodePoints(0, Math.min(codePointIndex, available));
    }

    /**
     * Source lines between two 1-based line numbers, inclusive, without terminators.
     */
    public List<String> lines(int fromLine, int toLine) {
        List<String> lines = new ArrayList<>();
        int from = Math.max(fromLine, 1);
        int to = Math.min(toLine, lineStarts.length);
        for (int line = from; line <= to; line++) {
            int start = lineStarts[line - 1];
            int end = line < lineStarts.length ? lineStarts[line] : text.length();
            lines.add(stripTerminator(text.substring(start, end)));
        }
        return lines;
    }

    private int rowOf(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    private boolean isAscii() {
        return utf8.length == text.length();
    }

    private int clampByte(int offset) {
        return Math.min(Math.max(offset, 0), utf8.length);
    }

    private int[] charToByteTable() {
        if (charToByte == null) {
            int[] table = new int[text.length() + 1];
            int bytes = 0;
            for (int i = 0; i < text.length(); i++) {
                table[i] = bytes;
                char c = text.charAt(i);
                if (c < 0x80) {
                    bytes += 1;
                } else if (c < 0x800) {
                    bytes += 2;
                } else if (Character.isHighSurrogate(c)) {
                    // the pair encodes as four bytes, all counted on the low half
                    bytes += 0;
                } else if (Character.isLowSurrogate(c)) {
                    bytes += 4;
                } else {
                    bytes += 3;
                }
            }
            table[text.length()] = bytes;
            charToByte = table;
        }
        return charToByte;
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                starts.add(i + 1);
            } else if (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n')) {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static String stripTerminator(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }
}
