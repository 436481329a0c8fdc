package org.dxworks.codemod.parser;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Immutable source buffer addressed by UTF-8 byte offsets, the unit tree-sitter reports ranges in.
 * Java strings are UTF-16, so all range arithmetic goes through the encoded bytes.
 */
public final class SourceText {
    private final String text;
    private final byte[] bytes;

    public SourceText(String text) {
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
    }

    public String getText() {
        return text;
    }

    public int length() {
        return bytes.length;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public String substring(int startByte, int endByte) {
        int start = Math.max(0, startByte);
        int end = Math.min(bytes.length, endByte);
        if (start >= end) return "";
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Returns the byte at {@code offset} as an unsigned value, or -1 outside the buffer.
     */
    public int byteAt(int offset) {
        if (offset < 0 || offset >= bytes.length) return -1;
        return bytes[offset] & 0xFF;
    }

    public boolean charAtIs(int offset, char expected) {
        return byteAt(offset) == expected;
    }

    public int lineStart(int offset) {
        int i = Math.min(offset, bytes.length) - 1;
        while (i >= 0 && bytes[i] != '\n') {
            i--;
        }
        return i + 1;
    }

    /**
     * Leading spaces and tabs of the line containing {@code offset}.
     */
    public String lineIndentation(int offset) {
        int start = lineStart(offset);
        int i = start;
        while (i < bytes.length && (bytes[i] == ' ' || bytes[i] == '\t')) {
            i++;
        }
        return substring(start, i);
    }

    /**
     * Whitespace that lines up with the column of {@code offset}: the line prefix itself when it
     * is blank, otherwise one space per character of the prefix.
     */
    public String columnIndentation(int offset) {
        int start = lineStart(offset);
        String prefix = substring(start, offset);
        if (prefix.isBlank()) {
            return prefix;
        }
        return " ".repeat(prefix.codePointCount(0, prefix.length()));
    }

    public boolean isFirstOnLine(int offset) {
        return substring(lineStart(offset), offset).isBlank();
    }
}
