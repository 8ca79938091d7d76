package com.frosted.tracer.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Captured source text plus per-line start offsets. Lines are 1-based; a trailing newline
 * does not open another line and empty text still has one line.
 */
public final class SourceText {
    private final String text;
    private final List<Integer> lineOffsets;

    private SourceText(String text) {
        this.text = text;
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n' && i + 1 < text.length()) {
                offsets.add(i + 1);
            }
        }
        this.lineOffsets = Collections.unmodifiableList(offsets);
    }

    public static SourceText of(String raw) {
        String normalized = raw == null ? "" : raw.replace("\r\n", "\n").replace('\r', '\n');
        return new SourceText(normalized);
    }

    public String getText() { return text; }

    public int lineCount() {
        return lineOffsets.size();
    }

    public boolean isValidLine(int line) {
        return line >= 1 && line <= lineCount();
    }

    public int offsetOf(int line) {
        if (!isValidLine(line)) {
            throw new IllegalArgumentException("Line " + line + " outside 1.." + lineCount());
        }
        return lineOffsets.get(line - 1);
    }

    public String line(int line) {
        int start = offsetOf(line);
        int end = text.indexOf('\n', start);
        return end < 0 ? text.substring(start) : text.substring(start, end);
    }

    /**
     * SHA-256 of the text as lowercase hex; the key external caches store derived results under.
     */
    public String contentHash() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
