package com.ragbridge.engine.naive;

import com.ragbridge.errors.ChunkingException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits document text into chunks of at most {@code chunkSize} characters.
 * <ul>
 *   <li>{@code general}: fixed windows advancing by {@code chunkSize - chunkOverlap}</li>
 *   <li>{@code paragraph}: paragraphs (separated by blank lines) packed greedily up to {@code chunkSize}; a paragraph
 *       longer than that is split into windows</li>
 * </ul>
 * Chunks are trimmed; blank chunks are dropped.
 */
public final class TextChunker {

    public static final String MODE_GENERAL = "general";
    public static final String MODE_PARAGRAPH = "paragraph";

    private final String mode;
    private final int chunkSize;
    private final int chunkOverlap;

    public TextChunker(String mode, int chunkSize, int chunkOverlap) {
        this.mode = mode != null ? mode : MODE_GENERAL;
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    /**
     * @throws ChunkingException if the settings cannot be applied (unknown mode, non-positive size, overlap not
     *                           smaller than size) or the text yields no chunk
     */
    public List<String> chunk(String documentId, String text) {
        if (chunkSize < 1) {
            throw new ChunkingException(documentId, "chunk_size must be positive: " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new ChunkingException(documentId,
                    "chunk_overlap (" + chunkOverlap + ") must be >= 0 and smaller than chunk_size (" + chunkSize + ")");
        }
        List<String> chunks;
        switch (mode) {
            case MODE_GENERAL:
                chunks = windows(text);
                break;
            case MODE_PARAGRAPH:
                chunks = paragraphs(text);
                break;
            default:
                throw new ChunkingException(documentId, "Unsupported index_mode: " + mode);
        }
        if (chunks.isEmpty()) {
            throw new ChunkingException(documentId, "Document produced no chunks");
        }
        return chunks;
    }

    private List<String> windows(String text) {
        List<String> out = new ArrayList<>();
        int step = chunkSize - chunkOverlap;
        for (int start = 0; start < text.length(); start += step) {
            int end = Math.min(text.length(), start + chunkSize);
            add(out, text.substring(start, end));
            if (end == text.length()) break;
        }
        return out;
    }

    private List<String> paragraphs(String text) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String raw : text.split("\\R\\s*\\R")) {
            String paragraph = raw.trim();
            if (paragraph.isEmpty()) continue;
            if (paragraph.length() > chunkSize) {
                add(out, current.toString());
                current.setLength(0);
                out.addAll(windows(paragraph));
                continue;
            }
            if (current.length() > 0 && current.length() + 2 + paragraph.length() > chunkSize) {
                add(out, current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) current.append("\n\n");
            current.append(paragraph);
        }
        add(out, current.toString());
        return out;
    }

    private static void add(List<String> out, String chunk) {
        String trimmed = chunk.trim();
        if (!trimmed.isEmpty()) out.add(trimmed);
    }
}
