package com.netcourier.docqa.service.ingestion;

/**
 * One addressable slice of a document's decoded text.
 *
 * @param index       0-based position within the document
 * @param text        window text with surrounding whitespace trimmed
 * @param fingerprint SHA-256 hex of {@code text}
 * @param startOffset inclusive start of the window in the source text
 * @param endOffset   exclusive end of the window in the source text
 * @param targetSize  window length the chunker aimed for
 * @param overlap     characters shared with the previous window
 */
public record Chunk(int index, String text, String fingerprint, int startOffset, int endOffset,
                    int targetSize, int overlap) {

    public String idFor(long documentId) {
        return idFor(documentId, index);
    }

    public static String idFor(long documentId, int index) {
        return documentId + "-" + index;
    }
}
