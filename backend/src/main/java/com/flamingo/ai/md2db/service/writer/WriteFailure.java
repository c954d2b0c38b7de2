package com.flamingo.ai.md2db.service.writer;

/**
 * A question the store refused during a bulk write.
 *
 * @param questionId the question's stable identifier
 * @param sourceChunk id of the chunk it came from
 * @param contentHash digest of the question text
 * @param reason store error message
 */
public record WriteFailure(
    String questionId, String sourceChunk, String contentHash, String reason) {}
