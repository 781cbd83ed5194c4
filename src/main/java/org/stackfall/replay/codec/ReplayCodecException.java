package org.stackfall.replay.codec;

/**
 * Raised when replay bytes cannot be encoded or decoded: malformed JSON, unknown event kinds,
 * unknown shape or input names, or missing fields.
 */
public class ReplayCodecException extends Exception {

    public ReplayCodecException(String message) {
        super(message);
    }

    public ReplayCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
