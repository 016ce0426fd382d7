package org.optimax.rogue.server.codec;

/**
 * Thrown when a value cannot be encoded or a frame cannot be decoded.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
