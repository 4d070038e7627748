package com.ordermatcher.codec;

/**
 * Base class for encoding and decoding failures.
 */
public abstract class CodecException extends Exception {

    protected CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
