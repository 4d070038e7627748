package com.ordermatcher.codec;

public class DecodingException extends CodecException {

    public DecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
