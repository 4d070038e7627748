package com.ordermatcher.codec;

public class EncodingException extends CodecException {

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
