package com.ordermatcher.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.nio.charset.StandardCharsets;

/**
 * UTF-8 JSON codec on Gson.
 *
 * NaN and infinite doubles are rejected on encode. Empty, null or malformed
 * input is rejected on decode.
 */
public class GsonOrderCodec implements OrderCodec {

    private final Gson gson;

    public GsonOrderCodec() {
        this(new GsonBuilder().disableHtmlEscaping().create());
    }

    public GsonOrderCodec(Gson gson) {
        this.gson = gson;
    }

    @Override
    public byte[] encode(Object value) throws EncodingException {
        if (value == null) {
            throw new EncodingException("Cannot encode null", null);
        }
        try {
            return gson.toJson(value).getBytes(StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | JsonParseException e) {
            throw new EncodingException(
                "Unsupported value of type " + value.getClass().getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) throws DecodingException {
        if (data == null || data.length == 0) {
            throw new DecodingException("Cannot decode empty input into " + type.getSimpleName(), null);
        }
        T value;
        try {
            value = gson.fromJson(new String(data, StandardCharsets.UTF_8), type);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            throw new DecodingException(
                "Malformed input for " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
        if (value == null) {
            throw new DecodingException("Input decoded to null for " + type.getSimpleName(), null);
        }
        return value;
    }
}
