package com.ordermatcher.codec;

/**
 * Pluggable byte encoding for orders and book snapshots.
 * The matching core never calls it on its own; it only hands over detached
 * plain-field values.
 */
public interface OrderCodec {

    byte[] encode(Object value) throws EncodingException;

    <T> T decode(byte[] data, Class<T> type) throws DecodingException;
}
