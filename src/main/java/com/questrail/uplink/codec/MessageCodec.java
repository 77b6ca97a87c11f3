package com.questrail.uplink.codec;

import com.questrail.uplink.api.MalformedMessageException;
import com.questrail.uplink.api.UplinkException;
import com.questrail.uplink.api.UplinkMessage;

/**
 * MessageCodec
 * -----------------------------------------------------------------------------
 * Serialization boundary between {@link UplinkMessage} envelopes and socket text.
 *
 * <p>The codec knows nothing about correlation, queueing or connection state.
 * It only maps envelopes to text and back.</p>
 */
public interface MessageCodec
{
    /**
     * Encode an outbound envelope.
     *
     * @param type      message type
     * @param id        correlation id; omitted from the output when {@code null}
     * @param payload   payload value; {@code null} is written as an empty object
     * @param timestamp epoch milliseconds
     * @return wire text
     * @throws UplinkException if the payload cannot be serialized
     */
    String encode(String type, String id, Object payload, long timestamp);

    /**
     * Decode inbound wire text.
     *
     * @throws MalformedMessageException if the text is not a valid envelope
     */
    UplinkMessage decode(String text);
}
