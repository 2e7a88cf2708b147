package com.dpw.fixrunner.transport;

import com.dpw.fixrunner.exception.TransmissionException;

/**
 * Hands an encoded message to the counterparty. The reply arrives asynchronously in the
 * {@link RecordStore}.
 */
public interface MessageTransport {

    void send(String encodedMessage) throws TransmissionException;
}
