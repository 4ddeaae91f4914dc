package com.phillippitts.wordassist.service.transport;

import com.phillippitts.wordassist.service.provider.PreparedRequest;

import java.io.IOException;

/**
 * Sends a prepared provider request and returns the raw response.
 *
 * <p>Non-2xx responses are returned, not thrown. Only failures where no response was received
 * (connection refused, timeout, TLS error) raise {@link IOException}.
 */
@FunctionalInterface
public interface ProviderTransport {

    TransportResponse send(PreparedRequest request) throws IOException;
}
