package com.questrail.uplink.transport;

import java.net.URI;

/**
 * Creates a fresh {@link SocketEndpoint} for each connection attempt.
 */
@FunctionalInterface
public interface SocketEndpointFactory
{
    /**
     * @param uri      server URI
     * @param listener receives the endpoint's events; set before the endpoint is returned
     * @return an unopened endpoint
     */
    SocketEndpoint create(URI uri, SocketEndpointListener listener);
}
