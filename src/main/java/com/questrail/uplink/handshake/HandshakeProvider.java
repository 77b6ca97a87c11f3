package com.questrail.uplink.handshake;

/**
 * Supplies the handshake payload.
 *
 * <p>Called once per successful open, on the client's event loop, so the
 * payload can reflect state that changed between connections.</p>
 */
@FunctionalInterface
public interface HandshakeProvider {

    ClientHello hello();
}
