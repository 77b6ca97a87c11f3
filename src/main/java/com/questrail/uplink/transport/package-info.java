/**
 * Uplink Transport Ports
 * =============================================================================
 *
 * <p>These interfaces are the boundary between a concrete socket implementation
 * (Netty WebSocket in production, a scripted fake in tests) and the transport
 * client.</p>
 *
 * <p>Everything above the boundary sees only:</p>
 * <ul>
 *   <li>whole text messages as {@code String}</li>
 *   <li>open / close / error lifecycle notifications</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform socket I/O only</li>
 *   <li>Not parse message envelopes</li>
 *   <li>Not retry, reconnect or time anything out</li>
 * </ul>
 *
 * <p>Netty types stay inside {@code transport.netty}.</p>
 */
package com.questrail.uplink.transport;
