/**
 * UDP Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete UDP implementation (Netty in
 * production, a fake in tests) and Alpaca discovery.
 *
 * <h2>Netty containment</h2>
 * Everything above the adapter sees only:
 * <ul>
 *   <li>raw datagram payloads as {@code byte[]}</li>
 *   <li>remote endpoints as {@link java.net.SocketAddress}</li>
 *   <li>transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <p>Implementations perform socket I/O only. Matching the discovery token and
 * building the reply are done by the discovery package.</p>
 */
package com.questrail.alpaca.transport;
