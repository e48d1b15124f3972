/**
 * Datagram Transport Port
 * =============================================================================
 *
 * {@link com.questrail.datagram.transport.DatagramSocketHandle} is the
 * <em>framework-agnostic boundary</em> between a concrete networking
 * implementation (Netty UDP, java.nio UDP, a test double) and the server engine.
 *
 * <h2>Why this port exists</h2>
 * Netty is used in production for binding and socket I/O <strong>without</strong>
 * letting Netty types leak into the engine or into caller handlers. Everything
 * above the port sees only:
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Blocking receive/send calls with explicit timeouts</li>
 * </ul>
 *
 * <h2>Constraints on implementations</h2>
 * <ul>
 *   <li>Perform transport I/O only (no payload interpretation)</li>
 *   <li>Deliver each datagram whole; no streaming assumptions</li>
 *   <li>Never retry, reorder or coalesce datagrams</li>
 * </ul>
 */
package com.questrail.datagram.transport;
