/**
 * Datagram Server API
 * =============================================================================
 *
 * The capability contracts a caller implements and the value types that flow
 * through the server.
 *
 * <h2>Capabilities</h2>
 * <ul>
 *   <li>{@link com.questrail.datagram.api.Binder}: produce a bound socket</li>
 *   <li>{@link com.questrail.datagram.api.RequestHandler}: interpret a datagram, decide on a reply</li>
 *   <li>{@link com.questrail.datagram.api.ResponseHandler}: write a reply to the socket</li>
 * </ul>
 *
 * <p>The three roles are deliberately separate so that binding, processing and
 * writing can be implemented, replaced and tested independently.</p>
 *
 * <h2>Payload ownership</h2>
 * The server never interprets payload bytes. A {@code RawDatagram} is handed to
 * exactly one request worker; a {@code Response} to exactly one response worker.
 */
package com.questrail.datagram.api;
