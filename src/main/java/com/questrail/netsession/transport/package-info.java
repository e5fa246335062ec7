/**
 * Datagram Socket Port
 * =============================================================================
 *
 * The framework-agnostic boundary between the session server and a concrete
 * datagram socket (Netty NIO in production, an in-memory fake in tests).
 *
 * <p>Everything above this package sees only:</p>
 * <ul>
 *   <li>payloads as {@link com.questrail.netsession.payload.Packet}</li>
 *   <li>peers as {@link java.net.InetSocketAddress}</li>
 *   <li>receive failures as a closed {@link com.questrail.netsession.transport.SocketErrorKind}</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>perform socket I/O only, with no session or match bookkeeping</li>
 *   <li>keep receiving after a per-datagram error; the server decides what an error means</li>
 *   <li>not schedule retries or timeouts</li>
 * </ul>
 */
package com.questrail.netsession.transport;
