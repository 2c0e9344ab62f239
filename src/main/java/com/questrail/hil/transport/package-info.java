/**
 * Serial Line Transport
 * =============================================================================
 *
 * Converts a blocking, byte-oriented serial device into a line-oriented,
 * timestamped interface that the cooperative scheduler can drive.
 *
 * <h2>Layers</h2>
 * <pre>
 *   SerialDevice (blocking bytes, jSerialComm or a simulator)
 *        → reader / writer worker threads
 *            → bounded inbound / outbound queues
 *                → LineTransport futures (getLine / putLine)
 * </pre>
 *
 * <h2>Architectural constraints (binding)</h2>
 * <ul>
 *   <li>Only the two worker threads of a session touch the device.</li>
 *   <li>Receive timestamps are taken when the blocking read returns, never at
 *       dequeue time, and share one monotonic clock with enqueue times.</li>
 *   <li>The reader never blocks on a full inbound queue; it drops and counts.</li>
 *   <li>No protocol interpretation happens at this layer.</li>
 * </ul>
 */
package com.questrail.hil.transport;
