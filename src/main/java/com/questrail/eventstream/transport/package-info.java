/**
 * Transport-facing adapters for the event-stream decoder.
 *
 * <p>Nothing here opens sockets. Adapters accept chunks from whatever
 * transport owns the connection and push decoded events onward.</p>
 */
package com.questrail.eventstream.transport;
