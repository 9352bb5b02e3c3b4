/**
 * Home of the {@code Server}.<p>
 * 
 * <strong>Architectural Overview</strong>. The {@link
 * alpha.nomagicdispatch.Server Server} wraps exactly one {@link
 * alpha.nomagicdispatch.handler.Handler Handler}, which knows how to process a
 * {@link alpha.nomagicdispatch.message.Request Request} into a {@link
 * alpha.nomagicdispatch.message.Response Response}. There is no routing; a
 * handler that serves many resources branches on the request itself.<p>
 * 
 * Bytes on the wire are the concern of a {@link
 * alpha.nomagicdispatch.transport.Transport Transport}. The server only
 * translates between the transport's raw representation and the
 * request/response API, and contains all failures.
 */
package alpha.nomagicdispatch;
