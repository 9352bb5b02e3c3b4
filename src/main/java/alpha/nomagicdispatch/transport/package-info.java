/**
 * The contract between the server and the component that owns the wire, and
 * the default implementation {@link
 * alpha.nomagicdispatch.transport.JdkTransport JdkTransport}.
 */
package alpha.nomagicdispatch.transport;
