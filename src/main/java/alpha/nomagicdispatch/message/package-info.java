/**
 * The request and response API, and the exceptions thrown when a received
 * request can not be adapted into a {@link
 * alpha.nomagicdispatch.message.Request Request}.
 */
package alpha.nomagicdispatch.message;
