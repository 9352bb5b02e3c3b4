/**
 * The {@link alpha.nomagicdispatch.handler.Handler Handler} contract.
 */
package alpha.nomagicdispatch.handler;
