/**
 * Utilities.
 */
package alpha.nomagicdispatch.util;
