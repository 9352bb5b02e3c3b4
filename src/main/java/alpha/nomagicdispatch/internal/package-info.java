/**
 * Internal implementation classes. Not meant to be used by the application.
 */
package alpha.nomagicdispatch.internal;
