/**
 * Input validation for configuration and CLI values; failures raise {@link java.lang.IllegalArgumentException}.
 */
package ca.gc.cra.tide.validation;
