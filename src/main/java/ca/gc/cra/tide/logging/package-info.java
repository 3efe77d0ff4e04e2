/**
 * Logging helpers shared by the CLI and the stream pipeline.
 * <p>{@link ca.gc.cra.tide.logging.LoggingConfigurator} adjusts Logback levels at startup;
 * {@link ca.gc.cra.tide.logging.Logs} keeps column values and credentials out of operator logs.</p>
 */
package ca.gc.cra.tide.logging;
