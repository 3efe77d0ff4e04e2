/**
 * Clock adapters implementing {@link ca.gc.cra.tide.application.port.ClockPort}.
 */
package ca.gc.cra.tide.infrastructure.time;
