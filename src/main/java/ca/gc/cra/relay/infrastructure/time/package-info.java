/**
 * Time sources implementing {@link ca.gc.cra.relay.application.port.ClockPort}.
 */
package ca.gc.cra.relay.infrastructure.time;
