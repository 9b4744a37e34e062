/**
 * <strong>Purpose:</strong> Pipeline lifecycle and delivery vocabulary shared by the application layer.
 * <p><strong>Concurrency:</strong> Enums and immutable records; safe to share across export threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.domain.pipeline;
