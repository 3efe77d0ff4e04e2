package ca.gc.cra.tide.application.pipeline;

import ca.gc.cra.tide.validation.Strings;
import java.util.Objects;

/**
 * Per-stream settings passed into a stream runner.
 *
 * @param slotName logical replication slot
 * @param publicationName publication whose changes are streamed
 * @param acknowledgement acknowledgment cadence
 * @since 0.1.0
 */
public record StreamSettings(String slotName, String publicationName, AcknowledgementPolicy acknowledgement) {
  /**
   * Validates constructor invariants.
   */
  public StreamSettings {
    slotName = Strings.requireNonBlank("slotName", slotName);
    publicationName = Strings.requireNonBlank("publicationName", publicationName);
    acknowledgement = Objects.requireNonNull(acknowledgement, "acknowledgement");
  }
}
