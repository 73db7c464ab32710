package com.servealert.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A remediation step attached to an alert when it is assigned.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CureStep {

    String id;
    String description;
    boolean completed;
    LocalDateTime completedAt;
    String completedBy;
    String notes;
}
