package com.servealert.domain.model;

import com.servealert.domain.enums.AssignmentAction;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One entry in an alert's assignment trail. Entries are only ever appended.
 */
@Value
@Builder
@Jacksonized
public class AssignmentHistoryEntry {

    String assignedTo;
    String assignedToName;
    String assignedBy;
    String assignedByName;
    LocalDateTime assignedAt;
    String reason;
    AssignmentAction action;
}
