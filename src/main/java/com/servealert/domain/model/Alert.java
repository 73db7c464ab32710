package com.servealert.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.enums.AlertType;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An operational event in the restaurant that needs somebody's attention.
 *
 * <p>Alerts are produced by the synthesis engine and owned by the lifecycle manager,
 * which is the only component allowed to change {@link #status} and the timestamp
 * fields tied to it. The notification scheduler reads {@link #shouldNotify} and
 * {@link #notificationSent}; the lifecycle manager books {@link #notificationSent} and
 * {@link #notificationId} when the delivery gate reports a hand-off to the device.
 *
 * <p>Alerts are immutable and the list accessors return read-only views. Every change
 * is a {@code toBuilder()} copy, so an alert handed out by a query stays a snapshot.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Alert {

    String id;
    AlertType type;
    AlertPriority priority;

    @Builder.Default
    AlertStatus status = AlertStatus.ACTIVE;

    String title;
    String message;
    String details;

    /** Advisory text shown next to the alert explaining why it fired. */
    String explanation;

    @Builder.Default
    List<String> relatedFactors = List.of();

    /** Creation time. Every other timestamp on the alert is at or after this one. */
    LocalDateTime timestamp;

    /** Name of the producer, e.g. the synthesis engine or an integration. */
    String source;

    boolean read;
    LocalDateTime readAt;

    LocalDateTime acknowledgedAt;
    String acknowledgedBy;
    LocalDateTime resolvedAt;
    LocalDateTime dismissedAt;

    boolean shouldNotify;
    boolean notificationSent;

    /** Handle returned by the device notification gateway. */
    String notificationId;

    LocalDateTime notificationScheduledAt;

    boolean actionRequired;

    /** Minutes. */
    Integer estimatedResolutionTime;

    @Builder.Default
    List<String> tags = List.of();

    int helpfulVotes;
    int notHelpfulVotes;

    /** Hidden from the working view until the next reload; status is unaffected. */
    boolean dismissedUntilRefresh;

    // ---- Assignment ----

    String assignedTo;
    String assignedToName;
    String assignedBy;
    String assignedByName;
    LocalDateTime assignedAt;

    @Builder.Default
    List<AssignmentHistoryEntry> assignmentHistory = List.of();

    @Builder.Default
    List<CureStep> cureSteps = List.of();

    String resolutionNotes;

    public List<String> getRelatedFactors() {
        return readOnly(relatedFactors);
    }

    public List<String> getTags() {
        return readOnly(tags);
    }

    public List<AssignmentHistoryEntry> getAssignmentHistory() {
        return readOnly(assignmentHistory);
    }

    public List<CureStep> getCureSteps() {
        return readOnly(cureSteps);
    }

    @JsonIgnore
    public boolean isAcknowledged() {
        return status == AlertStatus.ACKNOWLEDGED;
    }

    @JsonIgnore
    public boolean isResolved() {
        return status == AlertStatus.RESOLVED;
    }

    @JsonIgnore
    public boolean isDismissed() {
        return status == AlertStatus.DISMISSED;
    }

    private static <T> List<T> readOnly(List<T> list) {
        return list != null ? Collections.unmodifiableList(list) : List.of();
    }
}
