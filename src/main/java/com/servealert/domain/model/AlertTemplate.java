package com.servealert.domain.model;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertType;
import lombok.Builder;
import lombok.Value;

/**
 * Curated alert content. Null fields fall back to defaults when the template is
 * instantiated, and {@code message} may carry context placeholders such as
 * {@code {restaurantName}}.
 */
@Value
@Builder(toBuilder = true)
public class AlertTemplate {

    AlertType type;
    AlertPriority priority;
    String title;
    String message;
    String details;
    boolean actionRequired;
    Integer estimatedResolutionTime;
}
