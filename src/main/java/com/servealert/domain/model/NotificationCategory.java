package com.servealert.domain.model;

import com.servealert.domain.enums.NotificationAction;
import java.util.List;

/**
 * Interactive notification category: the buttons shown under a notification.
 */
public record NotificationCategory(String identifier, List<NotificationAction> actions) {}
