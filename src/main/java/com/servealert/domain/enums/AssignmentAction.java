package com.servealert.domain.enums;

public enum AssignmentAction {
    ASSIGNED,
    REASSIGNED,
    UNASSIGNED
}
