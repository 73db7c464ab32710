package com.servealert.lifecycle.command;

import com.servealert.domain.enums.AssignmentAction;

/** Moves an alert to another assignee, recording why. */
public class ReassignCommand extends AssignCommand {

    private final String reason;

    public ReassignCommand(
            String alertId,
            String assignedTo,
            String assignedToName,
            String assignedBy,
            String assignedByName,
            String reason) {
        super(alertId, assignedTo, assignedToName, assignedBy, assignedByName);
        this.reason = reason;
    }

    @Override
    public String name() {
        return "reassign";
    }

    @Override
    protected AssignmentAction action() {
        return AssignmentAction.REASSIGNED;
    }

    @Override
    protected String reason() {
        return reason;
    }
}
