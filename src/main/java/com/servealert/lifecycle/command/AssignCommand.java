package com.servealert.lifecycle.command;

import com.servealert.domain.enums.AssignmentAction;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.AssignmentHistoryEntry;
import com.servealert.lifecycle.CureStepCatalog;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Hands an open alert to a staff member and appends to its assignment trail. The first
 * assignment also attaches the default checklist for the alert type.
 */
public class AssignCommand extends SingleAlertCommand {

    protected final String assignedTo;
    protected final String assignedToName;
    protected final String assignedBy;
    protected final String assignedByName;

    public AssignCommand(
            String alertId, String assignedTo, String assignedToName, String assignedBy, String assignedByName) {
        super(alertId);
        this.assignedTo = assignedTo;
        this.assignedToName = assignedToName;
        this.assignedBy = assignedBy;
        this.assignedByName = assignedByName;
    }

    @Override
    public String name() {
        return "assign";
    }

    protected AssignmentAction action() {
        return AssignmentAction.ASSIGNED;
    }

    protected String reason() {
        return null;
    }

    @Override
    protected Alert update(Alert current, LocalDateTime now) {
        requireOpen(current);

        AssignmentHistoryEntry entry = AssignmentHistoryEntry.builder()
                .assignedTo(assignedTo)
                .assignedToName(assignedToName)
                .assignedBy(assignedBy)
                .assignedByName(assignedByName)
                .assignedAt(now)
                .reason(reason())
                .action(action())
                .build();

        List<AssignmentHistoryEntry> history = new ArrayList<>(current.getAssignmentHistory());
        history.add(entry);

        return current.toBuilder()
                .assignedTo(assignedTo)
                .assignedToName(assignedToName)
                .assignedBy(assignedBy)
                .assignedByName(assignedByName)
                .assignedAt(now)
                .assignmentHistory(history)
                .cureSteps(current.getCureSteps().isEmpty()
                        ? CureStepCatalog.defaultSteps(current.getType())
                        : current.getCureSteps())
                .build();
    }
}
