package com.servealert.lifecycle.command;

import com.servealert.domain.enums.AssignmentAction;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.AssignmentHistoryEntry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/** Clears the current assignee. A no-op when nobody is assigned. */
public class UnassignCommand extends SingleAlertCommand {

    static final String UNASSIGNED_NAME = "Unassigned";

    private final String unassignedBy;

    public UnassignCommand(String alertId, String unassignedBy) {
        super(alertId);
        this.unassignedBy = unassignedBy;
    }

    @Override
    public String name() {
        return "unassign";
    }

    @Override
    protected Alert update(Alert current, LocalDateTime now) {
        if (current.getAssignedTo() == null) {
            return current;
        }

        List<AssignmentHistoryEntry> history = new ArrayList<>(current.getAssignmentHistory());
        history.add(AssignmentHistoryEntry.builder()
                .assignedTo("")
                .assignedToName(UNASSIGNED_NAME)
                .assignedBy(unassignedBy)
                .assignedByName(unassignedBy)
                .assignedAt(now)
                .action(AssignmentAction.UNASSIGNED)
                .build());

        return current.toBuilder()
                .assignedTo(null)
                .assignedToName(null)
                .assignedBy(null)
                .assignedByName(null)
                .assignedAt(null)
                .assignmentHistory(history)
                .build();
    }
}
