package com.servealert.lifecycle.command;

import com.servealert.domain.model.Alert;
import com.servealert.domain.model.CureStep;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ticks off (or re-opens) one remediation step. Null arguments leave the matching field
 * as it is. An unknown step id changes nothing.
 */
public class UpdateCureStepCommand extends SingleAlertCommand {

    private final String stepId;
    private final Boolean completed;
    private final String completedBy;
    private final String notes;

    public UpdateCureStepCommand(String alertId, String stepId, Boolean completed, String completedBy, String notes) {
        super(alertId);
        this.stepId = stepId;
        this.completed = completed;
        this.completedBy = completedBy;
        this.notes = notes;
    }

    @Override
    public String name() {
        return "updateCureStep";
    }

    @Override
    protected Alert update(Alert current, LocalDateTime now) {
        boolean found = false;
        List<CureStep> steps = new ArrayList<>(current.getCureSteps().size());
        for (CureStep step : current.getCureSteps()) {
            if (Objects.equals(step.getId(), stepId)) {
                steps.add(updateStep(step, now));
                found = true;
            } else {
                steps.add(step);
            }
        }
        if (!found) {
            return current;
        }
        return current.toBuilder().cureSteps(steps).build();
    }

    private CureStep updateStep(CureStep step, LocalDateTime now) {
        CureStep.CureStepBuilder builder = step.toBuilder();
        if (Boolean.TRUE.equals(completed) && !step.isCompleted()) {
            builder.completed(true).completedAt(now);
        } else if (Boolean.FALSE.equals(completed)) {
            builder.completed(false).completedAt(null);
        }
        if (completedBy != null) {
            builder.completedBy(completedBy);
        }
        if (notes != null) {
            builder.notes(notes);
        }
        return builder.build();
    }
}
