package com.servealert.lifecycle.command;

import com.servealert.domain.model.Alert;
import java.time.LocalDateTime;

public class AddResolutionNotesCommand extends SingleAlertCommand {

    private final String notes;

    public AddResolutionNotesCommand(String alertId, String notes) {
        super(alertId);
        this.notes = notes;
    }

    @Override
    public String name() {
        return "addResolutionNotes";
    }

    @Override
    protected Alert update(Alert current, LocalDateTime now) {
        return current.toBuilder().resolutionNotes(notes).build();
    }
}
