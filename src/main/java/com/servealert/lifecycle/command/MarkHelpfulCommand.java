package com.servealert.lifecycle.command;

import com.servealert.domain.model.Alert;
import java.time.LocalDateTime;

/** Records one helpful / not helpful vote. */
public class MarkHelpfulCommand extends SingleAlertCommand {

    private final boolean helpful;

    public MarkHelpfulCommand(String alertId, boolean helpful) {
        super(alertId);
        this.helpful = helpful;
    }

    @Override
    public String name() {
        return "markHelpful";
    }

    @Override
    protected Alert update(Alert current, LocalDateTime now) {
        Alert.AlertBuilder builder = current.toBuilder();
        if (helpful) {
            builder.helpfulVotes(current.getHelpfulVotes() + 1);
        } else {
            builder.notHelpfulVotes(current.getNotHelpfulVotes() + 1);
        }
        return builder.build();
    }
}
