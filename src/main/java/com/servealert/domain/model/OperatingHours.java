package com.servealert.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.LocalTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Opening window for one weekday. {@code close} before {@code open} means the
 * restaurant closes after midnight.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperatingHours {

    private LocalTime open;
    private LocalTime close;
    private boolean closed;

    @JsonIgnore
    public boolean isOvernight() {
        return close.isBefore(open);
    }
}
