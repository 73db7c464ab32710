package com.servealert.domain.model;

import java.time.LocalTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QuietHours {

    private boolean enabled;

    @Builder.Default
    private LocalTime start = LocalTime.of(22, 0);

    @Builder.Default
    private LocalTime end = LocalTime.of(7, 0);

    /** True when the window runs past midnight, e.g. 22:00 to 07:00. */
    public boolean wrapsMidnight() {
        return start.isAfter(end);
    }
}
