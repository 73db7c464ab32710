package com.servealert.recovery;

import com.servealert.domain.enums.ErrorCategory;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ErrorStatistics {

    int totalErrors;
    Map<ErrorCategory, Long> errorsByCategory;

    /** Up to ten errors from the last 24 hours, oldest first. */
    List<AppError> recentErrors;

    /** Share of logged errors marked recoverable. */
    double recoverableRate;
}
