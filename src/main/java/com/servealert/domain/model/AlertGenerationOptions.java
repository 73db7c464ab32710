package com.servealert.domain.model;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertType;
import com.servealert.domain.enums.DemoScenario;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional overrides for a generation run.
 *
 * <p>Distributions are percent weights; when present they replace the weights the
 * synthesis engine would otherwise derive from the restaurant context.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertGenerationOptions {

    private Integer alertCount;
    private DemoScenario scenario;
    private Map<AlertPriority, Double> priorityDistribution;
    private Map<AlertType, Double> typeDistribution;

    public static AlertGenerationOptions none() {
        return AlertGenerationOptions.builder().build();
    }
}
