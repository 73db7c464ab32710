package com.servealert.domain.model;

import com.servealert.domain.enums.DayType;
import com.servealert.domain.enums.DemoScenario;
import com.servealert.domain.enums.RestaurantType;
import com.servealert.domain.enums.TimeOfDay;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs to the real-time simulation tick probability.
 */
@Value
@Builder
public class SimulationContext {

    DemoScenario scenario;
    RestaurantType restaurantType;
    TimeOfDay timeOfDay;
    DayType dayType;
}
