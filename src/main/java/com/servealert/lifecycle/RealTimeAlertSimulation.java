package com.servealert.lifecycle;

import com.servealert.config.ServeAlertProperties;
import com.servealert.domain.enums.DayType;
import com.servealert.domain.enums.TimeOfDay;
import com.servealert.domain.model.RestaurantContext;
import com.servealert.domain.model.RestaurantProfile;
import com.servealert.domain.model.SimulationContext;
import com.servealert.scheduling.NotificationScheduler;
import com.servealert.scheduling.SimulationHandle;
import com.servealert.synthesis.AlertSynthesisEngine;
import com.servealert.synthesis.RestaurantProfileFactory;
import java.time.Clock;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Live alert feed for one restaurant. Each successful tick takes a fresh context snapshot
 * from the profile and creates one alert through the lifecycle manager.
 *
 * <p>The tick probability is fixed when the feed starts (time of day, weekday or weekend,
 * restaurant type). Restart the feed to pick up a new period.
 */
@Service
public class RealTimeAlertSimulation {

    private static final Logger log = LoggerFactory.getLogger(RealTimeAlertSimulation.class);

    private final NotificationScheduler notificationScheduler;
    private final AlertLifecycleService alertLifecycleService;
    private final AlertSynthesisEngine alertSynthesisEngine;
    private final RestaurantProfileFactory restaurantProfileFactory;
    private final ServeAlertProperties properties;
    private final Clock clock;

    private SimulationHandle handle;

    public RealTimeAlertSimulation(
            NotificationScheduler notificationScheduler,
            AlertLifecycleService alertLifecycleService,
            AlertSynthesisEngine alertSynthesisEngine,
            RestaurantProfileFactory restaurantProfileFactory,
            ServeAlertProperties properties,
            Clock clock) {
        this.notificationScheduler = notificationScheduler;
        this.alertLifecycleService = alertLifecycleService;
        this.alertSynthesisEngine = alertSynthesisEngine;
        this.restaurantProfileFactory = restaurantProfileFactory;
        this.properties = properties;
        this.clock = clock;
    }

    /** Starts the feed, replacing one that is already running. */
    public synchronized SimulationHandle start(RestaurantProfile profile) {
        stop();

        SimulationContext context = simulationContext(profile);
        long intervalMs = properties.getSimulation().getInterval().toMillis();
        handle = notificationScheduler.startRealTimeSimulation(context, intervalMs, () -> onTick(profile));
        log.info("Live alert feed started for {} ({}, {}, {})",
                profile.getName(), context.getTimeOfDay(), context.getDayType(), context.getScenario());
        return handle;
    }

    /** @return true if a running feed was stopped */
    public synchronized boolean stop() {
        if (handle == null) {
            return false;
        }
        boolean stopped = handle.cancel();
        handle = null;
        if (stopped) {
            log.info("Live alert feed stopped");
        }
        return stopped;
    }

    public synchronized boolean isRunning() {
        return handle != null && !handle.isCancelled();
    }

    SimulationContext simulationContext(RestaurantProfile profile) {
        LocalDateTime now = LocalDateTime.now(clock);
        RestaurantContext snapshot = restaurantProfileFactory.generateRestaurantContext(profile);
        return SimulationContext.builder()
                .scenario(alertSynthesisEngine.selectDemoScenario(snapshot))
                .restaurantType(profile.getType())
                .timeOfDay(TimeOfDay.fromHour(now.getHour()))
                .dayType(DayType.of(now.getDayOfWeek()))
                .build();
    }

    private void onTick(RestaurantProfile profile) {
        RestaurantContext context = restaurantProfileFactory.generateRestaurantContext(profile);
        alertLifecycleService.createRealTimeAlert(context);
    }
}
