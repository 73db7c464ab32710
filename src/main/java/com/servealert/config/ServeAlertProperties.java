package com.servealert.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the alert engine, bound to {@code servealert.*}.
 *
 * <p>Tests construct this class directly and rely on the field defaults, which
 * mirror {@code application.yml}.
 */
@Configuration
@ConfigurationProperties(prefix = "servealert")
@Getter
@Setter
public class ServeAlertProperties {

    private Cache cache = new Cache();
    private Storage storage = new Storage();
    private Simulation simulation = new Simulation();
    private Notifications notifications = new Notifications();
    private ErrorLog errorLog = new ErrorLog();

    @Getter
    @Setter
    public static class Cache {

        /** How long the lifecycle working set is trusted before it is reloaded from storage. */
        private Duration ttl = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Storage {

        /** Persisted alert blobs older than this load as empty. */
        private Duration expiry = Duration.ofHours(24);

        private String keyPrefix = "servealert:";
    }

    @Getter
    @Setter
    public static class Simulation {

        private Duration interval = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Notifications {

        /** STOMP destination the default device gateway publishes to. */
        private String destination = "/topic/notifications";

        /** Answer given by the default device gateway to a permission request. */
        private boolean autoGrantPermission = true;

        /** Most recent notification responses kept for inspection. */
        private int responseHistoryCapacity = 100;
    }

    @Getter
    @Setter
    public static class ErrorLog {

        private int capacity = 100;
    }
}
