package com.servealert.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.servealert.config.RedisConfig;
import com.servealert.config.ServeAlertProperties;
import com.servealert.domain.enums.PermissionStatus;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.NotificationSettings;
import com.servealert.domain.model.RestaurantProfile;
import com.servealert.domain.model.UserPreferences;
import com.servealert.exception.StorageException;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Persists alert engine state as timestamped JSON envelopes in a {@link KeyValueStore}.
 *
 * <p>The alert list is the only value that expires: an envelope older than
 * {@code servealert.storage.expiry} loads as an empty list. A value that cannot be
 * parsed is deleted and treated as absent, so callers never see a raw parse error;
 * failures of the store itself surface as {@link StorageException}.
 *
 * <p>Export, import and backup operate on a JSON object keyed by logical name
 * ({@code alerts}, {@code alertHistory}, {@code notificationSettings},
 * {@code restaurantProfile}, {@code userPreferences}, {@code permissionStatus}),
 * each entry holding the stored envelope as-is.
 */
@Service
public class AlertStorageService {

    private static final Logger log = LoggerFactory.getLogger(AlertStorageService.class);

    public static final String BACKUP_VERSION = "1.0";

    private static final TypeReference<List<Alert>> ALERT_LIST = new TypeReference<>() {};

    private static final Map<String, String> EXPORT_KEYS = new LinkedHashMap<>();

    static {
        EXPORT_KEYS.put("alerts", RedisConfig.KEY_ALERTS);
        EXPORT_KEYS.put("alertHistory", RedisConfig.KEY_ALERT_HISTORY);
        EXPORT_KEYS.put("notificationSettings", RedisConfig.KEY_NOTIFICATION_SETTINGS);
        EXPORT_KEYS.put("restaurantProfile", RedisConfig.KEY_RESTAURANT_PROFILE);
        EXPORT_KEYS.put("userPreferences", RedisConfig.KEY_USER_PREFERENCES);
        EXPORT_KEYS.put("permissionStatus", RedisConfig.KEY_PERMISSION_STATUS);
    }

    private final KeyValueStore keyValueStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration alertExpiry;

    public AlertStorageService(
            KeyValueStore keyValueStore, ObjectMapper objectMapper, Clock clock, ServeAlertProperties properties) {
        this.keyValueStore = keyValueStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.alertExpiry = properties.getStorage().getExpiry();
    }

    // ---- Alerts ----

    public void saveAlerts(List<Alert> alerts) {
        write(RedisConfig.KEY_ALERTS, alerts);
        log.debug("Saved {} alerts", alerts.size());
    }

    public List<Alert> loadAlerts() {
        Optional<StorageEnvelope> envelope = readEnvelope(RedisConfig.KEY_ALERTS);
        if (envelope.isEmpty()) {
            return List.of();
        }
        if (isExpired(envelope.get())) {
            log.info(
                    "Stored alerts written at {} are older than {}, ignoring",
                    envelope.get().getTimestamp(),
                    alertExpiry);
            return List.of();
        }
        return convert(RedisConfig.KEY_ALERTS, envelope.get().getPayload(), ALERT_LIST)
                .orElse(List.of());
    }

    /** Stores only RESOLVED and DISMISSED alerts; open alerts in the input are skipped. */
    public void saveAlertHistory(List<Alert> alerts) {
        List<Alert> closed =
                alerts.stream().filter(alert -> alert.getStatus().isTerminal()).toList();
        write(RedisConfig.KEY_ALERT_HISTORY, closed);
    }

    public List<Alert> loadAlertHistory() {
        return readPayload(RedisConfig.KEY_ALERT_HISTORY, ALERT_LIST).orElse(List.of());
    }

    /** Drops the cached alert list only; settings, profile and history stay. */
    public void clearCache() {
        keyValueStore.delete(RedisConfig.KEY_ALERTS);
    }

    // ---- Settings, profile, preferences, permission ----

    public void saveNotificationSettings(NotificationSettings settings) {
        write(RedisConfig.KEY_NOTIFICATION_SETTINGS, settings);
    }

    /** Stored fields are laid over the defaults, so a partial or older copy still loads. */
    public NotificationSettings loadNotificationSettings() {
        Optional<StorageEnvelope> envelope = readEnvelope(RedisConfig.KEY_NOTIFICATION_SETTINGS);
        if (envelope.isEmpty()) {
            return NotificationSettings.defaults();
        }
        try {
            return objectMapper
                    .readerForUpdating(NotificationSettings.defaults())
                    .readValue(envelope.get().getPayload());
        } catch (IOException e) {
            discardCorrupt(RedisConfig.KEY_NOTIFICATION_SETTINGS, e.getMessage());
            return NotificationSettings.defaults();
        }
    }

    public void saveRestaurantProfile(RestaurantProfile profile) {
        write(RedisConfig.KEY_RESTAURANT_PROFILE, profile);
    }

    public Optional<RestaurantProfile> loadRestaurantProfile() {
        return readPayload(RedisConfig.KEY_RESTAURANT_PROFILE, new TypeReference<RestaurantProfile>() {});
    }

    public void saveUserPreferences(UserPreferences preferences) {
        write(RedisConfig.KEY_USER_PREFERENCES, preferences);
    }

    public UserPreferences loadUserPreferences() {
        return readPayload(RedisConfig.KEY_USER_PREFERENCES, new TypeReference<UserPreferences>() {})
                .orElseGet(() -> UserPreferences.builder().build());
    }

    public void savePermissionStatus(PermissionStatus status) {
        write(RedisConfig.KEY_PERMISSION_STATUS, status);
    }

    public Optional<PermissionStatus> loadPermissionStatus() {
        return readPayload(RedisConfig.KEY_PERMISSION_STATUS, new TypeReference<PermissionStatus>() {});
    }

    // ---- Whole-store operations ----

    public void clearAll() {
        for (String key : EXPORT_KEYS.values()) {
            keyValueStore.delete(key);
        }
        log.info("Cleared all persisted alert data");
    }

    public String exportAll() {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(exportTree());
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to export data", e);
        }
    }

    /** Writes every non-null entry of an export blob back under its key. Absent entries are left alone. */
    public void importAll(String exportJson) {
        importTree(parse(exportJson, "import"));
    }

    public String createBackup() {
        ObjectNode backup = objectMapper.createObjectNode();
        backup.put("version", BACKUP_VERSION);
        backup.put("timestamp", LocalDateTime.now(clock).toString());
        backup.set("data", exportTree());
        try {
            return objectMapper.writeValueAsString(backup);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to create backup", e);
        }
    }

    /**
     * Replaces everything stored with the contents of a backup.
     *
     * @throws StorageException if the blob is not JSON or its {@code data} entry is missing
     *     or not an object; nothing is cleared in that case
     */
    public void restoreFromBackup(String backupJson) {
        JsonNode backup = parse(backupJson, "restore");
        JsonNode data = backup.get("data");
        if (data == null || data.isNull()) {
            throw new StorageException("Invalid backup format: missing data");
        }
        if (data.isTextual()) {
            data = parse(data.asText(), "restore");
        }
        if (!data.isObject()) {
            throw new StorageException("Invalid backup format: data is not an object");
        }
        clearAll();
        importTree(data);
        log.info("Restored persisted data from backup version {}", backup.path("version").asText("unknown"));
    }

    /** Structural checks over what is stored. An empty error list means the data is usable. */
    public StorageValidationResult validateStoredData() {
        List<String> errors = new ArrayList<>();
        try {
            for (Alert alert : loadAlerts()) {
                if (!isValidAlert(alert)) {
                    errors.add("Invalid alert structure: " + alert.getId());
                }
            }
            if (!isValidSettings(loadNotificationSettings())) {
                errors.add("Invalid notification settings structure");
            }
            Optional<RestaurantProfile> profile = loadRestaurantProfile();
            if (profile.isPresent() && !isValidProfile(profile.get())) {
                errors.add("Invalid restaurant profile structure");
            }
        } catch (StorageException e) {
            errors.add("Validation error: " + e.getMessage());
        }
        return new StorageValidationResult(errors);
    }

    // ---- Internals ----

    private void write(String key, Object value) {
        StorageEnvelope envelope = new StorageEnvelope(objectMapper.valueToTree(value), LocalDateTime.now(clock));
        try {
            keyValueStore.put(key, objectMapper.writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            throw new StorageException("serialize", key, e);
        }
    }

    private Optional<StorageEnvelope> readEnvelope(String key) {
        Optional<String> raw = keyValueStore.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            StorageEnvelope envelope = objectMapper.readValue(raw.get(), StorageEnvelope.class);
            if (envelope.getPayload() == null || envelope.getPayload().isNull()) {
                discardCorrupt(key, "missing payload");
                return Optional.empty();
            }
            return Optional.of(envelope);
        } catch (JsonProcessingException e) {
            discardCorrupt(key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private <T> Optional<T> readPayload(String key, TypeReference<T> type) {
        return readEnvelope(key).flatMap(envelope -> convert(key, envelope.getPayload(), type));
    }

    private <T> Optional<T> convert(String key, JsonNode payload, TypeReference<T> type) {
        try {
            return Optional.ofNullable(objectMapper.convertValue(payload, type));
        } catch (IllegalArgumentException e) {
            discardCorrupt(key, e.getMessage());
            return Optional.empty();
        }
    }

    private void discardCorrupt(String key, String reason) {
        log.error(
                "Stored value for key {} is unreadable ({}), clearing it at {}", key, reason, LocalDateTime.now(clock));
        keyValueStore.delete(key);
    }

    private boolean isExpired(StorageEnvelope envelope) {
        if (envelope.getTimestamp() == null) {
            return true;
        }
        return envelope.getTimestamp().plus(alertExpiry).isBefore(LocalDateTime.now(clock));
    }

    private ObjectNode exportTree() {
        ObjectNode data = objectMapper.createObjectNode();
        EXPORT_KEYS.forEach((name, key) -> {
            Optional<String> raw = keyValueStore.get(key);
            JsonNode node = NullNode.getInstance();
            if (raw.isPresent()) {
                try {
                    node = objectMapper.readTree(raw.get());
                } catch (JsonProcessingException e) {
                    log.warn("Skipping unreadable value for {} in export: {}", name, e.getOriginalMessage());
                }
            }
            data.set(name, node);
        });
        return data;
    }

    private void importTree(JsonNode data) {
        if (!data.isObject()) {
            throw new StorageException("Invalid import format: expected a JSON object");
        }
        Iterator<Map.Entry<String, String>> entries = EXPORT_KEYS.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<String, String> entry = entries.next();
            JsonNode node = data.get(entry.getKey());
            if (node != null && !node.isNull()) {
                keyValueStore.put(entry.getValue(), node.toString());
            }
        }
    }

    private JsonNode parse(String json, String operation) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to " + operation + " data: " + e.getOriginalMessage(), e);
        }
    }

    private boolean isValidAlert(Alert alert) {
        return alert.getId() != null
                && alert.getType() != null
                && alert.getPriority() != null
                && alert.getStatus() != null
                && alert.getTitle() != null
                && alert.getMessage() != null
                && alert.getTimestamp() != null;
    }

    private boolean isValidSettings(NotificationSettings settings) {
        return settings.getQuietHours() != null
                && settings.getQuietHours().getStart() != null
                && settings.getQuietHours().getEnd() != null
                && settings.getMinimumPriority() != null
                && settings.getTypeFilters() != null
                && settings.getMaxPerHour() > 0;
    }

    private boolean isValidProfile(RestaurantProfile profile) {
        return profile.getId() != null
                && profile.getName() != null
                && profile.getType() != null
                && profile.getCapacity() > 0
                && profile.getStaffCount() >= 0
                && profile.getHoursOfOperation() != null;
    }
}
