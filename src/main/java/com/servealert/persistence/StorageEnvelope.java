package com.servealert.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored form of every persisted value: the JSON payload and when it was written.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StorageEnvelope {

    private JsonNode payload;
    private LocalDateTime timestamp;
}
