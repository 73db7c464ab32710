package com.servealert.persistence;

import java.util.List;

/**
 * Problems found by {@link AlertStorageService#validateStoredData()}.
 */
public record StorageValidationResult(List<String> errors) {

    public boolean isValid() {
        return errors.isEmpty();
    }
}
