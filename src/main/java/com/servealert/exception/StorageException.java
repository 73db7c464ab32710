package com.servealert.exception;

import java.util.Map;

public class StorageException extends BaseException {

    public StorageException(String message) {
        super(ErrorCode.STORAGE_FAILURE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_FAILURE, message, cause);
    }

    public StorageException(String operation, String key, Throwable cause) {
        super(
                ErrorCode.STORAGE_FAILURE,
                String.format("Storage %s failed for key %s: %s", operation, key, cause.getMessage()),
                Map.of("operation", operation, "key", key),
                cause);
    }
}
