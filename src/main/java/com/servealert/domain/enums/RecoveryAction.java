package com.servealert.domain.enums;

/**
 * What the application does after a recoverable failure.
 */
public enum RecoveryAction {
    /** Keep serving the in-memory working set. */
    SHOW_CACHED,
    /** Ask the caller to retry. */
    RETRY_PROMPT,
    /** Clear persisted data and start from an empty store. */
    REINITIALIZE,
    /** Turn notifications off for this session; alerts stay visible in-app. */
    DEGRADE_GRACEFULLY,
    RESTART_REQUIRED
}
