package com.servealert.exception;

public class PermissionDeniedException extends BaseException {

    public PermissionDeniedException(String message) {
        super(ErrorCode.PERMISSION_DENIED, message);
    }
}
