package com.rangerewards.exception;

import java.util.Map;

public class OperationInProgressException extends BaseException {

    public OperationInProgressException(String operation) {
        super(
                ErrorCode.OPERATION_IN_PROGRESS,
                String.format("Operation %s is already in progress", operation),
                Map.of("operation", operation));
    }
}
