package com.rangerewards.exception;

import java.util.Map;

public class UnauthorizedException extends BaseException {

    public UnauthorizedException(String operation, String caller) {
        super(
                ErrorCode.UNAUTHORIZED,
                String.format("Caller %s is not allowed to %s", caller, operation),
                Map.of("operation", operation, "caller", String.valueOf(caller)));
    }
}
