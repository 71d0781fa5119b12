package com.rangerewards.exception;

import java.util.Map;

/** An unknown pool, position or distributor. The details name which one. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s '%s' not found", resourceType, identifier),
                Map.of("resourceType", resourceType, "identifier", String.valueOf(identifier)));
    }
}
