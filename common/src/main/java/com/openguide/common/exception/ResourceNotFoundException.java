package com.openguide.common.exception;

/**
 * A trip, guide, user, place or call session that does not exist.
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String message) {
        super(message, "RESOURCE_NOT_FOUND");
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s %s not found", resourceType, identifier), "RESOURCE_NOT_FOUND");
    }
}
