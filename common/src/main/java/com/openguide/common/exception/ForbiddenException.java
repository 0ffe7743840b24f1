package com.openguide.common.exception;

/**
 * The caller is not the party allowed to act on the resource.
 * Kept distinct from {@link ResourceNotFoundException} so existence is never masked or leaked.
 */
public class ForbiddenException extends BusinessException {
    public ForbiddenException(String message) {
        super(message, "FORBIDDEN");
    }
}
