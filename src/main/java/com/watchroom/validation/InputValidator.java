package com.watchroom.validation;

import java.lang.annotation.Annotation;
import java.util.Comparator;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.watchroom.config.WatchRoomProperties;
import com.watchroom.dto.ErrorResponse.ErrorCode;
import com.watchroom.exception.RoomException;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Centralized input validation for room requests and relayed chat.
 */
@Component
public class InputValidator {

    private final Validator validator;
    private final int maxChatLength;

    public InputValidator(Validator validator, WatchRoomProperties properties) {
        this.validator = validator;
        this.maxChatLength = properties.getChat().getMaxLength();
    }

    /**
     * Validate a request DTO against its constraint annotations.
     * Throws RoomException carrying VAL_002 for missing fields and VAL_003 for oversized ones.
     * Display strings should be sanitized first so that blank-after-sanitizing is caught.
     */
    public <T> void validate(T request) {
        if (request == null) {
            throw new RoomException(ErrorCode.VAL_002, "Request payload is required");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return;
        }

        // Report one violation, deterministically
        ConstraintViolation<T> first = violations.stream()
                .min(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .orElseThrow();
        throw new RoomException(codeFor(first.getConstraintDescriptor().getAnnotation()), first.getMessage());
    }

    /**
     * Check chat content (non-throwing; relay events are dropped rather than answered).
     */
    public boolean isValidChatContent(String content) {
        return content != null && !content.isBlank() && content.length() <= maxChatLength;
    }

    /**
     * Sanitize display strings (remove control characters, trim).
     */
    public String sanitize(String input) {
        if (input == null) {
            return null;
        }
        return input.replaceAll("[\\p{Cntrl}&&[^\r\n\t]]", "").trim();
    }

    private ErrorCode codeFor(Annotation constraint) {
        if (constraint instanceof NotBlank || constraint instanceof NotNull) {
            return ErrorCode.VAL_002;
        }
        if (constraint instanceof Size || constraint instanceof MaxUtf8Bytes) {
            return ErrorCode.VAL_003;
        }
        return ErrorCode.VAL_001;
    }
}
