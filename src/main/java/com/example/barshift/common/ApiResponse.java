package com.example.barshift.common;

import java.util.Collections;
import java.util.Map;

/**
 * Common API response wrapper.
 * <p>
 * Clients branch on the {@code success} flag and read the payload from {@code data},
 * so every endpoint returns this shape.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
