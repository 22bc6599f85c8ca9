package net.spookly.dimensions.api;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;

/**
 * JSON response envelope for the reporting API.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ApiResponse {
    public final boolean ok;
    public final String message;
    public final Object data;

    public static ApiResponse ok(Object data) {
        return new ApiResponse(true, "ok", data);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse(false, message, null);
    }
}
