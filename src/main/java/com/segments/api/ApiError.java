package com.segments.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body: {@code {"error": "NOT_FOUND", "detail": "User not found."}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {

    private String error;
    private String detail;
}
