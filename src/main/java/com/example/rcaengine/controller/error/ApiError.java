package com.example.rcaengine.controller.error;

import java.time.Instant;
import java.util.Map;

public record ApiError(
        Instant timestamp,
        ErrorCode code,
        String message,
        Map<String, Object> details
) { }
