package com.scholary.dubbing.api;

import java.time.Instant;

/** Error body returned by every endpoint. */
public record ApiError(String errorCode, String message, Instant timestamp) {}
