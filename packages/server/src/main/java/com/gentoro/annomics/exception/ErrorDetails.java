package com.gentoro.annomics.exception;

import java.time.Instant;
import java.util.Map;

/** Flattened, serializable view of a failure, used for logging and error responses. */
public record ErrorDetails(
    String type,
    String message,
    AnnomicsErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
