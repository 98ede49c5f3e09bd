package com.gentoro.annomics.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of every failure raised by the server. Each instance carries an {@link
 * AnnomicsErrorCode} so that the dispatcher and the transport can branch on the kind of failure
 * without inspecting messages.
 */
public class AnnomicsException extends RuntimeException {
  private final AnnomicsErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public AnnomicsException(AnnomicsErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public AnnomicsException(AnnomicsErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public AnnomicsErrorCode getCode() {
    return code;
  }

  /** Attach a diagnostic key/value pair; returns this exception for fluent use. */
  public AnnomicsException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }
}
