package com.gentoro.annomics.exception;

/** Invalid or unreadable configuration. */
public class ConfigException extends AnnomicsException {
  public ConfigException(String message) {
    super(AnnomicsErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(AnnomicsErrorCode.CONFIG_ERROR, message, cause);
  }
}
