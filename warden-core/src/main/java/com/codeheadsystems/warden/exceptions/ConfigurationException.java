package com.codeheadsystems.warden.exceptions;

/**
 * Invalid startup configuration: missing secret, unsupported algorithm, nonsensical TTLs.
 * Raised while building components, never per request.
 */
public class ConfigurationException extends WardenException {

  /**
   * Instantiates a new Configuration exception.
   *
   * @param message the message
   */
  public ConfigurationException(final String message) {
    super(ErrorCode.CONFIG_ERROR, message);
  }

  /**
   * Instantiates a new Configuration exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ConfigurationException(final String message, final Throwable cause) {
    super(ErrorCode.CONFIG_ERROR, message, cause);
  }
}
