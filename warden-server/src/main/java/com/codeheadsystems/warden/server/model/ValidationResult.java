package com.codeheadsystems.warden.server.model;

import com.codeheadsystems.warden.exceptions.WardenException;
import com.codeheadsystems.warden.server.store.Subject;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Per-credential outcome of a batch validation.
 *
 * @param valid     whether the credential is currently usable
 * @param claims    the verified claims, when valid
 * @param subject   the subject, when valid
 * @param errorCode stable error code, when invalid
 * @param error     user-safe message, when invalid
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResult(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("claims") Map<String, Object> claims,
    @JsonProperty("subject") Subject subject,
    @JsonProperty("error_code") String errorCode,
    @JsonProperty("error") String error) {

  public static ValidationResult valid(AuthenticatedSubject authenticated) {
    return new ValidationResult(true, authenticated.claims().asMap(), authenticated.subject(), null, null);
  }

  public static ValidationResult invalid(WardenException e) {
    return new ValidationResult(false, null, null, e.errorCode().code(), e.getMessage());
  }
}
