package com.codeheadsystems.warden.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An access credential and its companion refresh credential, issued together.
 *
 * @param accessToken  short-lived bearer credential
 * @param refreshToken long-lived credential, usable once to obtain a new pair
 */
public record TokenPair(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken) {

  @Override
  public String toString() {
    return "TokenPair[access_token=***, refresh_token=***]";
  }
}
