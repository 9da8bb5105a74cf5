package com.codeheadsystems.warden.server.model;

import com.codeheadsystems.warden.server.store.Subject;
import com.codeheadsystems.warden.token.ClaimSet;

/**
 * Outcome of a successful access credential validation.
 *
 * @param subject the current subject record
 * @param claims  the verified claims of the credential
 */
public record AuthenticatedSubject(Subject subject, ClaimSet claims) {
}
