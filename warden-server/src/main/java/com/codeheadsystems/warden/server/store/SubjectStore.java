package com.codeheadsystems.warden.server.store;

import java.util.Optional;

/**
 * Read access to subjects.
 * <p>
 * Implementations must be thread-safe. Any {@link RuntimeException} thrown is reported to callers
 * as {@link com.codeheadsystems.warden.exceptions.StoreUnavailableException}.
 */
public interface SubjectStore {

  /**
   * Looks up a subject.
   *
   * @param id the subject id
   * @return the subject, or empty if it does not exist
   */
  Optional<Subject> findById(String id);
}
