package com.codeheadsystems.warden.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SubjectStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All subjects are lost on restart. Suitable for development and testing only.
 */
public class InMemorySubjectStore implements SubjectStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySubjectStore.class);

  private final ConcurrentHashMap<String, Subject> subjects = new ConcurrentHashMap<>();

  public InMemorySubjectStore() {
    log.warn("Using InMemorySubjectStore: subjects will NOT survive restarts. "
        + "Replace with a persistent SubjectStore for production.");
  }

  @Override
  public Optional<Subject> findById(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(subjects.get(id));
  }

  /**
   * Stores or replaces a subject.
   *
   * @param subject the subject
   */
  public void save(Subject subject) {
    subjects.put(subject.id(), subject);
    log.debug("Saved subject id={}", subject.id());
  }

  /**
   * Removes a subject, if present.
   *
   * @param id the subject id
   */
  public void delete(String id) {
    subjects.remove(id);
  }
}
