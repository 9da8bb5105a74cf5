package com.codeheadsystems.warden.server;

import com.codeheadsystems.warden.common.RandomProvider;
import com.codeheadsystems.warden.digest.PasswordDigester;
import com.codeheadsystems.warden.server.config.WardenConfiguration;
import com.codeheadsystems.warden.server.manager.CredentialLifecycleManager;
import com.codeheadsystems.warden.server.manager.PasswordAuthenticator;
import com.codeheadsystems.warden.server.store.DenylistStore;
import com.codeheadsystems.warden.server.store.InMemoryDenylistStore;
import com.codeheadsystems.warden.server.store.InMemorySubjectStore;
import com.codeheadsystems.warden.server.store.SubjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the digester, signing context, lifecycle manager and password authenticator from one
 * {@link WardenConfiguration}.
 * <p>
 * With in-memory stores (dev/test only):
 * <pre>{@code
 *   Warden warden = Warden.inMemory(new WardenConfigurationLoader().load());
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   Warden warden = Warden.create(configuration, mySubjectStore, myDenylistStore);
 *   TokenPair pair = warden.passwords().login(id, password, Map.of("role", "admin")).tokens();
 * }</pre>
 */
public class Warden {

  private static final Logger log = LoggerFactory.getLogger(Warden.class);

  private final PasswordDigester digester;
  private final CredentialLifecycleManager tokens;
  private final PasswordAuthenticator passwords;
  private final SubjectStore subjectStore;
  private final DenylistStore denylistStore;

  private Warden(WardenConfiguration configuration,
                 SubjectStore subjectStore,
                 DenylistStore denylistStore) {
    configuration.validate();
    this.subjectStore = subjectStore;
    this.denylistStore = denylistStore;
    this.digester = new PasswordDigester(configuration.toDigestParameters(), new RandomProvider());
    this.tokens = new CredentialLifecycleManager(
        configuration.toSigningContext(), subjectStore, denylistStore);
    this.passwords = new PasswordAuthenticator(
        digester, configuration.toPasswordPolicy(), subjectStore, tokens);
    log.info("Warden ready: {}", configuration.describe());
  }

  /**
   * Builds a Warden backed by the supplied stores.
   *
   * @param configuration the configuration; validated here
   * @param subjectStore  subject lookups
   * @param denylistStore revocation state
   * @return the assembly
   */
  public static Warden create(WardenConfiguration configuration,
                              SubjectStore subjectStore,
                              DenylistStore denylistStore) {
    return new Warden(configuration, subjectStore, denylistStore);
  }

  /**
   * Builds a Warden backed by in-memory stores.
   * <p>
   * For dev/test only. Subjects and revocations are lost on restart.
   *
   * @param configuration the configuration; validated here
   * @return the assembly
   */
  public static Warden inMemory(WardenConfiguration configuration) {
    log.warn("""
        #################################################################
        # WARNING: Using in-memory subject and denylist stores.         #
        # Subjects and revocations will be lost on restart.             #
        # Do not use in production.                                     #
        #################################################################
        """);
    return new Warden(configuration, new InMemorySubjectStore(), new InMemoryDenylistStore());
  }

  /**
   * Credential lifecycle operations.
   *
   * @return the manager
   */
  public CredentialLifecycleManager tokens() {
    return tokens;
  }

  /**
   * Password login and password hashing.
   *
   * @return the authenticator
   */
  public PasswordAuthenticator passwords() {
    return passwords;
  }

  public PasswordDigester digester() {
    return digester;
  }

  public SubjectStore subjectStore() {
    return subjectStore;
  }

  public DenylistStore denylistStore() {
    return denylistStore;
  }
}
