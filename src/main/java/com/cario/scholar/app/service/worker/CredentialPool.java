package com.cario.scholar.app.service.worker;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.log4j.Log4j2;

/**
 * Ordered pool of access credentials for one external source, with a single active index.
 *
 * <p>All reads and rotations go through one lock. A rotation names the credential that failed and
 * only advances when that credential is still active, so two workers reporting the same exhausted
 * key move the index once.
 */
@Log4j2
public class CredentialPool {

  private final String source;
  private final List<String> credentials;
  private final boolean metered;
  private final ReentrantLock lock = new ReentrantLock();
  private int index;

  public CredentialPool(String source, List<String> credentials) {
    this(source, credentials, true);
  }

  private CredentialPool(String source, List<String> credentials, boolean metered) {
    this.source = Objects.requireNonNull(source, "source");
    this.metered = metered;
    this.credentials =
        credentials == null
            ? List.of()
            : credentials.stream().filter(c -> c != null && !c.isBlank()).toList();
  }

  /** Pool with one placeholder credential, for sources that are not keyed per call. */
  public static CredentialPool single(String source) {
    return new CredentialPool(source, List.of(source));
  }

  /**
   * Pool for plain downloads. Errors from an unmetered source are never treated as quota
   * exhaustion, only retried.
   */
  public static CredentialPool unmetered(String source) {
    return new CredentialPool(source, List.of(source), false);
  }

  public boolean isMetered() {
    return metered;
  }

  public String getSource() {
    return source;
  }

  public int size() {
    return credentials.size();
  }

  /** Active credential, or null when the pool is exhausted. */
  public String current() {
    lock.lock();
    try {
      return index < credentials.size() ? credentials.get(index) : null;
    } finally {
      lock.unlock();
    }
  }

  public int currentIndex() {
    lock.lock();
    try {
      return index;
    } finally {
      lock.unlock();
    }
  }

  public boolean isExhausted() {
    return current() == null;
  }

  /**
   * Retires {@code failed} if it is still active.
   *
   * @return true when a usable credential remains
   */
  public boolean rotateFrom(String failed) {
    lock.lock();
    try {
      if (index < credentials.size() && credentials.get(index).equals(failed)) {
        index++;
        if (index < credentials.size()) {
          log.warn("credentials.rotate source={} index={}/{}", source, index, credentials.size());
        } else {
          log.warn("credentials.exhausted source={} size={}", source, credentials.size());
        }
      }
      return index < credentials.size();
    } finally {
      lock.unlock();
    }
  }

  /** Back to the first credential, e.g. when a paused session is resumed. */
  public void reset() {
    lock.lock();
    try {
      index = 0;
    } finally {
      lock.unlock();
    }
    log.info("credentials.reset source={}", source);
  }
}
