package com.responseready.sessionmonitor.storage;

import java.util.Optional;

/** Durable key/value slots holding the client's tokens and current user. */
public interface CredentialStorage {

  Optional<String> get(String key);

  void put(String key, String value);

  void remove(String key);

  default void removeAll(Iterable<String> keys) {
    for (String key : keys) {
      remove(key);
    }
  }
}
