package com.responseready.sessionmonitor.storage;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCredentialStorage implements CredentialStorage {

  private final Map<String, String> values = new ConcurrentHashMap<>();

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public void put(String key, String value) {
    values.put(key, Objects.requireNonNull(value, "value"));
  }

  @Override
  public void remove(String key) {
    values.remove(key);
  }
}
