package com.responseready.sessionmonitor.storage;

import java.util.List;

/** Credential slots shared by every tab of the client. */
public final class StorageKeys {

  public static final String AUTH_TOKEN = "auth-token";
  public static final String REFRESH_TOKEN = "refresh-token";
  public static final String CURRENT_USER = "response-ready-current-user";
  public static final String CURRENT_USER_ID = "response-ready-current-user-id";

  /** Everything a logout removes. */
  public static final List<String> CREDENTIALS =
      List.of(AUTH_TOKEN, REFRESH_TOKEN, CURRENT_USER, CURRENT_USER_ID);

  private StorageKeys() {}

  /** Keys whose change in another tab means a login or logout happened there. */
  public static boolean isSessionKey(String key) {
    return AUTH_TOKEN.equals(key) || CURRENT_USER_ID.equals(key);
  }
}
