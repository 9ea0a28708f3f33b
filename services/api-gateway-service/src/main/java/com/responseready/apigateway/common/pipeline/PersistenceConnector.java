package com.responseready.apigateway.common.pipeline;

/** Makes sure the persistence layer is reachable before a handler uses it. */
public interface PersistenceConnector {

  /**
   * @throws org.springframework.dao.DataAccessException when the store cannot be reached
   */
  void ensureConnected();
}
