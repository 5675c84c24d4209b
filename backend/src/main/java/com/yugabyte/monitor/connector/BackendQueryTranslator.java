package com.yugabyte.monitor.connector;

import com.yugabyte.monitor.model.QueryDescriptor;

import java.util.Optional;

/**
 * Turns a parsed question into a backend's native query.
 * An empty result means the backend cannot answer this question.
 */
public interface BackendQueryTranslator {

    Optional<TranslatedQuery> translate(QueryDescriptor descriptor);
}
