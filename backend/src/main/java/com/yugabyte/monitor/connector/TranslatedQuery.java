package com.yugabyte.monitor.connector;

import lombok.Value;

/**
 * A native query plus the options it must be executed with.
 */
@Value
public class TranslatedQuery {
    String query;
    QueryOptions options;
}
