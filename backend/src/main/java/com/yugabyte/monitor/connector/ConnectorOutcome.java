package com.yugabyte.monitor.connector;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Result of one connector call: data, empty success, or an isolated failure.
 * Items are never null; a failed outcome carries an empty list so callers can
 * aggregate "no data" and "backend down" the same way.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConnectorOutcome<E> {

    public enum Status { DATA, EMPTY, FAILED }

    private final Status status;
    private final List<E> items;
    private final FailureKind failureKind;
    private final String cause;

    public static <E> ConnectorOutcome<E> success(List<E> items) {
        if (items == null || items.isEmpty()) {
            return empty();
        }
        return new ConnectorOutcome<>(Status.DATA, Collections.unmodifiableList(new ArrayList<>(items)), null, null);
    }

    public static <E> ConnectorOutcome<E> empty() {
        return new ConnectorOutcome<>(Status.EMPTY, Collections.emptyList(), null, null);
    }

    public static <E> ConnectorOutcome<E> failure(FailureKind kind, String cause) {
        return new ConnectorOutcome<>(Status.FAILED, Collections.emptyList(), kind, cause);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean hasData() {
        return status == Status.DATA;
    }

    public int size() {
        return items.size();
    }

    /**
     * Union of the items of all outcomes, in iteration order. Failed outcomes contribute nothing.
     */
    public static <E> List<E> merge(Collection<ConnectorOutcome<E>> outcomes) {
        List<E> merged = new ArrayList<>();
        for (ConnectorOutcome<E> outcome : outcomes) {
            merged.addAll(outcome.getItems());
        }
        return merged;
    }

    @Override
    public String toString() {
        if (status == Status.FAILED) {
            return "FAILED(" + failureKind + ": " + cause + ")";
        }
        return status + "(" + items.size() + ")";
    }
}
