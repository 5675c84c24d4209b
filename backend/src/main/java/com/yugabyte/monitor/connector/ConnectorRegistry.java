package com.yugabyte.monitor.connector;

import com.yugabyte.monitor.model.ConnectorHealth;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Holds the configured connectors and runs operations across them concurrently.
 * <p>
 * Health is recomputed on every call. A fan-out only reaches connectors that are healthy at that
 * moment, and every one of them gets an entry in the result: a timeout or exception becomes a
 * failed {@link ConnectorOutcome} without affecting the others.
 */
@Slf4j
public class ConnectorRegistry implements AutoCloseable {

    private final List<MonitoringConnector> connectors;
    private final ExecutorService executor;
    private final Clock clock;

    public ConnectorRegistry(List<MonitoringConnector> connectors, Clock clock) {
        this.connectors = Collections.unmodifiableList(new ArrayList<>(connectors));
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "connector-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("Connector registry initialized with {} connector(s): {}", this.connectors.size(), getConnectorNames());
    }

    public List<String> getConnectorNames() {
        return connectors.stream().map(MonitoringConnector::getName).collect(Collectors.toList());
    }

    public List<MonitoringConnector> getConnectors() {
        return connectors;
    }

    public Optional<MonitoringConnector> getConnector(String name) {
        return connectors.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    public boolean isEmpty() {
        return connectors.isEmpty();
    }

    /**
     * Check every connector concurrently. A check that throws or overruns counts as unreachable.
     */
    public List<ConnectorHealth> checkHealth() {
        return checkHealth(null);
    }

    /**
     * Check every connector concurrently. Each check is bounded by its connector timeout, measured
     * from the moment all checks were started, and by {@code deadline} when one is given.
     */
    public List<ConnectorHealth> checkHealth(Instant deadline) {
        Instant start = clock.instant();
        Map<MonitoringConnector, CompletableFuture<ConnectorHealth>> checks = new LinkedHashMap<>();
        for (MonitoringConnector connector : connectors) {
            checks.put(connector, CompletableFuture.supplyAsync(connector::checkHealth, executor));
        }
        List<ConnectorHealth> results = new ArrayList<>();
        for (Map.Entry<MonitoringConnector, CompletableFuture<ConnectorHealth>> entry : checks.entrySet()) {
            MonitoringConnector connector = entry.getKey();
            Instant limit = start.plus(connector.getTimeout());
            if (deadline != null && deadline.isBefore(limit)) {
                limit = deadline;
            }
            long waitMillis = Math.max(0, Duration.between(clock.instant(), limit).toMillis());
            ConnectorHealth health;
            try {
                health = entry.getValue().get(waitMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                entry.getValue().cancel(true);
                health = new ConnectorHealth(connector.getName(), false, clock.instant());
            } catch (ExecutionException | TimeoutException e) {
                log.warn("Health check of {} did not complete: {}", connector.getName(), e.toString());
                entry.getValue().cancel(true);
                health = new ConnectorHealth(connector.getName(), false, clock.instant());
            }
            results.add(health);
        }
        return results;
    }

    /**
     * Health of every connector as name to reachable.
     */
    public Map<String, Boolean> healthCheckAll() {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (ConnectorHealth health : checkHealth()) {
            result.put(health.getConnectorName(), health.isReachable());
        }
        return result;
    }

    public List<MonitoringConnector> healthyConnectors() {
        return healthyConnectors(checkHealth());
    }

    /**
     * Connectors reported reachable by a health snapshot taken with {@link #checkHealth()}.
     */
    public List<MonitoringConnector> healthyConnectors(List<ConnectorHealth> health) {
        Map<String, Boolean> reachable = new LinkedHashMap<>();
        for (ConnectorHealth entry : health) {
            reachable.put(entry.getConnectorName(), entry.isReachable());
        }
        List<MonitoringConnector> healthy = new ArrayList<>();
        for (MonitoringConnector connector : connectors) {
            if (Boolean.TRUE.equals(reachable.get(connector.getName()))) {
                healthy.add(connector);
            } else {
                log.warn("Connector {} is unhealthy, excluded from this call", connector.getName());
            }
        }
        return healthy;
    }

    /**
     * Run {@code operation} on every healthy connector concurrently.
     *
     * @param label    operation name for logs
     * @param deadline absolute bound shared by all connectors; null for none
     * @return one outcome per healthy connector, in registration order
     */
    public <E> Map<String, ConnectorOutcome<E>> fanOut(String label,
                                                        Function<MonitoringConnector, ConnectorOutcome<E>> operation,
                                                        Instant deadline) {
        return fanOut(label, healthyConnectors(), operation, deadline);
    }

    /**
     * Run {@code operation} concurrently on an already selected set of connectors.
     */
    public <E> Map<String, ConnectorOutcome<E>> fanOut(String label, List<MonitoringConnector> targets,
                                                        Function<MonitoringConnector, ConnectorOutcome<E>> operation,
                                                        Instant deadline) {
        Instant start = clock.instant();
        Map<MonitoringConnector, CompletableFuture<ConnectorOutcome<E>>> calls = new LinkedHashMap<>();
        for (MonitoringConnector connector : targets) {
            calls.put(connector, CompletableFuture.supplyAsync(() -> operation.apply(connector), executor));
        }

        Map<String, ConnectorOutcome<E>> results = new LinkedHashMap<>();
        for (Map.Entry<MonitoringConnector, CompletableFuture<ConnectorOutcome<E>>> entry : calls.entrySet()) {
            MonitoringConnector connector = entry.getKey();
            CompletableFuture<ConnectorOutcome<E>> call = entry.getValue();
            Instant limit = start.plus(connector.getTimeout());
            if (deadline != null && deadline.isBefore(limit)) {
                limit = deadline;
            }
            long waitMillis = Math.max(0, Duration.between(clock.instant(), limit).toMillis());
            ConnectorOutcome<E> outcome;
            try {
                outcome = call.get(waitMillis, TimeUnit.MILLISECONDS);
                if (outcome == null) {
                    outcome = ConnectorOutcome.empty();
                }
            } catch (TimeoutException e) {
                call.cancel(true);
                log.warn("{} on {} timed out after {}ms", label, connector.getName(),
                        Duration.between(start, clock.instant()).toMillis());
                outcome = ConnectorOutcome.failure(FailureKind.TIMEOUT, label + " timed out");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                call.cancel(true);
                outcome = ConnectorOutcome.failure(FailureKind.TIMEOUT, label + " interrupted");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("{} on {} failed: {}", label, connector.getName(), cause.toString());
                outcome = ConnectorOutcome.failure(FailureKind.BACKEND_ERROR, cause.toString());
            }
            results.put(connector.getName(), outcome);
        }
        log.debug("{} fan-out over {} connector(s): {}", label, results.size(), results);
        return results;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
