/*-
 * -\-\-
 * Spotify Sluice Scheduler Service
 * --
 * Copyright (C) 2016 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.sluice;

import static com.spotify.sluice.ScheduledExecutionUtil.scheduleWithJitter;
import static com.spotify.sluice.util.CloserUtil.closeable;
import static com.spotify.sluice.util.CloserUtil.register;
import static com.spotify.sluice.util.ConfigUtil.get;
import static java.util.Objects.requireNonNull;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.google.cloud.datastore.Datastore;
import com.google.cloud.datastore.DatastoreOptions;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.Closer;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.spotify.sluice.api.SchedulerOperations;
import com.spotify.sluice.auth.CredentialRenewer;
import com.spotify.sluice.auth.OAuthCredentialRenewer;
import com.spotify.sluice.credentials.TokenRefreshService;
import com.spotify.sluice.crypto.SecretCipher;
import com.spotify.sluice.gateway.HttpQueryGateway;
import com.spotify.sluice.gateway.QueryGateway;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.monitoring.MetricsStats;
import com.spotify.sluice.monitoring.Stats;
import com.spotify.sluice.monitoring.StatsFactory;
import com.spotify.sluice.storage.DatastoreStorage;
import com.spotify.sluice.storage.InMemStorage;
import com.spotify.sluice.storage.Storage;
import com.spotify.sluice.sync.WarehouseSyncPipeline;
import com.spotify.sluice.util.ConfigurationException;
import com.spotify.sluice.util.Time;
import com.spotify.sluice.warehouse.SnowflakeWarehouseClient;
import com.spotify.sluice.warehouse.WarehouseClientFactory;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the periodic components of the scheduler and runs them on a shared tick executor.
 */
public class SluiceScheduler implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(SluiceScheduler.class);

  public static final String SERVICE_NAME = "sluice-scheduler";

  public static final String STORAGE_TYPE = "sluice.storage.type";
  public static final String DATASTORE_PROJECT = "sluice.datastore.project-id";
  public static final String DATASTORE_NAMESPACE = "sluice.datastore.namespace";
  public static final String ENCRYPTION_KEY = "sluice.encryption-key";
  public static final String GATEWAY_BASE_URL = "sluice.gateway.base-url";
  public static final String GATEWAY_CLIENT_ID = "sluice.gateway.client-id";
  public static final String TOKEN_URL = "sluice.credentials.token-url";
  public static final String TOKEN_CLIENT_ID = "sluice.credentials.client-id";
  public static final String TOKEN_CLIENT_SECRET = "sluice.credentials.client-secret";
  public static final String CREDENTIAL_VALIDITY_WINDOW = "sluice.credentials.validity-window";
  public static final String CREDENTIAL_SWEEP_INTERVAL = "sluice.credentials.sweep-interval";
  public static final String DISPATCHER_TICK_INTERVAL = "sluice.dispatcher.tick-interval";
  public static final String DISPATCHER_DEDUP_WINDOW = "sluice.dispatcher.dedup-window";
  public static final String DISPATCHER_DATA_LAG_DAYS = "sluice.dispatcher.data-lag-days";
  public static final String POLLER_TICK_INTERVAL = "sluice.poller.tick-interval";
  public static final String POLLER_CONCURRENCY = "sluice.poller.concurrency";
  public static final String POLLER_MAX_DURATION = "sluice.poller.max-execution-duration";
  public static final String POLLER_SUBMIT_TIMEOUT = "sluice.poller.submit-timeout";
  public static final String BACKFILL_TICK_INTERVAL = "sluice.backfill.tick-interval";
  public static final String BACKFILL_RUNS_PER_TICK = "sluice.backfill.runs-per-tick";
  public static final String BACKFILL_SEGMENTS_PER_RUN = "sluice.backfill.segments-per-run";
  public static final String BACKFILL_MAX_SEGMENTS = "sluice.backfill.max-segments";
  public static final String SYNC_TICK_INTERVAL = "sluice.sync.tick-interval";
  public static final String SYNC_CONCURRENCY = "sluice.sync.concurrency";
  public static final String SYNC_MAX_ATTEMPTS = "sluice.sync.max-attempts";
  public static final String SYNC_RETRY_DELAY = "sluice.sync.retry-delay";
  public static final String SYNC_UPLOAD_LEASE = "sluice.sync.upload-lease";
  public static final String METRICS_REPORT_INTERVAL = "sluice.metrics.report-interval";

  static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(10);
  static final Duration DEFAULT_DISPATCHER_TICK_INTERVAL = Duration.ofSeconds(60);
  static final Duration DEFAULT_POLLER_TICK_INTERVAL = Duration.ofSeconds(15);
  static final Duration DEFAULT_BACKFILL_TICK_INTERVAL = Duration.ofSeconds(30);
  static final Duration DEFAULT_SYNC_TICK_INTERVAL = Duration.ofSeconds(60);
  static final int DEFAULT_SYNC_CONCURRENCY = 10;

  public interface StorageFactory extends Function<Config, Storage> { }

  public interface QueryGatewayFactory extends Function<Config, QueryGateway> { }

  public interface CredentialRenewerFactory extends Function<Config, CredentialRenewer> { }

  interface ExecutorFactory {
    ScheduledExecutorService create(int threads, ThreadFactory threadFactory);
  }

  public static class Builder {

    private Time time = Instant::now;
    private StorageFactory storageFactory = SluiceScheduler::storage;
    private StatsFactory statsFactory = SluiceScheduler::stats;
    private ExecutorFactory executorFactory = Executors::newScheduledThreadPool;
    private QueryGatewayFactory gatewayFactory = SluiceScheduler::gateway;
    private CredentialRenewerFactory renewerFactory = SluiceScheduler::renewer;
    private WarehouseClientFactory warehouseClientFactory = SnowflakeWarehouseClient::create;

    public Builder setTime(Time time) {
      this.time = time;
      return this;
    }

    public Builder setStorageFactory(StorageFactory storageFactory) {
      this.storageFactory = storageFactory;
      return this;
    }

    public Builder setStatsFactory(StatsFactory statsFactory) {
      this.statsFactory = statsFactory;
      return this;
    }

    Builder setExecutorFactory(ExecutorFactory executorFactory) {
      this.executorFactory = executorFactory;
      return this;
    }

    public Builder setGatewayFactory(QueryGatewayFactory gatewayFactory) {
      this.gatewayFactory = gatewayFactory;
      return this;
    }

    public Builder setRenewerFactory(CredentialRenewerFactory renewerFactory) {
      this.renewerFactory = renewerFactory;
      return this;
    }

    public Builder setWarehouseClientFactory(WarehouseClientFactory warehouseClientFactory) {
      this.warehouseClientFactory = warehouseClientFactory;
      return this;
    }

    public SluiceScheduler build() {
      return new SluiceScheduler(this);
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static SluiceScheduler createDefault() {
    return newBuilder().build();
  }

  private final Time time;
  private final StorageFactory storageFactory;
  private final StatsFactory statsFactory;
  private final ExecutorFactory executorFactory;
  private final QueryGatewayFactory gatewayFactory;
  private final CredentialRenewerFactory renewerFactory;
  private final WarehouseClientFactory warehouseClientFactory;

  private final Closer closer = Closer.create();

  private SchedulerOperations operations;

  private SluiceScheduler(Builder builder) {
    this.time = requireNonNull(builder.time);
    this.storageFactory = requireNonNull(builder.storageFactory);
    this.statsFactory = requireNonNull(builder.statsFactory);
    this.executorFactory = requireNonNull(builder.executorFactory);
    this.gatewayFactory = requireNonNull(builder.gatewayFactory);
    this.renewerFactory = requireNonNull(builder.renewerFactory);
    this.warehouseClientFactory = requireNonNull(builder.warehouseClientFactory);
  }

  public void start(Config config) {
    final Thread.UncaughtExceptionHandler uncaughtExceptionHandler =
        (thread, throwable) -> LOG.error("Thread {} threw {}", thread, throwable);

    final ThreadFactory tickTf = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("sluice-tick-%d")
        .setUncaughtExceptionHandler(uncaughtExceptionHandler)
        .build();

    // Closer is LIFO: storage registered first is closed last, after every thread using it stopped
    final Storage storage = closer.register(storageFactory.apply(config));
    final Stats stats = statsFactory.apply(config);

    final SecretCipher cipher = SecretCipher.fromBase64Key(requiredString(config, ENCRYPTION_KEY));
    final QueryGateway gateway = gatewayFactory.apply(config);

    final TokenRefreshService tokens = new TokenRefreshService(storage, renewerFactory.apply(config),
        cipher, time,
        get(config, config::getDuration, CREDENTIAL_VALIDITY_WINDOW)
            .orElse(TokenRefreshService.DEFAULT_VALIDITY_WINDOW),
        stats);
    final ExecutionOutcomeHandler outcomes = new ExecutionOutcomeHandler(stats);
    final ExecutionSubmitter submitter =
        new ExecutionSubmitter(storage, gateway, tokens, outcomes, stats, time);

    final ExecutorService dispatchExecutor = executor(4, "sluice-dispatch-%d");
    final ScheduleDispatcher dispatcher = new ScheduleDispatcher(storage, submitter, stats, time,
        dispatchExecutor,
        get(config, config::getDuration, DISPATCHER_DEDUP_WINDOW)
            .orElse(ScheduleDispatcher.DEFAULT_DEDUP_WINDOW),
        get(config, config::getInt, DISPATCHER_DATA_LAG_DAYS)
            .orElse(ScheduleDispatcher.DEFAULT_DATA_LAG_DAYS));

    final int pollConcurrency = get(config, config::getInt, POLLER_CONCURRENCY)
        .orElse(ExecutionPoller.DEFAULT_CONCURRENCY);
    final ExecutorService pollExecutor = executor(pollConcurrency, "sluice-poll-%d");
    final ExecutionPoller poller = new ExecutionPoller(storage, gateway, tokens, outcomes, stats,
        time, pollExecutor, pollConcurrency,
        get(config, config::getDuration, POLLER_MAX_DURATION)
            .orElse(ExecutionPoller.DEFAULT_MAX_DURATION),
        get(config, config::getDuration, POLLER_SUBMIT_TIMEOUT)
            .orElse(ExecutionPoller.DEFAULT_SUBMIT_TIMEOUT));

    final int segmentsPerRun = get(config, config::getInt, BACKFILL_SEGMENTS_PER_RUN)
        .orElse(BackfillProcessor.DEFAULT_SEGMENTS_PER_RUN);
    final ExecutorService backfillExecutor = executor(segmentsPerRun, "sluice-backfill-%d");
    final BackfillProcessor backfills = new BackfillProcessor(storage, submitter, stats, time,
        backfillExecutor,
        get(config, config::getInt, BACKFILL_RUNS_PER_TICK)
            .orElse(BackfillProcessor.DEFAULT_RUNS_PER_TICK),
        segmentsPerRun,
        get(config, config::getInt, BACKFILL_MAX_SEGMENTS)
            .orElse(BackfillPlanner.DEFAULT_MAX_SEGMENTS));

    final ExecutorService syncExecutor = executor(
        get(config, config::getInt, SYNC_CONCURRENCY).orElse(DEFAULT_SYNC_CONCURRENCY),
        "sluice-sync-%d");
    final WarehouseSyncPipeline syncPipeline = new WarehouseSyncPipeline(storage, gateway, tokens,
        cipher, warehouseClientFactory, stats, time, syncExecutor,
        get(config, config::getInt, SYNC_MAX_ATTEMPTS)
            .orElse(WarehouseSyncPipeline.DEFAULT_MAX_ATTEMPTS),
        get(config, config::getDuration, SYNC_RETRY_DELAY)
            .orElse(WarehouseSyncPipeline.DEFAULT_RETRY_DELAY),
        get(config, config::getDuration, SYNC_UPLOAD_LEASE)
            .orElse(WarehouseSyncPipeline.DEFAULT_UPLOAD_LEASE));

    operations = new SchedulerOperations(storage, submitter, outcomes, backfills, syncPipeline,
        cipher, warehouseClientFactory, time);

    stats.registerActiveExecutionsMetric(() -> activeExecutions(storage));

    final ScheduledExecutorService tickExecutor = executorFactory.create(5, tickTf);
    // registered last so that it is closed first, before the work pools the ticks fan out to
    closer.register(closeable(tickExecutor, "tick-executor", Duration.ofSeconds(1)));

    scheduleWithJitter(tokens::sweep, tickExecutor,
        get(config, config::getDuration, CREDENTIAL_SWEEP_INTERVAL)
            .orElse(DEFAULT_SWEEP_INTERVAL));
    scheduleWithJitter(dispatcher::tick, tickExecutor,
        get(config, config::getDuration, DISPATCHER_TICK_INTERVAL)
            .orElse(DEFAULT_DISPATCHER_TICK_INTERVAL));
    scheduleWithJitter(poller::tick, tickExecutor,
        get(config, config::getDuration, POLLER_TICK_INTERVAL)
            .orElse(DEFAULT_POLLER_TICK_INTERVAL));
    scheduleWithJitter(backfills::tick, tickExecutor,
        get(config, config::getDuration, BACKFILL_TICK_INTERVAL)
            .orElse(DEFAULT_BACKFILL_TICK_INTERVAL));
    scheduleWithJitter(syncPipeline::tick, tickExecutor,
        get(config, config::getDuration, SYNC_TICK_INTERVAL)
            .orElse(DEFAULT_SYNC_TICK_INTERVAL));

    LOG.info("{} started", SERVICE_NAME);
  }

  /**
   * Operator operations on the running scheduler.
   */
  public SchedulerOperations operations() {
    if (operations == null) {
      throw new IllegalStateException(SERVICE_NAME + " is not started");
    }
    return operations;
  }

  @Override
  public void close() throws IOException {
    LOG.info("Shutting down {}", SERVICE_NAME);
    closer.close();
  }

  private ExecutorService executor(int threads, String nameFormat) {
    return register(closer, Executors.newFixedThreadPool(threads,
        new ThreadFactoryBuilder().setDaemon(true).setNameFormat(nameFormat).build()),
        nameFormat.replace("-%d", ""), Duration.ofSeconds(5));
  }

  private static long activeExecutions(Storage storage) {
    try {
      return storage.activeExecutions().stream()
          .filter(execution -> execution.status() == ExecutionStatus.RUNNING)
          .count();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @VisibleForTesting
  static Storage storage(Config config) {
    final String type = get(config, config::getString, STORAGE_TYPE).orElse("datastore");
    switch (type) {
      case "in-mem":
        LOG.warn("Using in-memory storage, nothing survives a restart");
        return new InMemStorage();
      case "datastore":
        final String projectId = requiredString(config, DATASTORE_PROJECT);
        final String namespace = requiredString(config, DATASTORE_NAMESPACE);
        LOG.info("Creating Datastore connection for project:{}, namespace:{}",
            projectId, namespace);
        final Datastore datastore = DatastoreOptions.newBuilder()
            .setProjectId(projectId)
            .setNamespace(namespace)
            .build()
            .getService();
        return new DatastoreStorage(datastore, Duration.ofMillis(100));
      default:
        throw new ConfigurationException("Unknown storage type: " + type);
    }
  }

  private static Stats stats(Config config) {
    final MetricRegistry registry = new MetricRegistry();
    final Duration interval = get(config, config::getDuration, METRICS_REPORT_INTERVAL)
        .orElse(Duration.ofMinutes(1));
    Slf4jReporter.forRegistry(registry)
        .outputTo(LoggerFactory.getLogger("sluice.metrics"))
        .convertDurationsTo(TimeUnit.MILLISECONDS)
        .build()
        .start(interval.toMillis(), TimeUnit.MILLISECONDS);
    return new MetricsStats(registry);
  }

  private static QueryGateway gateway(Config config) {
    return HttpQueryGateway.create(requiredString(config, GATEWAY_BASE_URL),
        requiredString(config, GATEWAY_CLIENT_ID));
  }

  private static CredentialRenewer renewer(Config config) {
    return OAuthCredentialRenewer.create(requiredString(config, TOKEN_URL),
        requiredString(config, TOKEN_CLIENT_ID), requiredString(config, TOKEN_CLIENT_SECRET));
  }

  private static String requiredString(Config config, String path) {
    return get(config, config::getString, path)
        .orElseThrow(() -> new ConfigurationException("Missing configuration " + path));
  }

  public static void main(String[] args) {
    final Config config = ConfigFactory.load(SERVICE_NAME);
    final SluiceScheduler scheduler = createDefault();
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      try {
        scheduler.close();
      } catch (IOException e) {
        LOG.error("Failed to shut down {}", SERVICE_NAME, e);
      }
    }));
    scheduler.start(config);
  }
}
