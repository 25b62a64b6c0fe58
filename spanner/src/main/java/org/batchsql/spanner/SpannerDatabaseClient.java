/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.spanner;

import com.google.cloud.spanner.BatchClient;
import com.google.cloud.spanner.BatchReadOnlyTransaction;
import com.google.cloud.spanner.DatabaseId;
import com.google.cloud.spanner.Options;
import com.google.cloud.spanner.Partition;
import com.google.cloud.spanner.PartitionOptions;
import com.google.cloud.spanner.ReadContext;
import com.google.cloud.spanner.ResultSet;
import com.google.cloud.spanner.Spanner;
import com.google.cloud.spanner.SpannerException;
import com.google.cloud.spanner.SpannerOptions;
import com.google.cloud.spanner.Statement;
import com.google.cloud.spanner.TimestampBound;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.spanner.v1.ResultSetStats;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;
import org.batchsql.client.DatabaseClient;
import org.batchsql.client.PartitionToken;
import org.batchsql.client.ReadSession;
import org.batchsql.client.RowIterator;
import org.batchsql.common.setting.PropertiesSettings;
import org.batchsql.common.setting.Settings;
import org.batchsql.exception.BatchSqlException;
import org.batchsql.exception.ErrorCode;
import org.batchsql.planner.plan.ExecutionPlan;
import org.batchsql.query.Query;

/**
 * {@link DatabaseClient} backed by Cloud Spanner.
 *
 * <p>Plans come from {@code analyzeQuery} in PLAN mode. Each partitioned read runs in its own
 * batch read-only transaction at a strong timestamp, and with Data Boost enabled (the default)
 * partitions execute on compute isolated from the instance's serving nodes.
 */
@Log4j2
public class SpannerDatabaseClient implements DatabaseClient, AutoCloseable {

  private static final Set<com.google.cloud.spanner.ErrorCode> TRANSIENT_CODES =
      Sets.immutableEnumSet(
          com.google.cloud.spanner.ErrorCode.UNAVAILABLE,
          com.google.cloud.spanner.ErrorCode.DEADLINE_EXCEEDED,
          com.google.cloud.spanner.ErrorCode.RESOURCE_EXHAUSTED,
          com.google.cloud.spanner.ErrorCode.ABORTED,
          com.google.cloud.spanner.ErrorCode.INTERNAL);

  /** Owning service, closed with this client; null when the caller owns it. */
  private final Spanner spanner;

  private final com.google.cloud.spanner.DatabaseClient databaseClient;
  private final BatchClient batchClient;
  private final boolean dataBoostEnabled;

  public SpannerDatabaseClient(
      com.google.cloud.spanner.DatabaseClient databaseClient,
      BatchClient batchClient,
      boolean dataBoostEnabled) {
    this(null, databaseClient, batchClient, dataBoostEnabled);
  }

  private SpannerDatabaseClient(
      Spanner spanner,
      com.google.cloud.spanner.DatabaseClient databaseClient,
      BatchClient batchClient,
      boolean dataBoostEnabled) {
    this.spanner = spanner;
    this.databaseClient = databaseClient;
    this.batchClient = batchClient;
    this.dataBoostEnabled = dataBoostEnabled;
  }

  /** Connects with application default credentials and settings from the classpath. */
  public static SpannerDatabaseClient connect(String project, String instance, String database) {
    return connect(project, instance, database, PropertiesSettings.fromClasspath());
  }

  /**
   * Connects with application default credentials.
   *
   * @param project GCP project id
   * @param instance Spanner instance id
   * @param database database id
   * @param settings source of {@code batchsql.spanner.data_boost_enabled}, default true
   * @return a client owning its Spanner service; close it when done
   */
  public static SpannerDatabaseClient connect(
      String project, String instance, String database, Settings settings) {
    boolean dataBoost = settings.getSettingValue(Settings.Key.DATA_BOOST_ENABLED, Boolean.TRUE);
    Spanner spanner = SpannerOptions.newBuilder().setProjectId(project).build().getService();
    DatabaseId id = DatabaseId.of(project, instance, database);
    log.info("Connected to {} (data boost {})", id, dataBoost ? "enabled" : "disabled");
    return new SpannerDatabaseClient(
        spanner, spanner.getDatabaseClient(id), spanner.getBatchClient(id), dataBoost);
  }

  @Override
  public ExecutionPlan getQueryPlan(Query query) {
    Statement statement = SpannerStatementBinder.bind(query);
    try (ReadContext context = databaseClient.singleUse();
        ResultSet resultSet =
            context.analyzeQuery(statement, ReadContext.QueryAnalyzeMode.PLAN)) {
      while (resultSet.next()) {
        // PLAN mode returns no rows; stats arrive once the stream is drained.
      }
      ResultSetStats stats = resultSet.getStats();
      if (stats == null || !stats.hasQueryPlan()) {
        return ExecutionPlan.empty();
      }
      return SpannerPlanConverter.convert(stats.getQueryPlan());
    }
  }

  @Override
  public ReadSession openReadSession(Query query) {
    BatchReadOnlyTransaction transaction =
        batchClient.batchReadOnlyTransaction(TimestampBound.strong());
    SpannerReadSession session =
        new SpannerReadSession(UUID.randomUUID().toString(), transaction);
    log.debug("Opened batch transaction for session {}", session.getSessionId());
    return session;
  }

  @Override
  public List<PartitionToken> partitionQuery(
      ReadSession session, Query query, Integer maxPartitionsHint) {
    PartitionOptions.Builder options = PartitionOptions.newBuilder();
    if (maxPartitionsHint != null) {
      options.setMaxPartitions(maxPartitionsHint);
    }
    List<Partition> partitions =
        transaction(session)
            .partitionQuery(
                options.build(),
                SpannerStatementBinder.bind(query),
                Options.dataBoostEnabled(dataBoostEnabled));

    ImmutableList.Builder<PartitionToken> tokens = ImmutableList.builder();
    for (int i = 0; i < partitions.size(); i++) {
      tokens.add(new PartitionToken(session.getSessionId(), i, partitions.get(i)));
    }
    return tokens.build();
  }

  @Override
  public RowIterator executePartition(ReadSession session, PartitionToken token) {
    if (!(token.getPayload() instanceof Partition)) {
      throw new BatchSqlException(
          ErrorCode.INVALID_PARTITION_TOKEN,
          "Token " + token + " does not carry a Spanner partition",
          token,
          null);
    }
    return new SpannerRowIterator(transaction(session).execute((Partition) token.getPayload()));
  }

  @Override
  public void releaseSession(ReadSession session) {
    transaction(session).cleanup();
    log.debug("Cleaned up batch transaction for session {}", session.getSessionId());
  }

  /** Treats retryable gRPC status codes as transient, on top of the default timeouts. */
  @Override
  public boolean isTransient(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof SpannerException
          && TRANSIENT_CODES.contains(((SpannerException) t).getErrorCode())) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return DatabaseClient.super.isTransient(failure);
  }

  @Override
  public void close() {
    if (spanner != null) {
      spanner.close();
    }
  }

  private static BatchReadOnlyTransaction transaction(ReadSession session) {
    if (!(session instanceof SpannerReadSession)) {
      throw new IllegalArgumentException("Not a Spanner read session: " + session);
    }
    return ((SpannerReadSession) session).getTransaction();
  }
}
