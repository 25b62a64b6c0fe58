/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.spanner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.cloud.spanner.BatchClient;
import com.google.cloud.spanner.BatchReadOnlyTransaction;
import com.google.cloud.spanner.ErrorCode;
import com.google.cloud.spanner.Options;
import com.google.cloud.spanner.Partition;
import com.google.cloud.spanner.PartitionOptions;
import com.google.cloud.spanner.ReadContext;
import com.google.cloud.spanner.ResultSet;
import com.google.cloud.spanner.ResultSets;
import com.google.cloud.spanner.SpannerExceptionFactory;
import com.google.cloud.spanner.Statement;
import com.google.cloud.spanner.Struct;
import com.google.cloud.spanner.TimestampBound;
import com.google.cloud.spanner.Type;
import com.google.spanner.v1.PlanNode;
import com.google.spanner.v1.QueryPlan;
import com.google.spanner.v1.ResultSetStats;
import java.util.List;
import org.batchsql.client.PartitionToken;
import org.batchsql.client.ReadSession;
import org.batchsql.client.RowIterator;
import org.batchsql.exception.BatchSqlException;
import org.batchsql.planner.plan.ExecutionPlan;
import org.batchsql.planner.plan.OperatorKind;
import org.batchsql.query.Query;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SpannerDatabaseClientTest {

  private static final Query QUERY = Query.of("SELECT SingerId FROM Singers");

  @Mock private com.google.cloud.spanner.DatabaseClient spannerClient;
  @Mock private BatchClient batchClient;
  @Mock private BatchReadOnlyTransaction transaction;

  private SpannerDatabaseClient client;

  @BeforeEach
  void setUp() {
    when(batchClient.batchReadOnlyTransaction(any(TimestampBound.class))).thenReturn(transaction);
    client = new SpannerDatabaseClient(spannerClient, batchClient, true);
  }

  @Test
  void should_fetch_plan_in_plan_mode() {
    // Given
    ReadContext context = mock(ReadContext.class);
    ResultSet planResult = mock(ResultSet.class);
    when(spannerClient.singleUse()).thenReturn(context);
    when(context.analyzeQuery(any(Statement.class), eq(ReadContext.QueryAnalyzeMode.PLAN)))
        .thenReturn(planResult);
    when(planResult.next()).thenReturn(false);
    when(planResult.getStats())
        .thenReturn(
            ResultSetStats.newBuilder()
                .setQueryPlan(
                    QueryPlan.newBuilder()
                        .addPlanNodes(
                            PlanNode.newBuilder()
                                .setIndex(0)
                                .setKind(PlanNode.Kind.RELATIONAL)
                                .setDisplayName("Distributed Union")))
                .build());

    // When
    ExecutionPlan plan = client.getQueryPlan(QUERY);

    // Then
    assertEquals(OperatorKind.DISTRIBUTED_UNION, plan.getRoot().getKind());
    verify(planResult).close();
    verify(context).close();
  }

  @Test
  void should_return_empty_plan_without_stats() {
    ReadContext context = mock(ReadContext.class);
    ResultSet planResult = mock(ResultSet.class);
    when(spannerClient.singleUse()).thenReturn(context);
    when(context.analyzeQuery(any(Statement.class), eq(ReadContext.QueryAnalyzeMode.PLAN)))
        .thenReturn(planResult);
    when(planResult.getStats()).thenReturn(null);

    assertTrue(client.getQueryPlan(QUERY).isEmpty());
  }

  @Test
  void should_partition_with_hint_and_data_boost() {
    // Given
    Partition first = mock(Partition.class);
    Partition second = mock(Partition.class);
    when(transaction.partitionQuery(
            any(PartitionOptions.class), any(Statement.class), any(Options.QueryOption.class)))
        .thenReturn(List.of(first, second));
    ReadSession session = client.openReadSession(QUERY);

    // When
    List<PartitionToken> tokens = client.partitionQuery(session, QUERY, 12);

    // Then
    ArgumentCaptor<PartitionOptions> options = ArgumentCaptor.forClass(PartitionOptions.class);
    verify(transaction)
        .partitionQuery(
            options.capture(),
            eq(Statement.of("SELECT SingerId FROM Singers")),
            any(Options.QueryOption.class));
    assertEquals(12, options.getValue().getMaxPartitions());
    assertEquals(2, tokens.size());
    assertTrue(tokens.get(1).belongsTo(session));
    assertEquals(1, tokens.get(1).getIndex());
    assertSame(second, tokens.get(1).getPayload());
  }

  @Test
  void should_read_partition_through_batch_transaction() {
    Partition partition = mock(Partition.class);
    Type rowType = Type.struct(Type.StructField.of("SingerId", Type.int64()));
    when(transaction.execute(partition))
        .thenReturn(
            ResultSets.forRows(
                rowType, List.of(Struct.newBuilder().set("SingerId").to(1L).build())));
    ReadSession session = client.openReadSession(QUERY);

    try (RowIterator rows =
        client.executePartition(
            session, new PartitionToken(session.getSessionId(), 0, partition))) {
      assertEquals(List.of("SingerId"), rows.getSchema().getColumnNames());
      assertEquals(List.of(1L), rows.next());
      assertFalse(rows.hasNext());
    }
  }

  @Test
  void should_reject_token_without_spanner_partition() {
    ReadSession session = client.openReadSession(QUERY);

    BatchSqlException e =
        assertThrows(
            BatchSqlException.class,
            () ->
                client.executePartition(
                    session, new PartitionToken(session.getSessionId(), 0, "not-a-partition")));

    assertEquals(
        org.batchsql.exception.ErrorCode.INVALID_PARTITION_TOKEN, e.getErrorCode());
  }

  @Test
  void should_clean_up_transaction_on_release() {
    ReadSession session = client.openReadSession(QUERY);

    client.releaseSession(session);

    verify(transaction).cleanup();
  }

  @Test
  void should_classify_retryable_status_codes_as_transient() {
    assertTrue(
        client.isTransient(
            SpannerExceptionFactory.newSpannerException(ErrorCode.UNAVAILABLE, "unavailable")));
    assertTrue(
        client.isTransient(
            new IllegalStateException(
                SpannerExceptionFactory.newSpannerException(
                    ErrorCode.RESOURCE_EXHAUSTED, "throttled"))));
    assertFalse(
        client.isTransient(
            SpannerExceptionFactory.newSpannerException(ErrorCode.INVALID_ARGUMENT, "bad sql")));
    assertFalse(client.isTransient(new IllegalStateException("plain")));
  }
}
