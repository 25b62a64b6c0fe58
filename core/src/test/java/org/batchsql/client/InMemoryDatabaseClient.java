/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.client;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.batchsql.data.Schema;
import org.batchsql.planner.plan.ExecutionPlan;
import org.batchsql.planner.plan.OperatorKind;
import org.batchsql.planner.plan.PlanNode;
import org.batchsql.query.Query;

/**
 * Scriptable {@link DatabaseClient} for tests. Each partition is described by a {@link
 * PartitionSpec}; the client records session, dispatch and concurrency statistics.
 */
public class InMemoryDatabaseClient implements DatabaseClient {

  private final List<PartitionSpec> partitions = new ArrayList<>();
  private Supplier<ExecutionPlan> plan =
      () -> new ExecutionPlan(PlanNode.of(OperatorKind.DISTRIBUTED_UNION));
  private RuntimeException partitionQueryFailure;

  private final AtomicInteger sessionsOpened = new AtomicInteger();
  private final AtomicInteger sessionsReleased = new AtomicInteger();
  private final AtomicInteger partitionQueryCalls = new AtomicInteger();
  private final AtomicInteger planCalls = new AtomicInteger();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger maxInFlight = new AtomicInteger();
  private final Map<Integer, AtomicInteger> attemptsByPartition = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> releasesBySession = new ConcurrentHashMap<>();
  private final Set<Thread> readerThreads = ConcurrentHashMap.newKeySet();
  private Integer lastMaxPartitionsHint;

  public InMemoryDatabaseClient withPlanRoot(OperatorKind kind) {
    this.plan = () -> new ExecutionPlan(PlanNode.of(kind));
    return this;
  }

  public InMemoryDatabaseClient withPlan(Supplier<ExecutionPlan> plan) {
    this.plan = plan;
    return this;
  }

  public InMemoryDatabaseClient withPartition(PartitionSpec spec) {
    partitions.add(spec);
    return this;
  }

  public InMemoryDatabaseClient failPartitionQueryWith(RuntimeException failure) {
    this.partitionQueryFailure = failure;
    return this;
  }

  @Override
  public ExecutionPlan getQueryPlan(Query query) {
    planCalls.incrementAndGet();
    return plan.get();
  }

  @Override
  public ReadSession openReadSession(Query query) {
    String id = "session-" + sessionsOpened.incrementAndGet();
    return () -> id;
  }

  @Override
  public List<PartitionToken> partitionQuery(
      ReadSession session, Query query, Integer maxPartitionsHint) {
    partitionQueryCalls.incrementAndGet();
    lastMaxPartitionsHint = maxPartitionsHint;
    if (partitionQueryFailure != null) {
      throw partitionQueryFailure;
    }
    List<PartitionToken> tokens = new ArrayList<>();
    for (int i = 0; i < partitions.size(); i++) {
      tokens.add(new PartitionToken(session.getSessionId(), i, "p" + i));
    }
    return tokens;
  }

  @Override
  public RowIterator executePartition(ReadSession session, PartitionToken token) {
    PartitionSpec spec = partitions.get(token.getIndex());
    readerThreads.add(Thread.currentThread());
    int attempt =
        attemptsByPartition.computeIfAbsent(token.getIndex(), k -> new AtomicInteger())
            .incrementAndGet();
    int current = inFlight.incrementAndGet();
    maxInFlight.accumulateAndGet(current, Math::max);
    try {
      if (spec.getBlocker() != null) {
        spec.getBlocker().await();
      }
      if (spec.getDelayMillis() > 0) {
        Thread.sleep(spec.getDelayMillis());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while reading partition " + token.getIndex());
    } finally {
      inFlight.decrementAndGet();
    }
    if (spec.getCrash() != null) {
      throw spec.getCrash();
    }
    if (spec.getPermanentFailure() != null) {
      throw spec.getPermanentFailure();
    }
    if (attempt <= spec.getTransientFailures()) {
      throw new TransientBackendException("Throttled on attempt " + attempt);
    }
    Iterator<List<Object>> rows = spec.getRows().iterator();
    return new RowIterator() {
      @Override
      public Schema getSchema() {
        return spec.getSchema();
      }

      @Override
      public boolean hasNext() {
        return rows.hasNext();
      }

      @Override
      public List<Object> next() {
        return rows.next();
      }

      @Override
      public void close() {}
    };
  }

  @Override
  public void releaseSession(ReadSession session) {
    sessionsReleased.incrementAndGet();
    releasesBySession
        .computeIfAbsent(session.getSessionId(), k -> new AtomicInteger())
        .incrementAndGet();
  }

  public int getSessionsOpened() {
    return sessionsOpened.get();
  }

  public int getSessionsReleased() {
    return sessionsReleased.get();
  }

  public int getReleases(String sessionId) {
    AtomicInteger count = releasesBySession.get(sessionId);
    return count == null ? 0 : count.get();
  }

  public int getPartitionQueryCalls() {
    return partitionQueryCalls.get();
  }

  public int getPlanCalls() {
    return planCalls.get();
  }

  public int getMaxInFlight() {
    return maxInFlight.get();
  }

  public int getAttempts(int partition) {
    AtomicInteger count = attemptsByPartition.get(partition);
    return count == null ? 0 : count.get();
  }

  /** Threads that executed at least one partition read. */
  public Set<Thread> getReaderThreads() {
    return Set.copyOf(readerThreads);
  }

  public Integer getLastMaxPartitionsHint() {
    return lastMaxPartitionsHint;
  }

  /** Behaviour of one partition. */
  public static class PartitionSpec {
    private final Schema schema;
    private final List<List<Object>> rows;
    private int transientFailures;
    private RuntimeException permanentFailure;
    private Error crash;
    private CountDownLatch blocker;
    private long delayMillis;

    private PartitionSpec(Schema schema, List<List<Object>> rows) {
      this.schema = schema;
      this.rows = rows;
    }

    public static PartitionSpec rows(Schema schema, List<List<Object>> rows) {
      return new PartitionSpec(schema, rows);
    }

    /** A partition of {@code count} single-column rows holding 0..count-1. */
    public static PartitionSpec sequence(Schema schema, int count) {
      List<List<Object>> rows = new ArrayList<>();
      for (long i = 0; i < count; i++) {
        rows.add(List.of(i));
      }
      return new PartitionSpec(schema, rows);
    }

    public PartitionSpec failingTransiently(int times) {
      this.transientFailures = times;
      return this;
    }

    public PartitionSpec failingWith(RuntimeException failure) {
      this.permanentFailure = failure;
      return this;
    }

    public PartitionSpec crashingWith(Error error) {
      this.crash = error;
      return this;
    }

    public PartitionSpec blockedBy(CountDownLatch latch) {
      this.blocker = latch;
      return this;
    }

    public PartitionSpec delayedBy(long millis) {
      this.delayMillis = millis;
      return this;
    }

    Schema getSchema() {
      return schema;
    }

    List<List<Object>> getRows() {
      return rows;
    }

    int getTransientFailures() {
      return transientFailures;
    }

    RuntimeException getPermanentFailure() {
      return permanentFailure;
    }

    Error getCrash() {
      return crash;
    }

    CountDownLatch getBlocker() {
      return blocker;
    }

    long getDelayMillis() {
      return delayMillis;
    }
  }
}
