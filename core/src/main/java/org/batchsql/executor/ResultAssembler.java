/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.executor;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.batchsql.data.Schema;
import org.batchsql.exception.BatchSqlException;
import org.batchsql.exception.ErrorCode;
import org.batchsql.exception.PartialFailureException;
import org.batchsql.executor.partition.PartitionResult;
import org.batchsql.query.PartialFailurePolicy;

/**
 * Merges per-partition results into one {@link QueryResult}. Assembly is a pure function of its
 * input: the same results always produce an equal result.
 */
@Log4j2
public class ResultAssembler {

  /** Assembles with the abort policy. */
  public QueryResult assemble(List<PartitionResult> results) {
    return assemble(results, PartialFailurePolicy.ABORT);
  }

  /**
   * Assembles partition results.
   *
   * @param results results in dispatch order
   * @param policy what to do with failed partitions
   * @return merged result; under best effort it lists the skipped partitions
   * @throws PartialFailureException under the abort policy when any partition failed
   * @throws BatchSqlException SCHEMA_MISMATCH when successful partitions disagree on the schema,
   *     UNSUPPORTED_TYPE when the schema holds STRUCT columns
   */
  public QueryResult assemble(List<PartitionResult> results, PartialFailurePolicy policy) {
    List<PartitionResult> failures = new ArrayList<>();
    for (PartitionResult result : results) {
      if (!result.isSuccess()) {
        failures.add(result);
      }
    }
    if (!failures.isEmpty() && policy == PartialFailurePolicy.ABORT) {
      PartitionResult first = failures.get(0);
      throw new PartialFailureException(
          first.getToken(), first.getFailure().orElse(null), failures.size() - 1);
    }

    Schema schema = null;
    PartitionResult schemaSource = null;
    int totalRows = 0;
    for (PartitionResult result : results) {
      if (!result.isSuccess()) {
        continue;
      }
      if (schema == null) {
        schema = result.getSchema();
        schemaSource = result;
      } else if (!schema.equals(result.getSchema())) {
        throw new BatchSqlException(
            ErrorCode.SCHEMA_MISMATCH,
            String.format(
                "Partition %d returned schema %s but partition %d returned %s",
                result.getToken().getIndex(),
                result.getSchema(),
                schemaSource.getToken().getIndex(),
                schema),
            result.getToken(),
            null);
      }
      totalRows += result.getRowCount();
    }
    if (schema == null) {
      schema = Schema.empty();
    }
    checkSupported(schema);

    List<List<Object>> rows = new ArrayList<>(totalRows);
    for (PartitionResult result : results) {
      if (result.isSuccess()) {
        rows.addAll(result.getRows());
      }
    }

    if (!failures.isEmpty()) {
      log.warn(
          "Best-effort result skips {} of {} partition(s)", failures.size(), results.size());
    }
    log.info("Assembled {} row(s) from {} partition(s)", rows.size(), results.size());
    return new QueryResult(schema, rows, failures);
  }

  private void checkSupported(Schema schema) {
    for (Schema.Column column : schema.getColumns()) {
      if (column.getType() != null && column.getType().containsStruct()) {
        throw new BatchSqlException(
            ErrorCode.UNSUPPORTED_TYPE,
            "Column " + column.getName() + " has unsupported type " + column.getType());
      }
    }
  }
}
