/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.spanner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.Date;
import com.google.cloud.spanner.Statement;
import com.google.cloud.spanner.Value;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.batchsql.exception.BatchSqlException;
import org.batchsql.exception.ErrorCode;
import org.batchsql.query.Query;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SpannerStatementBinderTest {

  @Test
  void should_bind_named_parameters() throws Exception {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("id", 7);
    params.put("day", LocalDate.of(2024, 1, 2));
    params.put("doc", new ObjectMapper().readTree("{\"k\":true}"));
    Query query = Query.of("SELECT * FROM t WHERE id = @id AND day = @day AND doc = @doc", params);

    Statement statement = SpannerStatementBinder.bind(query);

    assertEquals(query.getSql(), statement.getSql());
    assertEquals(Value.int64(7L), statement.getParameters().get("id"));
    assertEquals(
        Value.date(Date.fromYearMonthDay(2024, 1, 2)), statement.getParameters().get("day"));
    assertEquals(Value.json("{\"k\":true}"), statement.getParameters().get("doc"));
  }

  @Test
  void should_reject_unsupported_parameter_type() {
    Query query = Query.of("SELECT @xs", Map.of("xs", List.of(1, 2)));

    BatchSqlException e =
        assertThrows(BatchSqlException.class, () -> SpannerStatementBinder.bind(query));

    assertEquals(ErrorCode.INVALID_QUERY, e.getErrorCode());
  }
}
