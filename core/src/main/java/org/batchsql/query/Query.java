/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.query;

import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;
import org.batchsql.exception.BatchSqlException;
import org.batchsql.exception.ErrorCode;

/**
 * Immutable SQL text plus named parameters. Parameters are referenced as {@code @name} in the
 * text and bound by name; values use the same Java types as result columns. An {@code @name}
 * inside a quoted string, a quoted identifier or a comment is not a reference.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Query {

  /** Quoted text and comments are matched whole so that only group 1 marks a real reference. */
  private static final Pattern PARAMETER_REFERENCE =
      Pattern.compile(
          "'(?:[^'\\\\]|\\\\.)*'"
              + "|\"(?:[^\"\\\\]|\\\\.)*\""
              + "|`[^`]*`"
              + "|--[^\\n]*"
              + "|#[^\\n]*"
              + "|/\\*.*?\\*/"
              + "|@([A-Za-z_][A-Za-z0-9_]*)",
          Pattern.DOTALL);

  private final String sql;

  /** Parameter values by name. Values may be null for SQL NULL. */
  private final Map<String, Object> parameters;

  private Query(String sql, Map<String, Object> parameters) {
    this.sql = sql;
    this.parameters = parameters;
  }

  public static Query of(String sql) {
    return new Query(sql, ImmutableMap.of());
  }

  public static Query of(String sql, Map<String, ?> parameters) {
    // LinkedHashMap keeps null values, which ImmutableMap would reject.
    return new Query(sql, Collections.unmodifiableMap(new LinkedHashMap<>(parameters)));
  }

  /** Returns the parameter names referenced in the SQL text, in order of first appearance. */
  public Set<String> referencedParameters() {
    Set<String> names = new LinkedHashSet<>();
    if (sql != null) {
      Matcher matcher = PARAMETER_REFERENCE.matcher(sql);
      while (matcher.find()) {
        if (matcher.group(1) != null) {
          names.add(matcher.group(1));
        }
      }
    }
    return names;
  }

  /**
   * Checks that the query can be submitted: the text is not blank and every supplied parameter is
   * referenced by the text.
   *
   * @throws BatchSqlException with {@link ErrorCode#INVALID_QUERY} otherwise
   */
  public void validate() {
    if (StringUtils.isBlank(sql)) {
      throw new BatchSqlException(ErrorCode.INVALID_QUERY, "Query text must not be empty");
    }
    Set<String> referenced = referencedParameters();
    for (String name : parameters.keySet()) {
      if (!referenced.contains(name)) {
        throw new BatchSqlException(
            ErrorCode.INVALID_QUERY,
            "Parameter @" + name + " is not referenced by the query text");
      }
    }
  }
}
