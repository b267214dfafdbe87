package com.example.authengine.adapter.db;

import java.util.Collection;

/**
 * One clause of a structured filter. Clauses are combined left to right using each clause's
 * connector; the connector of the first clause is ignored.
 */
public record Where(String field, Operator operator, Object value, Connector connector) {

  public enum Operator {
    EQ, NE, IN, NOT_IN, CONTAINS, STARTS_WITH, ENDS_WITH
  }

  public enum Connector {
    AND, OR
  }

  public Where {
    if (field == null || field.isBlank()) {
      throw new IllegalArgumentException("Where field cannot be blank");
    }
    operator = operator == null ? Operator.EQ : operator;
    connector = connector == null ? Connector.AND : connector;
    if ((operator == Operator.IN || operator == Operator.NOT_IN) && !(value instanceof Collection)) {
      throw new IllegalArgumentException(operator + " requires a collection value for field " + field);
    }
  }

  public static Where eq(String field, Object value) {
    return new Where(field, Operator.EQ, value, Connector.AND);
  }

  public static Where of(String field, Operator operator, Object value) {
    return new Where(field, operator, value, Connector.AND);
  }

  public Where or() {
    return new Where(field, operator, value, Connector.OR);
  }
}
