package com.example.authengine.adapter.db;

public record SortBy(String field, Direction direction) {

  public enum Direction {
    ASC, DESC
  }

  public static SortBy asc(String field) {
    return new SortBy(field, Direction.ASC);
  }

  public static SortBy desc(String field) {
    return new SortBy(field, Direction.DESC);
  }
}
