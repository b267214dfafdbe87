package com.example.authengine.adapter.db;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage contract consumed by the engine. Implementations abstract over a relational or
 * document database and own their own transaction and isolation discipline.
 *
 * <p>Rows are exchanged as field maps keyed by the logical field names of the schema registry.
 * Models used by the engine are {@code user}, {@code session}, {@code account} and
 * {@code verification}; plugins may add more.
 */
public interface DatabaseAdapter {

  String id();

  Map<String, Object> create(String model, Map<String, Object> data);

  Optional<Map<String, Object>> findOne(String model, List<Where> where);

  List<Map<String, Object>> findMany(String model, List<Where> where, SortBy sortBy,
                                     Integer limit, Integer offset);

  default List<Map<String, Object>> findMany(String model, List<Where> where) {
    return findMany(model, where, null, null, null);
  }

  long count(String model, List<Where> where);

  /**
   * Updates the first matching row and returns it, or empty when nothing matched.
   */
  Optional<Map<String, Object>> update(String model, List<Where> where, Map<String, Object> data);

  long updateMany(String model, List<Where> where, Map<String, Object> data);

  void delete(String model, List<Where> where);

  long deleteMany(String model, List<Where> where);
}
