package com.example.authengine.adapter.db;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory {@link DatabaseAdapter} for development and tests. Each model is a list of rows
 * guarded by the list's own monitor; callers always receive copies.
 */
@Slf4j
public class MemoryDatabaseAdapter implements DatabaseAdapter {

  private final Map<String, List<Map<String, Object>>> tables = new ConcurrentHashMap<>();

  @Override
  public String id() {
    return "memory";
  }

  @Override
  public Map<String, Object> create(String model, Map<String, Object> data) {
    Map<String, Object> row = new LinkedHashMap<>(data);
    List<Map<String, Object>> table = table(model);
    synchronized (table) {
      table.add(row);
    }
    log.trace("Created {} row {}", model, row.get("id"));
    return new LinkedHashMap<>(row);
  }

  @Override
  public Optional<Map<String, Object>> findOne(String model, List<Where> where) {
    List<Map<String, Object>> table = table(model);
    synchronized (table) {
      return table.stream()
          .filter(row -> matches(row, where))
          .findFirst()
          .map(LinkedHashMap::new);
    }
  }

  @Override
  public List<Map<String, Object>> findMany(String model, List<Where> where, SortBy sortBy,
                                            Integer limit, Integer offset) {
    List<Map<String, Object>> table = table(model);
    List<Map<String, Object>> result = new ArrayList<>();
    synchronized (table) {
      for (Map<String, Object> row : table) {
        if (matches(row, where)) {
          result.add(new LinkedHashMap<>(row));
        }
      }
    }
    if (sortBy != null) {
      Comparator<Object> valueOrder = Comparator.nullsFirst(MemoryDatabaseAdapter::compareValues);
      Comparator<Map<String, Object>> comparator =
          (a, b) -> valueOrder.compare(a.get(sortBy.field()), b.get(sortBy.field()));
      result.sort(sortBy.direction() == SortBy.Direction.DESC ? comparator.reversed() : comparator);
    }
    int from = offset == null ? 0 : Math.min(offset, result.size());
    int to = limit == null ? result.size() : Math.min(from + limit, result.size());
    return new ArrayList<>(result.subList(from, to));
  }

  @Override
  public long count(String model, List<Where> where) {
    List<Map<String, Object>> table = table(model);
    synchronized (table) {
      return table.stream().filter(row -> matches(row, where)).count();
    }
  }

  @Override
  public Optional<Map<String, Object>> update(String model, List<Where> where, Map<String, Object> data) {
    List<Map<String, Object>> table = table(model);
    synchronized (table) {
      for (Map<String, Object> row : table) {
        if (matches(row, where)) {
          row.putAll(data);
          return Optional.of(new LinkedHashMap<>(row));
        }
      }
    }
    return Optional.empty();
  }

  @Override
  public long updateMany(String model, List<Where> where, Map<String, Object> data) {
    List<Map<String, Object>> table = table(model);
    long updated = 0;
    synchronized (table) {
      for (Map<String, Object> row : table) {
        if (matches(row, where)) {
          row.putAll(data);
          updated++;
        }
      }
    }
    return updated;
  }

  @Override
  public void delete(String model, List<Where> where) {
    List<Map<String, Object>> table = table(model);
    synchronized (table) {
      Iterator<Map<String, Object>> it = table.iterator();
      while (it.hasNext()) {
        if (matches(it.next(), where)) {
          it.remove();
          return;
        }
      }
    }
  }

  @Override
  public long deleteMany(String model, List<Where> where) {
    List<Map<String, Object>> table = table(model);
    synchronized (table) {
      int before = table.size();
      table.removeIf(row -> matches(row, where));
      return before - table.size();
    }
  }

  private List<Map<String, Object>> table(String model) {
    return tables.computeIfAbsent(model, k -> new ArrayList<>());
  }

  static boolean matches(Map<String, Object> row, List<Where> where) {
    if (where == null || where.isEmpty()) {
      return true;
    }
    boolean result = evaluate(row, where.get(0));
    for (int i = 1; i < where.size(); i++) {
      Where clause = where.get(i);
      boolean current = evaluate(row, clause);
      result = clause.connector() == Where.Connector.OR ? result || current : result && current;
    }
    return result;
  }

  private static boolean evaluate(Map<String, Object> row, Where clause) {
    Object actual = row.get(clause.field());
    Object expected = clause.value();
    return switch (clause.operator()) {
      case EQ -> valueEquals(actual, expected);
      case NE -> !valueEquals(actual, expected);
      case IN -> ((Collection<?>) expected).stream().anyMatch(v -> valueEquals(actual, v));
      case NOT_IN -> ((Collection<?>) expected).stream().noneMatch(v -> valueEquals(actual, v));
      case CONTAINS -> actual != null && expected != null
          && actual.toString().contains(expected.toString());
      case STARTS_WITH -> actual != null && expected != null
          && actual.toString().startsWith(expected.toString());
      case ENDS_WITH -> actual != null && expected != null
          && actual.toString().endsWith(expected.toString());
    };
  }

  private static boolean valueEquals(Object actual, Object expected) {
    if (actual instanceof Number a && expected instanceof Number b) {
      return a.doubleValue() == b.doubleValue();
    }
    return Objects.equals(actual, expected);
  }

  @SuppressWarnings("unchecked")
  private static int compareValues(Object a, Object b) {
    if (a instanceof Comparable<?> && a.getClass().isInstance(b)) {
      return ((Comparable<Object>) a).compareTo(b);
    }
    return a.toString().compareTo(b.toString());
  }
}
