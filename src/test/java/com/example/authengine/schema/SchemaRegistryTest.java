package com.example.authengine.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.ContextBuildException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaRegistryTest {

  private SchemaRegistry registry;

  @BeforeEach
  void setUp() {
    SchemaRegistry.Builder builder = SchemaRegistry.builder();
    BaseSchema.fields().forEach(field -> builder.add("core", field));
    builder.add("profile", FieldAttribute.of(SchemaRegistry.USER, "nickname", FieldType.STRING).withRequired(true));
    builder.add("profile", FieldAttribute.of(SchemaRegistry.USER, "age", FieldType.NUMBER));
    builder.add("profile", FieldAttribute.of(SchemaRegistry.USER, "tier", FieldType.STRING).withDefault("free"));
    builder.add("profile", FieldAttribute.of(SchemaRegistry.USER, "apiKey", FieldType.STRING).withReturned(false));
    registry = builder.build();
  }

  @Test
  void inputDropsUnknownKeysAndCoercesValues() {
    Map<String, Object> input = new LinkedHashMap<>();
    input.put("nickname", "ada");
    input.put("age", "36");
    input.put("favouriteColour", "green");

    Map<String, Object> result = registry.transformInput(SchemaRegistry.USER, input, false);

    assertThat(result).containsOnly(Map.entry("nickname", "ada"), Map.entry("age", 36.0));
  }

  @Test
  void inputRejectsEngineOwnedFields() {
    assertThatThrownBy(() -> registry.transformInput(SchemaRegistry.USER, Map.of("emailVerified", true), false))
        .isInstanceOfSatisfying(AuthApiException.class,
            e -> assertThat(e.getCode()).isEqualTo("FIELD_NOT_ALLOWED"));
  }

  @Test
  void inputReportsEveryTypeProblemAndMissingField() {
    Map<String, Object> input = Map.of("age", "old", "name", 42);

    assertThatThrownBy(() -> registry.transformInput(SchemaRegistry.USER, input, true))
        .isInstanceOfSatisfying(AuthApiException.class, e -> {
          assertThat(e.getCode()).isEqualTo("VALIDATION_ERROR");
          assertThat(e.getDetails()).extracting(detail -> detail.get("field"))
              .containsExactlyInAnyOrder("age", "name", "id", "email", "nickname");
        });
  }

  @Test
  void defaultsFillOnlyMissingValues() {
    Map<String, Object> result = registry.applyDefaults(SchemaRegistry.USER, Map.of("nickname", "ada"));

    assertThat(result)
        .containsEntry("tier", "free")
        .containsEntry("emailVerified", false)
        .containsEntry("nickname", "ada");
    assertThat(registry.applyDefaults(SchemaRegistry.USER, Map.of("tier", "pro"))).containsEntry("tier", "pro");
  }

  @Test
  void outputHidesUnreturnedFields() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", "u1");
    row.put("nickname", "ada");
    row.put("apiKey", "secret");
    row.put("createdAt", Instant.EPOCH);

    assertThat(registry.transformOutput(SchemaRegistry.USER, row))
        .containsOnlyKeys("id", "nickname", "createdAt");
  }

  @Test
  void accountTokensAreNeverReturned() {
    Map<String, Object> row = Map.of("id", "a1", "providerId", "github", "accessToken", "at", "refreshToken", "rt");

    assertThat(registry.transformOutput(SchemaRegistry.ACCOUNT, row)).containsOnlyKeys("id", "providerId");
  }

  @Test
  void duplicateFieldNamesTheOwners() {
    SchemaRegistry.Builder builder = SchemaRegistry.builder()
        .add("one", FieldAttribute.of(SchemaRegistry.USER, "nickname", FieldType.STRING));

    assertThatThrownBy(() -> builder.add("two", FieldAttribute.of(SchemaRegistry.USER, "nickname", FieldType.NUMBER)))
        .isInstanceOf(ContextBuildException.class)
        .hasMessageContaining("'two'")
        .hasMessageContaining("'one'");
  }

  @Test
  void fieldAttributeNeedsAType() {
    assertThatThrownBy(() -> FieldAttribute.of(SchemaRegistry.USER, "x", null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void unknownEntityIsAnError() {
    assertThat(registry.get("team")).isEmpty();
    assertThatThrownBy(() -> registry.require("team")).isInstanceOf(IllegalArgumentException.class);
    assertThat(registry.require(SchemaRegistry.SESSION).fields()).extracting(FieldAttribute::field)
        .contains("token", "expiresAt");
    assertThat(List.of(SchemaRegistry.USER, SchemaRegistry.ACCOUNT, SchemaRegistry.VERIFICATION))
        .allMatch(entity -> registry.get(entity).isPresent());
  }
}
