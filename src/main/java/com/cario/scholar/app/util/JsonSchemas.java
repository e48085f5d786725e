package com.cario.scholar.app.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import java.util.List;
import java.util.Map;

/** JSON schemas for structured LLM output, generated from response POJOs. */
public final class JsonSchemas {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private JsonSchemas() {}

  /**
   * Strict schema for {@code type}: every object closed to additional properties and every
   * property required, as the OpenAI {@code json_schema} strict mode demands.
   */
  public static Map<String, Object> fromPojo(Class<?> type) {
    SchemaGeneratorConfigBuilder cfgBuilder =
        new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON);
    cfgBuilder.with(new JacksonModule());

    SchemaGenerator generator = new SchemaGenerator(cfgBuilder.build());
    JsonNode schemaNode = generator.generateSchema(type);

    Map<String, Object> schema =
        MAPPER.convertValue(schemaNode, new TypeReference<Map<String, Object>>() {});
    schema.remove("$schema");
    schema.remove("$id");
    schema.put("type", "object");
    schema.put("additionalProperties", false);

    enforceNoAdditionalProperties(schema);
    return schema;
  }

  @SuppressWarnings("unchecked")
  static void enforceNoAdditionalProperties(Map<String, Object> schema) {
    if (schema == null) return;

    if ("object".equals(schema.get("type"))) {
      schema.put("additionalProperties", false);
      if (schema.get("properties") instanceof Map<?, ?> propsMap) {
        List<String> keys = propsMap.keySet().stream().map(Object::toString).toList();
        schema.put("required", keys);
        for (Object v : propsMap.values()) {
          if (v instanceof Map<?, ?> child) {
            enforceNoAdditionalProperties((Map<String, Object>) child);
          }
        }
      }
    }

    if ("array".equals(schema.get("type")) && schema.get("items") instanceof Map<?, ?> child) {
      enforceNoAdditionalProperties((Map<String, Object>) child);
    }

    for (String composite : List.of("anyOf", "oneOf", "allOf")) {
      if (schema.get(composite) instanceof List<?> list) {
        for (Object item : list) {
          if (item instanceof Map<?, ?> child) {
            enforceNoAdditionalProperties((Map<String, Object>) child);
          }
        }
      }
    }

    for (String defsKey : List.of("definitions", "$defs")) {
      if (schema.get(defsKey) instanceof Map<?, ?> defsMap) {
        for (Object v : defsMap.values()) {
          if (v instanceof Map<?, ?> child) {
            enforceNoAdditionalProperties((Map<String, Object>) child);
          }
        }
      }
    }
  }
}
