package com.example.vparam.source;

import com.example.vparam.validation.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * JSON Pointer selector over a JSON body. A scalar at the pointer yields one value, an array
 * yields one value per element, an object yields its JSON text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonPointerExtractor implements DocumentExtractor {

  private final ObjectMapper objectMapper;

  @Override
  public SelectorKind kind() {
    return SelectorKind.JPATH;
  }

  @Override
  public Object parse(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      log.warn("Request body is not valid JSON: {}", ex.getOriginalMessage());
      return null;
    }
  }

  @Override
  public List<String> select(Object document, String path) {
    JsonNode root = (JsonNode) document;
    JsonNode node;
    try {
      node = root.at(JsonPointer.compile(path));
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException(
          "Invalid JSON pointer \"" + path + "\"", ex);
    }
    if (node.isMissingNode()) {
      return List.of();
    }
    if (node.isArray()) {
      List<String> values = new ArrayList<>(node.size());
      node.forEach(element -> values.add(toRaw(element)));
      return values;
    }
    return Collections.singletonList(toRaw(node));
  }

  private static String toRaw(JsonNode node) {
    if (node.isNull()) {
      return null;
    }
    return node.isValueNode() ? node.asText() : node.toString();
  }
}
