package com.example.vparam.source;

import java.util.List;

/**
 * Pulls raw textual values out of a structured request body. The body is parsed once per
 * validation context and the parsed document is reused for every field using the same kind.
 */
public interface DocumentExtractor {

  SelectorKind kind();

  /** Parses the body; returns {@code null} when it is empty or unparseable. */
  Object parse(String body);

  /** Zero or more raw values at {@code path}; a {@code null} entry stands for an explicit null. */
  List<String> select(Object document, String path);
}
