package com.example.vparam.source;

import java.util.List;

/**
 * Raw input supplied by the host: every value sent under a flat parameter name, plus the raw
 * request body for structured selectors.
 */
public interface ParamSource {

  /** All values for {@code name} in arrival order; empty when the parameter was not sent. */
  List<String> values(String name);

  /** The raw request body, or {@code null} when there is none. */
  String body();
}
