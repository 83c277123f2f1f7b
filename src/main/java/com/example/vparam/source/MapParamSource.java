package com.example.vparam.source;

import java.util.List;
import java.util.Map;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/** {@link ParamSource} over an in-memory multi-value map, as produced by form or query parsing. */
public class MapParamSource implements ParamSource {

  private final MultiValueMap<String, String> params;
  private final String body;

  public MapParamSource(MultiValueMap<String, String> params, String body) {
    this.params = params == null ? new LinkedMultiValueMap<>() : params;
    this.body = body;
  }

  public static MapParamSource of(Map<String, List<String>> params) {
    return of(params, null);
  }

  public static MapParamSource of(Map<String, List<String>> params, String body) {
    MultiValueMap<String, String> copy = new LinkedMultiValueMap<>();
    if (params != null) {
      params.forEach((name, values) -> {
        if (values != null) {
          copy.addAll(name, values);
        }
      });
    }
    return new MapParamSource(copy, body);
  }

  public static MapParamSource ofBody(String body) {
    return new MapParamSource(null, body);
  }

  @Override
  public List<String> values(String name) {
    List<String> values = params.get(name);
    return values == null ? List.of() : values;
  }

  @Override
  public String body() {
    return body;
  }
}
