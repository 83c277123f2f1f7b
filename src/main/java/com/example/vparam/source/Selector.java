package com.example.vparam.source;

import java.util.Objects;

public record Selector(SelectorKind kind, String path) {

  public Selector {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(path, "path");
  }

  public static Selector jpath(String path) {
    return new Selector(SelectorKind.JPATH, path);
  }

  public static Selector cpath(String path) {
    return new Selector(SelectorKind.CPATH, path);
  }

  public static Selector xpath(String path) {
    return new Selector(SelectorKind.XPATH, path);
  }
}
