package com.example.vparam.source;

/** Structured document selectors a field can use instead of the flat parameter source. */
public enum SelectorKind {
  /** JSON Pointer into a JSON body, e.g. {@code /point/lon}. */
  JPATH,
  /** CSS selector into an HTML/XML body, e.g. {@code Point > Lon}. */
  CPATH,
  /** XPath into an XML body, e.g. {@code /Point/@time}. */
  XPATH
}
