package com.example.vparam.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.vparam.validation.ConfigurationException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class XPathExtractorTest {

  private final XPathExtractor extractor = new XPathExtractor();

  @Test
  void selectsTextOfEveryMatch() {
    Object doc = extractor.parse("<order><item>1</item><item>2</item><note>hi</note></order>");

    assertThat(extractor.select(doc, "/order/item")).containsExactly("1", "2");
    assertThat(extractor.select(doc, "/order/missing")).isEmpty();
  }

  @Test
  void malformedBodyIsNullAndNothingReachesStderr() {
    PrintStream original = System.err;
    ByteArrayOutputStream captured = new ByteArrayOutputStream();
    System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
    try {
      assertThat(extractor.parse("<order><item>1</order>")).isNull();
    } finally {
      System.setErr(original);
    }

    assertThat(captured.toString(StandardCharsets.UTF_8)).isEmpty();
  }

  @Test
  void doctypeIsRefused() {
    String xxe = "<?xml version=\"1.0\"?><!DOCTYPE a [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><a>&x;</a>";

    assertThat(extractor.parse(xxe)).isNull();
  }

  @Test
  void badExpressionIsConfigurationError() {
    Object doc = extractor.parse("<a/>");

    assertThatThrownBy(() -> extractor.select(doc, "/a[")).isInstanceOf(ConfigurationException.class);
  }
}
