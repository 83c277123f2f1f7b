package com.example.vparam.spec;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.vparam.VparamTestSupport;
import com.example.vparam.config.VparamProperties;
import com.example.vparam.source.SelectorKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class FieldSpecResolverTest {

  private final VparamProperties props = VparamTestSupport.props();
  private final FieldSpecResolver resolver =
      new FieldSpecResolver(VparamTestSupport.types(props), VparamTestSupport.filters(), props);

  @Test
  void typeStagesFillTheGaps() {
    ResolvedField field = resolver.resolve("id", FieldSpec.of("@int"), null, null);

    assertThat(field.getType()).isEqualTo("int");
    assertThat(field.isArray()).isTrue();
    assertThat(field.isOptional()).isFalse();
    assertThat(field.getPre()).isNotNull();
    assertThat(field.getValid()).isNotNull();
    assertThat(field.getPost()).isNotNull();
  }

  @Test
  void filtersKeepDeclarationOrder() {
    FieldSpec spec = FieldSpec.builder().type("str").size(1, 5).regexp("^a").in(List.of("ab")).build();

    ResolvedField field = resolver.resolve("code", spec, null, null);

    assertThat(field.getFilters()).extracting(BoundFilter::name).containsExactly("size", "regexp", "in");
  }

  @Test
  void callFlagsApplyWhenSpecIsSilent() {
    ResolvedField field = resolver.resolve("tags", FieldSpec.of("str"), true, true);

    assertThat(field.isOptional()).isTrue();
    assertThat(field.isSkipundef()).isTrue();
  }

  @Test
  void selectorIsCarried() {
    ResolvedField field = resolver.resolve("id", FieldSpec.builder().type("int").jpath("/id").build(), null, null);

    assertThat(field.getSelector().kind()).isEqualTo(SelectorKind.JPATH);
    assertThat(field.getSelector().path()).isEqualTo("/id");
  }
}
