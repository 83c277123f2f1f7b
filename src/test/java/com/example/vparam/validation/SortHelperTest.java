package com.example.vparam.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.vparam.VparamTestSupport;
import com.example.vparam.config.VparamProperties;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class SortHelperTest {

  private static final List<String> COLUMNS = List.of("name", "date");

  @Test
  void orderByFallbackChain() {
    assertThat(SortHelper.orderBy(1, COLUMNS)).isEqualTo("date");
    assertThat(SortHelper.orderBy("0", COLUMNS)).isEqualTo("name");
    assertThat(SortHelper.orderBy(5, COLUMNS)).isEqualTo(6);
    assertThat(SortHelper.orderBy(-1, COLUMNS)).isEqualTo(1);
    assertThat(SortHelper.orderBy(-3, COLUMNS)).isEqualTo(-2);
    assertThat(SortHelper.orderBy(null, COLUMNS)).isEqualTo(1);
    assertThat(SortHelper.orderBy(0, List.of())).isEqualTo(1);
  }

  @Test
  void orderByLargestIndexDoesNotWrap() {
    assertThat(SortHelper.orderBy(Integer.MAX_VALUE, List.of("a"))).isEqualTo(Integer.MAX_VALUE);
    assertThat(SortHelper.orderBy(String.valueOf(Integer.MAX_VALUE), List.of("a"))).isEqualTo(Integer.MAX_VALUE);
  }

  @Test
  void blankNameDisablesField() {
    VparamProperties props = VparamTestSupport.props();
    props.getSort().setPage("");
    props.getSort().setOrderDirection(null);
    props.getSort().setRowsParam("limit");

    assertThat(new SortHelper(props).sortFields(COLUMNS)).containsOnlyKeys("limit", "oby");
  }

  @Test
  void rowsDefaultComesFromConfiguration() {
    VparamProperties props = VparamTestSupport.props();
    props.getSort().setRows(50);

    assertThat(new SortHelper(props).sortFields(null).get("rws").getDefaultValue()).isEqualTo(50);
  }

  @Test
  void nullColumnIsRejected() {
    SortHelper helper = new SortHelper(VparamTestSupport.props());

    assertThatThrownBy(() -> helper.sortFields(Arrays.asList("name", null)))
        .isInstanceOf(ConfigurationException.class);
  }
}
