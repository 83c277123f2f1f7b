package com.example.vparam.validation;

import com.example.vparam.config.VparamProperties;
import com.example.vparam.spec.FieldSpec;
import com.example.vparam.type.Numbers;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;

/**
 * Builds the paging fields for table listings: page number, rows per page, order-by column and
 * order direction. Field names and defaults come from {@link VparamProperties.Sort}; a blank name
 * drops that field.
 */
@RequiredArgsConstructor
public class SortHelper {

  private static final Pattern DIRECTION = Pattern.compile("^(?:asc|desc)$", Pattern.CASE_INSENSITIVE);

  private final VparamProperties props;

  public Map<String, FieldSpec> sortFields(List<String> columns) {
    List<String> safeColumns = checkColumns(columns);
    VparamProperties.Sort sort = props.getSort();
    Map<String, FieldSpec> fields = new LinkedHashMap<>();

    if (isSet(sort.getPage())) {
      fields.put(sort.getPage(), FieldSpec.builder().type("int").defaultValue(1).build());
    }
    if (isSet(sort.getRowsParam())) {
      fields.put(sort.getRowsParam(), FieldSpec.builder().type("int").defaultValue(sort.getRows()).build());
    }
    if (isSet(sort.getOrderBy())) {
      fields.put(sort.getOrderBy(), FieldSpec.builder()
          .type("int")
          .defaultValue(0)
          .post(value -> orderBy(value, safeColumns))
          .build());
    }
    if (isSet(sort.getOrderDirection())) {
      fields.put(sort.getOrderDirection(), FieldSpec.builder()
          .type("str")
          .defaultValue(sort.getDirection())
          .post(value -> value == null ? null : value.toString().toUpperCase(Locale.ROOT))
          .regexp(DIRECTION)
          .build());
    }
    return fields;
  }

  /**
   * Column at {@code index} when the list has one there, otherwise {@code index + 1}, and 1 when
   * that is zero. {@link Integer#MAX_VALUE} stays as it is.
   */
  static Object orderBy(Object value, List<String> columns) {
    Integer index = Numbers.toInteger(value);
    if (index == null) {
      return 1;
    }
    if (index >= 0 && index < columns.size()) {
      return columns.get(index);
    }
    if (index == Integer.MAX_VALUE) {
      return index;
    }
    int next = index + 1;
    return next != 0 ? next : 1;
  }

  private static List<String> checkColumns(List<String> columns) {
    if (columns == null) {
      return List.of();
    }
    for (String column : columns) {
      if (column == null || column.isBlank()) {
        throw new ConfigurationException("Sort columns must be non-blank names, got " + columns);
      }
    }
    return List.copyOf(columns);
  }

  private static boolean isSet(String name) {
    return name != null && !name.isBlank();
  }
}
