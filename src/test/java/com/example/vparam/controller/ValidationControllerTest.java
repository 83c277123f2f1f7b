package com.example.vparam.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.vparam.VparamTestSupport;
import com.example.vparam.request.FieldDescriptor;
import com.example.vparam.request.ValidateRequest;
import com.example.vparam.response.ErrorView;
import com.example.vparam.response.ValidateResponse;
import com.example.vparam.validation.VparamService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

class ValidationControllerTest {

  private final ValidationController controller = new ValidationController(VparamTestSupport.service());

  @Test
  void validateReturnsValuesAndErrors() {
    Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
    fields.put("id", FieldDescriptor.builder().type("int").build());
    fields.put("tags", FieldDescriptor.builder().type("@str").build());
    fields.put("age", FieldDescriptor.builder().type("int").filters(Map.of("range", List.of(18, 99))).build());

    ValidateRequest request = ValidateRequest.builder()
        .params(Map.of("id", List.of("12"), "tags", List.of("a", "b"), "age", List.of("7")))
        .fields(fields)
        .build();

    ResponseEntity<ValidateResponse> response = controller.validate(request).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCodeValue()).isEqualTo(200);
    ValidateResponse body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body.getValues())
        .containsEntry("id", 12)
        .containsEntry("tags", List.of("a", "b"))
        .containsEntry("age", null);
    assertThat(body.getErrorCount()).isEqualTo(1);
    assertThat(body.getErrors()).containsOnlyKeys("age");
    ErrorView error = body.getErrors().get("age").get(0);
    assertThat(error.getMessage()).isEqualTo("Value should not be less than 18");
    assertThat(error.getStage()).isEqualTo("FILTER");
    assertThat(error.getFilter()).isEqualTo("range");
    assertThat(error.getOriginal()).isEqualTo("7");
    assertThat(body.getProblems()).isEmpty();
  }

  @Test
  void validateReturnsBadRequestForUnknownType() {
    ValidateRequest request = ValidateRequest.builder()
        .fields(Map.of("x", FieldDescriptor.builder().type("nope").build()))
        .build();

    ResponseEntity<ValidateResponse> response = controller.validate(request).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCodeValue()).isEqualTo(400);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().getProblems()).containsExactly("Type \"nope\" is not defined");
    assertThat(response.getBody().getValues()).isEmpty();
  }

  @Test
  void validateReturnsUnexpectedErrors() {
    VparamService service = mock(VparamService.class);
    when(service.newContext(any())).thenThrow(new IllegalStateException("boom"));
    ValidationController failing = new ValidationController(service);

    ValidateRequest request = ValidateRequest.builder()
        .fields(Map.of("x", FieldDescriptor.builder().type("int").build()))
        .build();

    ResponseEntity<ValidateResponse> response = failing.validate(request).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCodeValue()).isEqualTo(500);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().getProblems()).containsExactly("Unexpected error: boom");
  }

  @Test
  void validateAddsPagingFieldsWhenSortIsGiven() {
    ValidateRequest request = ValidateRequest.builder()
        .params(Map.of("oby", List.of("1"), "ods", List.of("desc")))
        .fields(Map.of("q", FieldDescriptor.builder().type("?str").build()))
        .sort(List.of("name", "date"))
        .build();

    ResponseEntity<ValidateResponse> response = controller.validate(request).block();

    assertThat(response).isNotNull();
    ValidateResponse body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body.getValues().keySet()).containsExactly("page", "rws", "oby", "ods", "q");
    assertThat(body.getValues())
        .containsEntry("page", 1)
        .containsEntry("rws", 25)
        .containsEntry("oby", "date")
        .containsEntry("ods", "DESC");
    assertThat(body.getErrorCount()).isZero();
  }

  @Test
  void listsRegisteredNames() {
    ResponseEntity<List<String>> types = controller.types().block();
    ResponseEntity<List<String>> filters = controller.filters().block();

    assertThat(types).isNotNull();
    assertThat(types.getBody()).contains("int", "str", "date", "address", "number");
    assertThat(filters).isNotNull();
    assertThat(filters.getBody()).containsExactly("in", "max", "min", "range", "regexp", "size");
  }
}
