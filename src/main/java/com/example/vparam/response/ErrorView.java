package com.example.vparam.response;

import com.example.vparam.validation.ValidationError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorView {
  private Integer index;
  private String original;
  private String message;
  private String stage;
  private String filter;

  public static ErrorView from(ValidationError error) {
    return ErrorView.builder()
        .index(error.getIndex())
        .original(error.getOriginal())
        .message(error.getMessage())
        .stage(error.getStage() == null ? null : error.getStage().name())
        .filter(error.getFilter())
        .build();
  }
}
