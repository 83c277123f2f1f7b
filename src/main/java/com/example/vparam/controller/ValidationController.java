package com.example.vparam.controller;

import com.example.vparam.request.FieldDescriptor;
import com.example.vparam.request.ValidateRequest;
import com.example.vparam.response.ErrorView;
import com.example.vparam.response.ValidateResponse;
import com.example.vparam.source.MapParamSource;
import com.example.vparam.spec.FieldSpecs;
import com.example.vparam.validation.ConfigurationException;
import com.example.vparam.validation.ValidationContext;
import com.example.vparam.validation.VparamService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/v1/vparam")
@Tag(name = "Validation Playground", description = "Run field specs against sample parameters")
@RequiredArgsConstructor
public class ValidationController {

    private final VparamService vparamService;

    @PostMapping("/validate")
    @Operation(
            summary = "Validate sample parameters",
            description = "Runs the described fields against the supplied parameters and body and returns typed values plus errors."
    )
    public Mono<ResponseEntity<ValidateResponse>> validate(@Valid @RequestBody ValidateRequest req) {
        return Mono.fromCallable(() -> run(req))
                .map(response -> ResponseEntity.ok(response))
                .onErrorResume(ConfigurationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(toProblemResponse(ex.getMessage()))))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while validating parameters", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(toUnexpectedErrorResponse(ex)));
                });
    }

    @GetMapping("/types")
    @Operation(summary = "List registered type names")
    public Mono<ResponseEntity<List<String>>> types() {
        return Mono.just(ResponseEntity.ok(List.copyOf(vparamService.typeNames())));
    }

    @GetMapping("/filters")
    @Operation(summary = "List registered filter names")
    public Mono<ResponseEntity<List<String>>> filters() {
        return Mono.just(ResponseEntity.ok(List.copyOf(vparamService.filterNames())));
    }

    private ValidateResponse run(ValidateRequest req) {
        ValidationContext ctx = vparamService.newContext(MapParamSource.of(req.getParams(), req.getBody()));

        FieldSpecs.Builder specs = FieldSpecs.builder()
                .optional(req.getOptional())
                .skipundef(req.getSkipundef());
        req.getFields().forEach((name, descriptor) ->
                specs.field(name, (descriptor == null ? new FieldDescriptor() : descriptor).toSpec()));

        Map<String, Object> values = req.getSort() == null
                ? vparamService.validateMany(ctx, specs.build())
                : vparamService.validateSorted(ctx, req.getSort(), specs.build());

        return toResponse(values, ctx);
    }

    private ValidateResponse toResponse(Map<String, Object> values, ValidationContext ctx) {
        Map<String, List<ErrorView>> errors = new LinkedHashMap<>();
        ctx.allErrors().forEach((field, records) ->
                errors.put(field, records.stream().map(ErrorView::from).toList()));
        return ValidateResponse.builder()
                .values(values)
                .errors(errors)
                .errorCount(ctx.errorCount())
                .problems(List.of())
                .build();
    }

    private ValidateResponse toProblemResponse(String message) {
        return ValidateResponse.builder()
                .values(Map.of())
                .errors(Map.of())
                .problems(List.of(message))
                .build();
    }

    private ValidateResponse toUnexpectedErrorResponse(Throwable ex) {
        String detail = ex.getMessage();
        String message = (detail == null || detail.isBlank())
                ? "Unexpected error occurred."
                : "Unexpected error: " + detail;
        return toProblemResponse(message);
    }
}
