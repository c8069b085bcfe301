package com.example.roledocs.controller;

import com.example.roledocs.dto.ClassifyRequest;
import com.example.roledocs.dto.TypeInferenceRequest;
import com.example.roledocs.dto.TypeResponse;
import com.example.roledocs.model.RepoType;
import com.example.roledocs.model.RoleInfo;
import com.example.roledocs.service.RoleDocsService;
import com.example.roledocs.service.inference.RoleVarTypeClassifier;
import com.example.roledocs.service.inference.TypeInferrer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API для разбора defaults-файлов и определения типов переменных.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RoleDocsController {

    private static final MediaType TEXT_MARKDOWN = MediaType.parseMediaType("text/markdown; charset=utf-8");

    private final RoleDocsService roleDocsService;
    private final TypeInferrer typeInferrer;
    private final RoleVarTypeClassifier roleVarClassifier;

    /**
     * Разбирает переданный defaults-файл роли.
     *
     * POST /api/v1/roles/{role}/parse?repoType=saltbox
     */
    @PostMapping(value = "/roles/{role}/parse", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<RoleInfo> parse(
            @PathVariable String role,
            @RequestParam(defaultValue = "saltbox") String repoType,
            @RequestBody String content) {

        log.info("Parsing defaults for role: {}", role);

        RoleInfo roleInfo = roleDocsService.parse(content, role, RepoType.fromTag(repoType));
        return ResponseEntity.ok(roleInfo);
    }

    /**
     * Разбирает defaults-файл и возвращает документацию в Markdown.
     *
     * POST /api/v1/roles/{role}/markdown?repoType=saltbox
     */
    @PostMapping(value = "/roles/{role}/markdown", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> markdown(
            @PathVariable String role,
            @RequestParam(defaultValue = "saltbox") String repoType,
            @RequestBody String content) {

        log.info("Generating markdown for role: {}", role);

        RoleInfo roleInfo = roleDocsService.parse(content, role, RepoType.fromTag(repoType));
        return ResponseEntity.ok()
                .contentType(TEXT_MARKDOWN)
                .body(roleDocsService.generateMarkdown(roleInfo));
    }

    /**
     * Определяет тип переменной по имени и значению.
     *
     * POST /api/v1/types/infer
     */
    @PostMapping("/types/infer")
    public ResponseEntity<TypeResponse> inferType(@RequestBody @Valid TypeInferenceRequest request) {
        log.debug("Inferring type for: {}", request.getName());
        return ResponseEntity.ok(TypeResponse.of(typeInferrer.inferType(request.getName(), request.getValue())));
    }

    /**
     * Классифицирует суффикс role_var.
     *
     * POST /api/v1/role-vars/classify
     */
    @PostMapping("/role-vars/classify")
    public ResponseEntity<TypeResponse> classify(@RequestBody @Valid ClassifyRequest request) {
        String line = request.getLine() != null ? request.getLine() : "";
        return ResponseEntity.ok(TypeResponse.of(roleVarClassifier.classify(request.getSuffix(), line)));
    }

    /**
     * Health check эндпоинт.
     *
     * GET /api/v1/health
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
