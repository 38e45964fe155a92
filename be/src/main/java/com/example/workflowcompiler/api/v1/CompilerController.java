package com.example.workflowcompiler.api.v1;

import com.example.workflowcompiler.api.v1.dto.CompileRequest;
import com.example.workflowcompiler.api.v1.dto.CompileResponse;
import com.example.workflowcompiler.api.v1.dto.SampleWorkflowListResponse;
import com.example.workflowcompiler.api.v1.dto.ValidateResponse;
import com.example.workflowcompiler.service.WorkflowCompilationService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for compiling and validating workflow graphs.
 * <p>
 * {@code POST /api/v1/compile} and {@code POST /api/v1/validate} take {@code {"workflow": ...}} and answer
 * 200 whether or not the workflow is valid; problems are listed in the body. {@code GET /api/v1/samples}
 * lists the starter workflows.
 * </p>
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class CompilerController {

    private final WorkflowCompilationService service;

    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@Valid @RequestBody CompileRequest request) {
        log.debug("Compile request name={}", request.workflow().name());
        return ResponseEntity.ok(CompileResponse.from(service.compile(request.workflow())));
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidateResponse> validate(@Valid @RequestBody CompileRequest request) {
        log.debug("Validate request name={}", request.workflow().name());
        return ResponseEntity.ok(ValidateResponse.from(service.validate(request.workflow())));
    }

    @GetMapping("/samples")
    public ResponseEntity<SampleWorkflowListResponse> samples() {
        log.debug("Listing sample workflows");
        return ResponseEntity.ok(new SampleWorkflowListResponse(service.samples()));
    }
}
