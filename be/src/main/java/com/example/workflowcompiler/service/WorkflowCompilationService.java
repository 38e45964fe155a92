package com.example.workflowcompiler.service;

import com.example.workflowcompiler.compiler.CompilationResult;
import com.example.workflowcompiler.compiler.ValidationReport;
import com.example.workflowcompiler.compiler.WorkflowCompiler;
import com.example.workflowcompiler.config.SampleWorkflowCatalog;
import com.example.workflowcompiler.model.WorkflowDefinition;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for the API layer: compiles and validates submitted workflows and lists the samples.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowCompilationService {

    private final WorkflowCompiler compiler;
    private final SampleWorkflowCatalog sampleCatalog;

    public CompilationResult compile(WorkflowDefinition definition) {
        log.info("Compiling workflow name={} nodeCount={} edgeCount={}",
                definition.name(), definition.nodes().size(), definition.edges().size());
        CompilationResult result = compiler.compile(definition);
        if (result.success()) {
            log.info("Compiled workflow name={} package={} activities={}", definition.name(),
                    result.compiled().metadata().packageName(), result.compiled().metadata().activities().size());
        } else {
            log.warn("Compilation rejected workflow name={} errors={}", definition.name(), result.failures().size());
        }
        return result;
    }

    public ValidationReport validate(WorkflowDefinition definition) {
        log.info("Validating workflow name={} nodeCount={}", definition.name(), definition.nodes().size());
        ValidationReport report = compiler.validateOnly(definition);
        if (!report.valid()) {
            log.warn("Validation failed for workflow name={} errors={}", definition.name(), report.errors().size());
        }
        return report;
    }

    public List<WorkflowDefinition> samples() {
        return sampleCatalog.samples();
    }
}
