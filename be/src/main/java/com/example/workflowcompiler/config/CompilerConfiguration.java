package com.example.workflowcompiler.config;

import com.example.workflowcompiler.compiler.WorkflowCompiler;
import com.example.workflowcompiler.emit.ActivityStubEmitter;
import com.example.workflowcompiler.emit.EmitterSettings;
import com.example.workflowcompiler.emit.GoTemplateRegistry;
import com.example.workflowcompiler.emit.TestHarnessEmitter;
import com.example.workflowcompiler.emit.WorkerBootstrapEmitter;
import com.example.workflowcompiler.emit.WorkflowCodeEmitter;
import com.example.workflowcompiler.model.config.DurationParser;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the compiler pipeline. Settings come from {@code compiler.*} properties.
 */
@Configuration
public class CompilerConfiguration {

    @Bean
    public GoTemplateRegistry goTemplateRegistry(@Value("${compiler.templates.path:templates/go}") String templatePath) {
        return new GoTemplateRegistry(templatePath);
    }

    @Bean
    public EmitterSettings emitterSettings(
            @Value("${compiler.activity-timeout:10m}") String activityTimeout,
            @Value("${compiler.task-queue-suffix:-task-queue}") String taskQueueSuffix,
            @Value("${compiler.go-module:}") String goModule) {
        try {
            return new EmitterSettings(DurationParser.parse(activityTimeout), taskQueueSuffix, goModule);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid compiler.activity-timeout: " + activityTimeout, e);
        }
    }

    @Bean
    public WorkflowCompiler workflowCompiler(GoTemplateRegistry templates, EmitterSettings settings) {
        return new WorkflowCompiler(
                new WorkflowCodeEmitter(templates, settings),
                new ActivityStubEmitter(templates),
                new WorkerBootstrapEmitter(templates, settings),
                new TestHarnessEmitter(templates));
    }
}
