package com.example.workflowcompiler.emit;

import com.example.workflowcompiler.controlflow.StructuredProgram;
import com.example.workflowcompiler.model.CompilationMetadata;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Emits the worker {@code main} package: client dial, worker on the workflow task queue, registrations.
 */
public class WorkerBootstrapEmitter implements ArtifactEmitter {

    private final GoTemplateRegistry templates;
    private final EmitterSettings settings;

    public WorkerBootstrapEmitter(GoTemplateRegistry templates, EmitterSettings settings) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public String emit(StructuredProgram program, CompilationMetadata metadata) {
        Map<String, Object> model = new HashMap<>();
        model.put("workflowName", GoSyntax.comment(program.workflowName()));
        model.put("packageName", metadata.packageName());
        model.put("importPath", GoSyntax.quote(settings.importPath(metadata.packageName())));
        model.put("entryPoint", program.entryPoint());
        model.put("taskQueue", GoSyntax.quote(settings.taskQueue(metadata.packageName())));
        model.put("registerActivities", !metadata.activities().isEmpty());
        return templates.render(GoTemplateRegistry.WORKER, model);
    }
}
