package com.example.workflowcompiler.emit;

import com.example.workflowcompiler.controlflow.ProgramVariable;
import com.example.workflowcompiler.controlflow.StructuredProgram;
import com.example.workflowcompiler.model.CompilationMetadata;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Emits the workflow function: input and output types, the {@code current_step} query, default activity
 * options and the structured body.
 */
public class WorkflowCodeEmitter implements ArtifactEmitter {

    public static final String CURRENT_STEP_QUERY = "current_step";

    /** Statements of the function body start one tab in. */
    private static final int BODY_DEPTH = 1;

    private final GoTemplateRegistry templates;
    private final EmitterSettings settings;

    public WorkflowCodeEmitter(GoTemplateRegistry templates, EmitterSettings settings) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public String emit(StructuredProgram program, CompilationMetadata metadata) {
        GoStatementWriter writer = new GoStatementWriter(settings, program.entryPoint() + "Output", BODY_DEPTH);
        writer.writeBody(program.body());

        Map<String, Object> model = new HashMap<>();
        model.put("workflowName", GoSyntax.comment(program.workflowName()));
        model.put("packageName", metadata.packageName());
        model.put("entryPoint", program.entryPoint());
        model.put("imports", GoStatementWriter.imports(writer.usesTemporal()));
        model.put("fields", fields(program.variables()));
        model.put("queryName", GoSyntax.quote(CURRENT_STEP_QUERY));
        model.put("activityTimeout", GoSyntax.duration(settings.defaultActivityTimeout()));
        model.put("usesActivities", !metadata.activities().isEmpty());
        model.put("body", writer.text());
        return templates.render(GoTemplateRegistry.WORKFLOW, model);
    }

    static List<Map<String, Object>> fields(List<ProgramVariable> variables) {
        List<Map<String, Object>> fields = new ArrayList<>();
        for (ProgramVariable variable : variables) {
            Map<String, Object> field = new HashMap<>();
            field.put("name", variable.fieldName());
            field.put("goType", GoSyntax.goType(variable.type()));
            field.put("json", variable.name());
            fields.add(field);
        }
        return fields;
    }
}
