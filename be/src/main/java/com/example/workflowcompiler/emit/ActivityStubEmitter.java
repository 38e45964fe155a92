package com.example.workflowcompiler.emit;

import com.example.workflowcompiler.controlflow.StepDescriptor;
import com.example.workflowcompiler.controlflow.StructuredProgram;
import com.example.workflowcompiler.model.CompilationMetadata;
import com.example.workflowcompiler.model.config.DatabaseQueryConfig;
import com.example.workflowcompiler.model.config.HttpCallConfig;
import com.example.workflowcompiler.model.config.NodeConfig;
import com.example.workflowcompiler.model.config.NotificationConfig;
import com.example.workflowcompiler.model.config.TransformConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Emits the {@code Activities} type with one stub method per activity identifier. Each stub logs and passes
 * the workflow state through unchanged; the node configuration is written above it as comments.
 */
public class ActivityStubEmitter implements ArtifactEmitter {

    private final GoTemplateRegistry templates;

    public ActivityStubEmitter(GoTemplateRegistry templates) {
        this.templates = Objects.requireNonNull(templates, "templates");
    }

    @Override
    public String emit(StructuredProgram program, CompilationMetadata metadata) {
        Map<String, StepDescriptor> byIdentifier = new LinkedHashMap<>();
        for (StepDescriptor step : program.steps()) {
            if (step.type().isWork()) {
                byIdentifier.putIfAbsent(step.identifier(), step);
            }
        }
        List<Map<String, Object>> activities = new ArrayList<>();
        for (StepDescriptor step : byIdentifier.values()) {
            Map<String, Object> activity = new HashMap<>();
            activity.put("name", step.identifier());
            activity.put("nodeId", GoSyntax.comment(step.nodeId()));
            activity.put("nodeIdLiteral", GoSyntax.quote(step.nodeId()));
            activity.put("kind", step.type().name().toLowerCase(Locale.ROOT));
            activity.put("notes", notes(step));
            activities.add(activity);
        }

        Map<String, Object> model = new HashMap<>();
        model.put("workflowName", GoSyntax.comment(program.workflowName()));
        model.put("packageName", metadata.packageName());
        model.put("entryPoint", program.entryPoint());
        model.put("activities", activities);
        return templates.render(GoTemplateRegistry.ACTIVITIES, model);
    }

    private static List<String> notes(StepDescriptor step) {
        List<String> notes = new ArrayList<>();
        String label = GoSyntax.comment(step.label());
        if (!label.isEmpty()) {
            notes.add("Label: " + label);
        }
        NodeConfig config = step.config();
        if (config instanceof HttpCallConfig http) {
            notes.add("HTTP " + http.method() + " " + GoSyntax.comment(http.url()));
        } else if (config instanceof DatabaseQueryConfig query) {
            notes.add("Query: " + GoSyntax.comment(query.query()));
        } else if (config instanceof NotificationConfig notification) {
            StringBuilder note = new StringBuilder("Notify via ").append(notification.channel());
            if (notification.recipient() != null) {
                note.append(" to ").append(GoSyntax.comment(notification.recipient()));
            }
            if (notification.template() != null) {
                note.append(" using template ").append(GoSyntax.comment(notification.template()));
            }
            notes.add(note.toString());
        } else if (config instanceof TransformConfig transform) {
            notes.add("Runs as a local activity.");
            if (transform.expression() != null) {
                notes.add("Expression: " + GoSyntax.comment(transform.expression()));
            }
            for (Map.Entry<String, String> mapping : transform.mappings().entrySet()) {
                notes.add("Mapping: " + GoSyntax.comment(mapping.getKey()) + " <- " + GoSyntax.comment(mapping.getValue()));
            }
        }
        return notes;
    }
}
