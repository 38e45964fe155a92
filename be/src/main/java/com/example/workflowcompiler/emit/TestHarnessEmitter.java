package com.example.workflowcompiler.emit;

import com.example.workflowcompiler.controlflow.ProgramVariable;
import com.example.workflowcompiler.controlflow.StepDescriptor;
import com.example.workflowcompiler.controlflow.StructuredProgram;
import com.example.workflowcompiler.model.CompilationMetadata;
import com.example.workflowcompiler.model.config.SubWorkflowConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Emits a Go test that runs the workflow in the SDK test environment. Child workflows are mocked, every
 * awaited signal is sent one second after the previous one and variables start at their declared defaults.
 */
public class TestHarnessEmitter implements ArtifactEmitter {

    private final GoTemplateRegistry templates;

    public TestHarnessEmitter(GoTemplateRegistry templates) {
        this.templates = Objects.requireNonNull(templates, "templates");
    }

    @Override
    public String emit(StructuredProgram program, CompilationMetadata metadata) {
        List<Map<String, Object>> signals = new ArrayList<>();
        for (int i = 0; i < metadata.signals().size(); i++) {
            Map<String, Object> signal = new HashMap<>();
            signal.put("literal", GoSyntax.quote(metadata.signals().get(i)));
            signal.put("delay", GoSyntax.duration(Duration.ofSeconds(i + 1L)));
            signals.add(signal);
        }

        Set<String> children = new LinkedHashSet<>();
        for (StepDescriptor step : program.steps()) {
            if (step.config() instanceof SubWorkflowConfig child) {
                children.add(GoSyntax.quote(child.workflowName()));
            }
        }

        List<Map<String, Object>> inputs = new ArrayList<>();
        for (ProgramVariable variable : program.variables()) {
            if (variable.defaultValue() == null) {
                continue;
            }
            Map<String, Object> input = new HashMap<>();
            input.put("name", variable.fieldName());
            input.put("value", GoSyntax.literal(variable.defaultValue()));
            inputs.add(input);
        }

        Map<String, Object> model = new HashMap<>();
        model.put("packageName", metadata.packageName());
        model.put("entryPoint", program.entryPoint());
        model.put("registerActivities", !metadata.activities().isEmpty());
        model.put("signals", signals);
        model.put("children", new ArrayList<>(children));
        model.put("inputs", inputs);
        return templates.render(GoTemplateRegistry.TEST, model);
    }
}
