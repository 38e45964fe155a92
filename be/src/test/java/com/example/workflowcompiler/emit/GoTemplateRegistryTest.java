package com.example.workflowcompiler.emit;

import com.example.workflowcompiler.controlflow.CodeGenerationException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("GoTemplateRegistry")
class GoTemplateRegistryTest {

    @Test
    @DisplayName("fails construction when templates are missing")
    void missingTemplates() {
        assertThrows(IllegalStateException.class, () -> new GoTemplateRegistry("templates/does-not-exist"));
    }

    @Test
    @DisplayName("an incomplete model is a code generation failure, not partial output")
    void incompleteModel() {
        assertThrows(CodeGenerationException.class,
                () -> EmitterTestSupport.TEMPLATES.render(GoTemplateRegistry.WORKER, Map.of("workflowName", "x")));
    }

    @Test
    @DisplayName("rejects unknown template names")
    void unknownTemplate() {
        assertThrows(IllegalArgumentException.class,
                () -> EmitterTestSupport.TEMPLATES.render("missing.ftl", Map.of()));
    }
}
