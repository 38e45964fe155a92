package com.example.workflowcompiler.emit;

import com.example.workflowcompiler.controlflow.CodeGenerationException;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FreeMarker templates for the generated Go sources, loaded from the classpath once at construction.
 * A missing or unparsable template fails construction, so a broken installation fails at startup rather
 * than on the first compile. Read-only afterwards and safe to share between requests.
 */
public class GoTemplateRegistry {

    public static final String WORKFLOW = "workflow.go.ftl";
    public static final String ACTIVITIES = "activities.go.ftl";
    public static final String WORKER = "worker.go.ftl";
    public static final String TEST = "workflow_test.go.ftl";

    private static final List<String> TEMPLATE_NAMES = List.of(WORKFLOW, ACTIVITIES, WORKER, TEST);
    private static final Logger log = LoggerFactory.getLogger(GoTemplateRegistry.class);

    private final Map<String, Template> templates;

    public GoTemplateRegistry(String templatePath) {
        Configuration configuration = new Configuration(Configuration.VERSION_2_3_32);
        configuration.setClassLoaderForTemplateLoading(GoTemplateRegistry.class.getClassLoader(), templatePath);
        configuration.setDefaultEncoding(StandardCharsets.UTF_8.name());
        // fail on missing variables instead of printing an error page into the generated code
        configuration.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        configuration.setLogTemplateExceptions(false);
        configuration.setFallbackOnNullLoopVariable(false);

        Map<String, Template> loaded = new LinkedHashMap<>();
        for (String name : TEMPLATE_NAMES) {
            try {
                loaded.put(name, configuration.getTemplate(name));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load code template " + templatePath + "/" + name, e);
            }
        }
        this.templates = Collections.unmodifiableMap(loaded);
        log.info("Loaded {} code templates from {}", templates.size(), templatePath);
    }

    public String render(String name, Map<String, Object> model) {
        Template template = templates.get(name);
        if (template == null) {
            throw new IllegalArgumentException("Unknown template: " + name);
        }
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException | IOException e) {
            log.error("Rendering template {} failed", name, e);
            throw new CodeGenerationException("workflow", "failed to render " + name + ": " + e.getMessage());
        }
        return out.toString();
    }
}
