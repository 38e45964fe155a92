package com.example.workflowcompiler.config;

import com.example.workflowcompiler.model.WorkflowDefinition;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Starter workflows shipped on the classpath, served to the editor. Loaded once at startup; a sample that
 * does not parse fails startup.
 */
@Component
@Slf4j
public class SampleWorkflowCatalog {

    private static final String SAMPLES_DIR = "samples/";
    private static final List<String> SAMPLE_FILES = List.of(
            "order-approval.json",
            "parallel-fulfillment.json",
            "document-review.json"
    );

    private final List<WorkflowDefinition> samples;

    public SampleWorkflowCatalog(JsonMapper jsonMapper) {
        List<WorkflowDefinition> loaded = new ArrayList<>();
        for (String filename : SAMPLE_FILES) {
            WorkflowDefinition sample = load(jsonMapper, SAMPLES_DIR + filename);
            if (sample != null) {
                loaded.add(sample);
            }
        }
        this.samples = Collections.unmodifiableList(loaded);
        log.info("Loaded {} sample workflow(s)", samples.size());
    }

    public List<WorkflowDefinition> samples() {
        return samples;
    }

    private static WorkflowDefinition load(JsonMapper jsonMapper, String path) {
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("Sample workflow resource not found: {}", path);
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            WorkflowDefinition definition = jsonMapper.readValue(in, WorkflowDefinition.class);
            log.debug("Loaded sample workflow: {}", definition.name());
            return definition;
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to parse sample workflow " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read sample workflow " + path, e);
        }
    }
}
