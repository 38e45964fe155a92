package com.example.workflowcompiler.api.v1.dto;

import com.example.workflowcompiler.model.WorkflowDefinition;

import java.util.List;

/**
 * Response body for the sample list.
 */
public record SampleWorkflowListResponse(List<WorkflowDefinition> samples) {}
