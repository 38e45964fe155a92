package com.example.workflowcompiler.api.v1.dto;

import com.example.workflowcompiler.compiler.ValidationReport;

import java.util.List;

public record ValidateResponse(boolean valid, List<String> errors) {

    public static ValidateResponse from(ValidationReport report) {
        return new ValidateResponse(report.valid(), report.errors());
    }
}
