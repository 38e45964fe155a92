package com.example.workflowcompiler.controlflow;

public record Step(StepDescriptor descriptor) implements ControlNode {
}
