package com.example.workflowcompiler.controlflow;

/**
 * Return point of the workflow, one per reachable End node.
 */
public record Exit(String nodeId, String label) implements ControlNode {
}
