package com.example.workflowcompiler.controlflow;

import com.example.workflowcompiler.expression.ConditionExpression;

/**
 * One conditioned outgoing edge of a decision and the code that runs when it is taken.
 */
public record ConditionalArm(String edgeId, ConditionExpression condition, Sequence body) {
}
