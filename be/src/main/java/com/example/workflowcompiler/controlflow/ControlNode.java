package com.example.workflowcompiler.controlflow;

/**
 * Element of the structured program tree. The tree mirrors the shape of the generated code: sequences of
 * steps, branches and forks, ending in exits.
 */
public sealed interface ControlNode permits Sequence, Step, Branch, Fork, Exit {
}
