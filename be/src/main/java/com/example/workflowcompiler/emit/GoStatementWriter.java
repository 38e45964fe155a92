package com.example.workflowcompiler.emit;

import com.example.workflowcompiler.controlflow.Branch;
import com.example.workflowcompiler.controlflow.ConditionalArm;
import com.example.workflowcompiler.controlflow.ControlNode;
import com.example.workflowcompiler.controlflow.Exit;
import com.example.workflowcompiler.controlflow.Fork;
import com.example.workflowcompiler.controlflow.Sequence;
import com.example.workflowcompiler.controlflow.Step;
import com.example.workflowcompiler.controlflow.StepDescriptor;
import com.example.workflowcompiler.model.NodeType;
import com.example.workflowcompiler.model.config.ActivityConfig;
import com.example.workflowcompiler.model.config.RetrySettings;
import com.example.workflowcompiler.model.config.SignalConfig;
import com.example.workflowcompiler.model.config.SubWorkflowConfig;
import com.example.workflowcompiler.model.config.TimerConfig;
import com.example.workflowcompiler.model.config.WorkConfig;
import com.example.workflowcompiler.naming.IdentifierResolver;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Writes the statements of the generated workflow function for a structured body.
 * <p>
 * Inside a fork branch the statements run in a {@code workflow.Go} closure, which cannot return the workflow
 * result; errors are stored in the fork's error variable instead and re-raised after the wait group.
 * One writer renders one function.
 * </p>
 */
final class GoStatementWriter {

    private static final String INDENT = "\t";
    private static final String STATE = "state";

    private final EmitterSettings settings;
    private final String outputType;
    private final StringBuilder out = new StringBuilder();
    /** Error variables of the enclosing forks, innermost first; empty at the top level. */
    private final Deque<String> errorSinks = new ArrayDeque<>();
    private int depth;
    private boolean usesTemporal;

    GoStatementWriter(EmitterSettings settings, String outputType, int baseDepth) {
        this.settings = settings;
        this.outputType = outputType;
        this.depth = baseDepth;
    }

    /** True once any statement needs the {@code go.temporal.io/sdk/temporal} package. */
    boolean usesTemporal() {
        return usesTemporal;
    }

    String text() {
        return out.toString();
    }

    void writeBody(Sequence body) {
        write(body);
        if (!body.terminates()) {
            writeReturn("Workflow completed successfully");
        }
    }

    void write(Sequence sequence) {
        for (ControlNode node : sequence.items()) {
            if (node instanceof Step step) {
                writeStep(step.descriptor());
            } else if (node instanceof Branch branch) {
                writeBranch(branch);
            } else if (node instanceof Fork fork) {
                writeFork(fork);
            } else if (node instanceof Exit exit) {
                writeExit(exit);
            }
        }
    }

    private void writeStep(StepDescriptor step) {
        heading(step.label(), step.type().name().toLowerCase(Locale.ROOT) + " " + step.nodeId());
        line("currentStep = " + GoSyntax.quote(step.nodeId()));
        if (step.type() == NodeType.TRANSFORM) {
            writeLocalActivity(step);
        } else if (step.config() instanceof WorkConfig work) {
            writeActivity(step, work);
        } else if (step.config() instanceof TimerConfig timer) {
            open("if err := workflow.Sleep(ctx, " + GoSyntax.duration(timer.duration()) + "); err != nil {");
            fail("err");
            close("}");
        } else if (step.config() instanceof SignalConfig signal) {
            writeSignal(signal);
        } else if (step.config() instanceof SubWorkflowConfig child) {
            writeChild(child);
        }
    }

    private void writeActivity(StepDescriptor step, WorkConfig work) {
        String taskQueue = work instanceof ActivityConfig activity ? activity.taskQueue() : null;
        boolean customOptions = work.timeout() != null || step.retry() != null
                || (taskQueue != null && !taskQueue.isBlank());
        String call = "workflow.ExecuteActivity(%s, a." + step.identifier() + ", " + STATE + ").Get(%s, &" + STATE + ")";
        if (!customOptions) {
            executeAndCheck(String.format(call, "ctx", "ctx"));
            return;
        }
        open("{");
        open("stepCtx := workflow.WithActivityOptions(ctx, workflow.ActivityOptions{");
        Duration timeout = work.timeout() != null ? work.timeout() : settings.defaultActivityTimeout();
        line("StartToCloseTimeout: " + GoSyntax.duration(timeout) + ",");
        if (taskQueue != null && !taskQueue.isBlank()) {
            line("TaskQueue: " + GoSyntax.quote(taskQueue) + ",");
        }
        writeRetryPolicy(step.retry());
        close("})");
        executeAndCheck(String.format(call, "stepCtx", "stepCtx"));
        close("}");
    }

    private void writeLocalActivity(StepDescriptor step) {
        open("{");
        open("localCtx := workflow.WithLocalActivityOptions(ctx, workflow.LocalActivityOptions{");
        line("StartToCloseTimeout: " + GoSyntax.duration(settings.defaultActivityTimeout()) + ",");
        writeRetryPolicy(step.retry());
        close("})");
        executeAndCheck("workflow.ExecuteLocalActivity(localCtx, a." + step.identifier() + ", " + STATE
                + ").Get(localCtx, &" + STATE + ")");
        close("}");
    }

    private void writeRetryPolicy(RetrySettings retry) {
        if (retry == null) {
            return;
        }
        usesTemporal = true;
        open("RetryPolicy: &temporal.RetryPolicy{");
        if (retry.initialInterval() != null) {
            line("InitialInterval: " + GoSyntax.duration(retry.initialInterval()) + ",");
        }
        line("BackoffCoefficient: " + retry.backoffCoefficient() + ",");
        if (retry.maxInterval() != null) {
            line("MaximumInterval: " + GoSyntax.duration(retry.maxInterval()) + ",");
        }
        line("MaximumAttempts: " + retry.maxAttempts() + ",");
        close("},");
    }

    private void writeSignal(SignalConfig signal) {
        String name = GoSyntax.quote(signal.signalName());
        open("{");
        line("var payload interface{}");
        if (signal.timeout() == null) {
            line("workflow.GetSignalChannel(ctx, " + name + ").Receive(ctx, &payload)");
        } else {
            usesTemporal = true;
            line("received := false");
            line("timerCtx, cancelTimer := workflow.WithCancel(ctx)");
            line("selector := workflow.NewSelector(ctx)");
            open("selector.AddReceive(workflow.GetSignalChannel(ctx, " + name + "), func(c workflow.ReceiveChannel, more bool) {");
            line("c.Receive(ctx, &payload)");
            line("received = true");
            close("})");
            line("selector.AddFuture(workflow.NewTimer(timerCtx, " + GoSyntax.duration(signal.timeout())
                    + "), func(f workflow.Future) {})");
            line("selector.Select(ctx)");
            line("cancelTimer()");
            open("if !received {");
            fail("temporal.NewApplicationError(" + GoSyntax.quote("timed out waiting for signal " + signal.signalName())
                    + ", \"SignalTimeout\")");
            close("}");
        }
        line("logger.Info(\"Signal received\", \"signal\", " + name + ", \"payload\", payload)");
        close("}");
    }

    private void writeChild(SubWorkflowConfig child) {
        open("{");
        if (child.taskQueue() != null && !child.taskQueue().isBlank()) {
            open("childCtx := workflow.WithChildOptions(ctx, workflow.ChildWorkflowOptions{");
            line("TaskQueue: " + GoSyntax.quote(child.taskQueue()) + ",");
            close("})");
        } else {
            line("childCtx := workflow.WithChildOptions(ctx, workflow.ChildWorkflowOptions{})");
        }
        line("var childResult interface{}");
        executeAndCheck("workflow.ExecuteChildWorkflow(childCtx, " + GoSyntax.quote(child.workflowName())
                + ", " + STATE + ").Get(childCtx, &childResult)");
        line("logger.Info(\"Child workflow completed\", \"workflow\", " + GoSyntax.quote(child.workflowName())
                + ", \"result\", childResult)");
        close("}");
    }

    private void writeBranch(Branch branch) {
        heading(branch.label(), "decision " + branch.decisionId());
        line("currentStep = " + GoSyntax.quote(branch.decisionId()));
        if (branch.arms().isEmpty()) {
            write(branch.defaultArm());
            return;
        }
        List<ConditionalArm> arms = branch.arms();
        for (int i = 0; i < arms.size(); i++) {
            ConditionalArm arm = arms.get(i);
            String condition = GoSyntax.condition(arm.condition(), STATE);
            if (i == 0) {
                open("if " + condition + " {");
            } else {
                reopen("} else if " + condition + " {");
            }
            write(arm.body());
        }
        reopen("} else {");
        if (branch.hasDefault()) {
            write(branch.defaultArm());
        } else {
            usesTemporal = true;
            fail("temporal.NewApplicationError(" + GoSyntax.quote("no condition matched at decision " + branch.decisionId())
                    + ", \"NoBranchMatched\")");
        }
        close("}");
    }

    private void writeFork(Fork fork) {
        String errVar = IdentifierResolver.lowerCamel(fork.identifier()) + "Err";
        heading(fork.label(), "parallel " + fork.gatewayId() + " -> " + fork.joinId());
        line("currentStep = " + GoSyntax.quote(fork.gatewayId()));
        open("{");
        line("var " + errVar + " error");
        line("wg := workflow.NewWaitGroup(ctx)");
        line("wg.Add(" + fork.branches().size() + ")");
        errorSinks.push(errVar);
        for (Sequence branch : fork.branches()) {
            open("workflow.Go(ctx, func(ctx workflow.Context) {");
            line("defer wg.Done()");
            write(branch);
            close("})");
        }
        errorSinks.pop();
        line("wg.Wait(ctx)");
        open("if " + errVar + " != nil {");
        fail(errVar);
        close("}");
        close("}");
        line("currentStep = " + GoSyntax.quote(fork.joinId()));
    }

    private void writeExit(Exit exit) {
        line("currentStep = " + GoSyntax.quote(exit.nodeId()));
        line("logger.Info(\"Workflow completed\", \"end\", " + GoSyntax.quote(exit.nodeId()) + ")");
        String label = exit.label();
        writeReturn(label == null || label.isBlank() ? "Workflow completed successfully" : label);
    }

    private void writeReturn(String message) {
        open("return &" + outputType + "{");
        line("Success: true,");
        line("Message: " + GoSyntax.quote(message) + ",");
        line("State: " + STATE + ",");
        close("}, nil");
    }

    private void executeAndCheck(String call) {
        open("if err := " + call + "; err != nil {");
        fail("err");
        close("}");
    }

    /** Propagates {@code errorExpression}: returned at the top level, stored and returned inside a fork branch. */
    private void fail(String errorExpression) {
        String sink = errorSinks.peek();
        if (sink == null) {
            line("return nil, " + errorExpression);
            return;
        }
        open("if " + sink + " == nil {");
        line(sink + " = " + errorExpression);
        close("}");
        line("return");
    }

    private void heading(String label, String what) {
        String text = GoSyntax.comment(label);
        line(text.isEmpty() ? "// " + what : "// " + text + " (" + what + ")");
    }

    private void line(String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }

    private void open(String text) {
        line(text);
        depth++;
    }

    private void reopen(String text) {
        depth--;
        line(text);
        depth++;
    }

    private void close(String text) {
        depth--;
        line(text);
    }

    static List<String> imports(boolean usesTemporal) {
        List<String> imports = new ArrayList<>();
        if (usesTemporal) {
            imports.add("go.temporal.io/sdk/temporal");
        }
        imports.add("go.temporal.io/sdk/workflow");
        return imports;
    }
}
