package com.example.workflowcompiler.compiler;

import com.example.workflowcompiler.controlflow.ControlFlowBuilder;
import com.example.workflowcompiler.controlflow.StructuredProgram;
import com.example.workflowcompiler.emit.ActivityStubEmitter;
import com.example.workflowcompiler.emit.EmitterSettings;
import com.example.workflowcompiler.emit.GoTemplateRegistry;
import com.example.workflowcompiler.emit.TestHarnessEmitter;
import com.example.workflowcompiler.emit.WorkerBootstrapEmitter;
import com.example.workflowcompiler.emit.WorkflowCodeEmitter;
import com.example.workflowcompiler.model.CompilationMetadata;
import com.example.workflowcompiler.model.CompiledWorkflow;
import com.example.workflowcompiler.model.NodeType;
import com.example.workflowcompiler.model.WorkflowDefinition;
import com.example.workflowcompiler.naming.IdentifierResolver;
import com.example.workflowcompiler.optimizer.OptimizedWorkflow;
import com.example.workflowcompiler.optimizer.WorkflowOptimizer;
import com.example.workflowcompiler.support.WorkflowFixtures;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowCompiler")
class WorkflowCompilerTest {

    private static WorkflowCompiler compiler;

    @BeforeAll
    static void setUp() {
        GoTemplateRegistry templates = new GoTemplateRegistry("templates/go");
        EmitterSettings settings = EmitterSettings.DEFAULTS;
        compiler = new WorkflowCompiler(
                new WorkflowCodeEmitter(templates, settings),
                new ActivityStubEmitter(templates),
                new WorkerBootstrapEmitter(templates, settings),
                new TestHarnessEmitter(templates));
    }

    @Nested
    @DisplayName("compile")
    class Compile {

        @Test
        @DisplayName("compiles the order approval workflow into four artifacts with metadata")
        void orderApproval() {
            CompilationResult result = compiler.compile(WorkflowFixtures.orderApproval());

            assertTrue(result.success());
            assertTrue(result.failures().isEmpty());
            CompiledWorkflow compiled = result.compiled();
            assertNotNull(compiled);
            assertFalse(compiled.workflowCode().isBlank());
            assertFalse(compiled.activityCode().isBlank());
            assertFalse(compiled.workerCode().isBlank());
            assertFalse(compiled.testCode().isBlank());

            CompilationMetadata metadata = compiled.metadata();
            assertEquals("Order Approval", metadata.workflowName());
            assertEquals("order_approval", metadata.packageName());
            assertEquals(List.of("SendEmailActivity", "EscalateActivity", "ApproveActivity"), metadata.activities());
            assertTrue(metadata.signals().isEmpty());
            assertEquals(List.of("current_step"), metadata.queries());
            assertEquals(5, metadata.estimatedComplexity());
        }

        @Test
        @DisplayName("is deterministic")
        void deterministic() {
            CompiledWorkflow first = compiler.compile(WorkflowFixtures.orderApproval()).compiled();
            CompiledWorkflow second = compiler.compile(WorkflowFixtures.orderApproval()).compiled();
            assertEquals(first, second);
        }

        @Test
        @DisplayName("drops unreachable nodes from the output")
        void deadCode() {
            WorkflowDefinition definition = WorkflowFixtures.workflow("Dead")
                    .node("s", NodeType.START, "Start")
                    .node("a", NodeType.ACTIVITY, "Live")
                    .node("z", NodeType.ACTIVITY, "Ghost")
                    .node("e", NodeType.END, "End")
                    .edge("s", "a")
                    .edge("a", "e")
                    .edge("z", "e")
                    .build();

            CompilationResult result = compiler.compile(definition);

            assertTrue(result.success());
            assertEquals(List.of("LiveActivity"), result.compiled().metadata().activities());
            assertFalse(result.compiled().workflowCode().contains("Ghost"));
            assertFalse(result.compiled().activityCode().contains("Ghost"));
            assertEquals(2, result.compiled().metadata().estimatedComplexity());
        }

        @Test
        @DisplayName("collects awaited signal names")
        void signals() {
            WorkflowDefinition definition = WorkflowFixtures.workflow("Wait")
                    .node("s", NodeType.START, "Start")
                    .node("w", NodeType.WAIT_SIGNAL, "Await", Map.of("signal_name", "approved"))
                    .node("e", NodeType.END, "End")
                    .edge("s", "w")
                    .edge("w", "e")
                    .build();

            CompilationMetadata metadata = compiler.compile(definition).compiled().metadata();

            assertEquals(List.of("approved"), metadata.signals());
            assertTrue(metadata.activities().isEmpty());
        }

        @Test
        @DisplayName("compiles a matched fork/join")
        void forkJoin() {
            CompilationResult result = compiler.compile(WorkflowFixtures.forkJoin());
            assertTrue(result.success());
            assertEquals(List.of("LeftActivity", "RightActivity"), result.compiled().metadata().activities());
        }
    }

    @Nested
    @DisplayName("generated names")
    class GeneratedNames {

        private CompiledWorkflow compileSingleActivity(String name) {
            WorkflowDefinition definition = WorkflowFixtures.workflow(name)
                    .node("s", NodeType.START, "Start")
                    .node("a", NodeType.ACTIVITY, "Do Work")
                    .node("e", NodeType.END, "End")
                    .edge("s", "a")
                    .edge("a", "e")
                    .build();
            CompilationResult result = compiler.compile(definition);
            assertTrue(result.success());
            return result.compiled();
        }

        @Test
        @DisplayName("a workflow named after a Go keyword gets a usable package name")
        void keywordPackage() {
            CompiledWorkflow compiled = compileSingleActivity("Select");

            assertEquals("select_wf", compiled.metadata().packageName());
            assertTrue(compiled.workflowCode().contains("package select_wf\n"));
            assertTrue(compiled.activityCode().contains("package select_wf\n"));
            assertTrue(compiled.workerCode().contains("w.RegisterWorkflow(select_wf.Select)"));
        }

        @Test
        @DisplayName("a workflow named Worker does not shadow the worker import")
        void workerPackage() {
            CompiledWorkflow compiled = compileSingleActivity("Worker");

            assertEquals("worker_wf", compiled.metadata().packageName());
            assertTrue(compiled.workerCode().contains("w := worker.New(c, TaskQueue, worker.Options{})"));
            assertTrue(compiled.workerCode().contains("w.RegisterWorkflow(worker_wf.Worker)"));
            assertTrue(compiled.workerCode().contains("w.RegisterActivity(worker_wf.NewActivities())"));
        }

        @Test
        @DisplayName("a workflow named Activities does not clash with the stub type")
        void activitiesName() {
            CompiledWorkflow compiled = compileSingleActivity("Activities");

            assertTrue(compiled.workflowCode().contains("func Activities2(ctx workflow.Context, input Activities2Input)"));
            assertFalse(compiled.workflowCode().contains("func Activities("));
            assertTrue(compiled.activityCode().contains("type Activities struct {"));
            assertTrue(compiled.activityCode().contains("input Activities2Input"));
            assertTrue(compiled.workerCode().contains("w.RegisterWorkflow(activities.Activities2)"));
        }

        @Test
        @DisplayName("a workflow named New Activities does not clash with the stub constructor")
        void newActivitiesName() {
            CompiledWorkflow compiled = compileSingleActivity("New Activities");

            assertTrue(compiled.workflowCode().contains("func NewActivities2(ctx workflow.Context"));
            assertTrue(compiled.activityCode().contains("func NewActivities() *Activities {"));
            assertTrue(compiled.testCode().contains("func TestNewActivities2(t *testing.T)"));
        }
    }

    @Nested
    @DisplayName("metadata")
    class Metadata {

        @Test
        @DisplayName("counts every optimized node except start")
        void complexityExcludesStart() {
            WorkflowDefinition definition = WorkflowFixtures.forkJoin();
            OptimizedWorkflow optimized = WorkflowOptimizer.optimize(definition);
            StructuredProgram program = ControlFlowBuilder.build(optimized, new IdentifierResolver());

            CompilationMetadata metadata = WorkflowCompiler.metadata(program, optimized);

            assertEquals(6, optimized.definition().nodes().size());
            assertEquals(5, metadata.estimatedComplexity());
            assertEquals("fork_join", metadata.packageName());
            assertEquals(List.of("current_step"), metadata.queries());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a cycle fails validation and returns no artifacts")
        void cycle() {
            WorkflowDefinition definition = WorkflowFixtures.workflow("Loop")
                    .node("s", NodeType.START, "Start")
                    .node("a", NodeType.ACTIVITY, "A")
                    .node("b", NodeType.ACTIVITY, "B")
                    .node("e", NodeType.END, "End")
                    .edge("s", "a")
                    .edge("a", "b")
                    .edge("back", "b", "a", null)
                    .build();

            CompilationResult result = compiler.compile(definition);

            assertFalse(result.success());
            assertNull(result.compiled());
            assertTrue(result.failures().stream().anyMatch(f -> f.code() == FailureCode.CYCLE_DETECTED));
        }

        @Test
        @DisplayName("an unstructurable graph is reported as a code generation failure")
        void unstructurable() {
            WorkflowDefinition definition = WorkflowFixtures.workflow("Open fork")
                    .node("s", NodeType.START, "Start")
                    .node("g", NodeType.PARALLEL_GATEWAY, "Split")
                    .node("a", NodeType.ACTIVITY, "A")
                    .node("b", NodeType.ACTIVITY, "B")
                    .node("e", NodeType.END, "End")
                    .edge("s", "g")
                    .edge("g", "a")
                    .edge("g", "b")
                    .edge("a", "e")
                    .edge("b", "e")
                    .build();

            CompilationResult result = compiler.compile(definition);

            assertFalse(result.success());
            assertNull(result.compiled());
            assertEquals(1, result.failures().size());
            assertEquals(FailureCode.CODE_GENERATION, result.failures().get(0).code());
        }

        @Test
        @DisplayName("rejects a null definition")
        void nullDefinition() {
            assertThrows(NullPointerException.class, () -> compiler.compile(null));
        }
    }

    @Nested
    @DisplayName("validateOnly")
    class ValidateOnly {

        @Test
        @DisplayName("reports a valid workflow")
        void valid() {
            ValidationReport report = compiler.validateOnly(WorkflowFixtures.orderApproval());
            assertTrue(report.valid());
            assertTrue(report.errors().isEmpty());
        }

        @Test
        @DisplayName("reports two start nodes with the field prefix")
        void twoStarts() {
            WorkflowDefinition definition = WorkflowFixtures.workflow("Two starts")
                    .node("s1", NodeType.START, "Start")
                    .node("s2", NodeType.START, "Start again")
                    .node("e", NodeType.END, "End")
                    .edge("s1", "e")
                    .edge("s2", "e")
                    .build();

            ValidationReport report = compiler.validateOnly(definition);

            assertFalse(report.valid());
            assertTrue(report.errors().contains("nodes: exactly one start node is allowed, found 2"));
        }
    }
}
