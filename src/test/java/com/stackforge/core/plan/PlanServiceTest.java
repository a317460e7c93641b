package com.stackforge.core.plan;

import com.stackforge.core.actions.StackActions;
import com.stackforge.core.config.StackforgeProperties;
import com.stackforge.core.diff.Difference;
import com.stackforge.core.diff.StackDiff;
import com.stackforge.core.engine.PlanResult;
import com.stackforge.core.events.EventBus;
import com.stackforge.core.events.StackforgeEvent;
import com.stackforge.core.hooks.HookRegistry;
import com.stackforge.core.metrics.StackforgeMetrics;
import com.stackforge.core.model.ChangeSetStatus;
import com.stackforge.core.model.FailureReason;
import com.stackforge.core.model.InvalidConfigurationException;
import com.stackforge.core.model.NodeState;
import com.stackforge.core.model.Operation;
import com.stackforge.core.model.Stack;
import com.stackforge.core.model.StackStatus;
import com.stackforge.core.project.ProjectLoader;
import com.stackforge.core.resolver.ResolverRegistry;
import com.stackforge.core.template.FileTemplateHandler;
import com.stackforge.core.template.TemplateHandlerRegistry;
import com.stackforge.provider.local.LocalStackProviderFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs whole plans against a project on disk and the local provider.
 */
class PlanServiceTest {

    @TempDir
    Path root;

    private EventBus eventBus;
    private PlanService service;

    @BeforeEach
    void setUp() throws IOException {
        write("templates/vpc.yaml", """
                Parameters:
                  Name: {}
                Outputs:
                  VpcId:
                    Value: vpc-${Name}
                """);
        write("templates/app.yaml", """
                Parameters:
                  VpcId: {}
                Outputs:
                  Url:
                    Value: http://${VpcId}
                """);
        write("config/config.yaml", "project_code: shop\n");
        write("config/dev/vpc.yaml", """
                template_path: vpc.yaml
                parameters:
                  Name: main
                """);
        write("config/dev/app.yaml", """
                template_path: app.yaml
                parameters:
                  VpcId: {"!stack_output": "vpc::VpcId"}
                """);

        var properties = new StackforgeProperties();
        properties.setProjectDir(root.toString());
        properties.setPollIntervalMs(0);
        properties.setMaxConcurrency(4);

        eventBus = new EventBus();
        service = new PlanService(
                new ProjectLoader(ResolverRegistry.withBuiltins(), HookRegistry.withBuiltins(), Map.of()),
                new LocalStackProviderFactory(root.resolve(".stackforge/state")),
                new TemplateHandlerRegistry(List.of(new FileTemplateHandler(root.resolve("templates")))),
                properties, eventBus, new StackforgeMetrics(new SimpleMeterRegistry()));
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private PlanResult run(String path, Operation operation) {
        return service.execute(path, operation, PlanOptions.defaults());
    }

    @Nested
    @DisplayName("launch")
    class LaunchTests {

        @Test
        @DisplayName("launches dependencies first and wires outputs into parameters")
        void launchesInOrder() {
            PlanResult result = run("dev", Operation.LAUNCH);

            assertTrue(result.isSuccessful());
            assertEquals(List.of("dev/vpc", "dev/app"), List.copyOf(result.results().keySet()));

            PlanResult outputs = run("dev/app", Operation.OUTPUTS);
            assertEquals(Map.of("Url", "http://vpc-main"), outputs.result("dev/app").output());
        }

        @Test
        @DisplayName("launching an unchanged project again is a no-op success")
        void idempotent() {
            run("dev", Operation.LAUNCH);
            PlanResult again = run("dev", Operation.LAUNCH);

            assertTrue(again.isSuccessful());
            assertEquals(StackStatus.COMPLETE, again.result("dev/app").status());
        }

        @Test
        @DisplayName("publishes plan and stack events for the run")
        void events() {
            var received = new CopyOnWriteArrayList<String>();
            try (var subscription = eventBus.subscribeAll(event -> received.add(event.eventType()))) {
                run("dev/vpc", Operation.LAUNCH);
            }

            assertTrue(received.contains(StackforgeEvent.PLAN_STARTED));
            assertTrue(received.contains(StackforgeEvent.STACK_COMPLETED));
            assertTrue(received.contains(StackforgeEvent.PLAN_COMPLETED));
        }

        @Test
        @DisplayName("a failing stack fails its dependents without running them")
        void failurePropagates() throws IOException {
            write("config/dev/vpc.yaml", "template_path: missing.yaml\n");

            PlanResult result = run("dev", Operation.LAUNCH);

            assertFalse(result.isSuccessful());
            assertEquals(FailureReason.TEMPLATE_ERROR, result.result("dev/vpc").failureReason());
            assertEquals(NodeState.FAILED, result.result("dev/app").state());
            assertEquals(FailureReason.UPSTREAM_FAILED, result.result("dev/app").failureReason());
        }

        @Test
        @DisplayName("a protected stack is reported as protected")
        void protectedStack() throws IOException {
            write("config/dev/vpc.yaml", "template_path: vpc.yaml\nprotect: true\nparameters:\n  Name: main\n");

            PlanResult result = run("dev/vpc", Operation.LAUNCH);

            assertEquals(FailureReason.PROTECTED, result.result("dev/vpc").failureReason());
        }
    }

    @Nested
    @DisplayName("delete and status")
    class DeleteTests {

        @Test
        @DisplayName("stacks that were never launched are PENDING")
        void pending() {
            PlanResult result = run("dev", Operation.STATUS);

            assertTrue(result.isSuccessful());
            assertEquals(StackStatus.PENDING, result.result("dev/vpc").status());
            assertEquals("PENDING", result.result("dev/app").output());
        }

        @Test
        @DisplayName("delete runs dependents first and leaves nothing behind")
        void deletesInReverse() {
            run("dev", Operation.LAUNCH);

            PlanResult deleted = run("dev", Operation.DELETE);

            assertTrue(deleted.isSuccessful());
            assertEquals(List.of("dev/app", "dev/vpc"), List.copyOf(deleted.results().keySet()));
            assertEquals(StackStatus.PENDING, run("dev", Operation.STATUS).result("dev/vpc").status());
        }
    }

    @Nested
    @DisplayName("obsolete stacks")
    class PruneTests {

        @BeforeEach
        void obsoleteStack() throws IOException {
            write("config/dev/old.yaml", """
                    template_path: vpc.yaml
                    obsolete: true
                    parameters:
                      Name: old
                    """);
        }

        @Test
        @DisplayName("a group launch skips obsolete stacks")
        void skippedByLaunch() {
            PlanResult result = run("dev", Operation.LAUNCH);

            assertTrue(result.isSuccessful());
            assertNull(result.result("dev/old"));
        }

        @Test
        @DisplayName("launch with prune deletes obsolete stacks before launching the rest")
        void launchWithPrune() {
            assertTrue(run("dev/old", Operation.LAUNCH).isSuccessful());

            PlanResult result = service.execute("dev", Operation.LAUNCH, PlanOptions.defaults().withPrune(true));

            assertTrue(result.isSuccessful());
            assertEquals(Operation.DELETE, result.result("dev/old").operation());
            assertEquals(Operation.LAUNCH, result.result("dev/app").operation());
            assertEquals(StackStatus.PENDING, run("dev/old", Operation.STATUS).result("dev/old").status());
        }

        @Test
        @DisplayName("launch with prune on the obsolete stack itself deletes it and does not relaunch it")
        void launchWithPruneExactPath() {
            assertTrue(run("dev/old", Operation.LAUNCH).isSuccessful());

            PlanResult result = service.execute("dev/old", Operation.LAUNCH, PlanOptions.defaults().withPrune(true));

            assertTrue(result.isSuccessful());
            assertEquals(Operation.DELETE, result.result("dev/old").operation());
            assertEquals(StackStatus.PENDING, run("dev/old", Operation.STATUS).result("dev/old").status());
        }

        @Test
        @DisplayName("prune refuses an obsolete stack that a live stack depends on")
        void cannotPrune() throws IOException {
            write("config/dev/app.yaml", "template_path: app.yaml\ndependencies: [dev/old]\n");

            assertThrows(CannotPruneStackException.class, () -> service.prune("dev", PlanOptions.defaults()));
        }

        @Test
        @DisplayName("prune with nothing obsolete returns an empty result")
        void nothingToPrune() throws IOException {
            Files.delete(root.resolve("config/dev/old.yaml"));

            PlanResult result = service.prune(".", PlanOptions.defaults());

            assertTrue(result.results().isEmpty());
            assertTrue(result.isSuccessful());
        }
    }

    @Nested
    @DisplayName("read-only operations")
    class ReadOnlyTests {

        @Test
        @DisplayName("list returns the stacks in execution order")
        void list() {
            List<Stack> stacks = service.list("dev/app", PlanOptions.defaults());

            assertEquals(List.of("dev/vpc", "dev/app"), stacks.stream().map(Stack::name).toList());
            assertEquals("shop-dev-app", stacks.get(1).externalName());
        }

        @Test
        @DisplayName("dump config fails on an unresolvable output unless placeholders are enabled")
        @SuppressWarnings("unchecked")
        void placeholders() {
            PlanResult strict = run("dev/app", Operation.DUMP_CONFIG);
            assertEquals(FailureReason.RESOLUTION_ERROR, strict.result("dev/app").failureReason());

            PlanResult lenient = service.execute("dev/app", Operation.DUMP_CONFIG,
                    PlanOptions.defaults().withPlaceholders(true));
            assertTrue(lenient.isSuccessful());
            var config = (Map<String, Object>) lenient.result("dev/app").output();
            var parameters = (Map<String, Object>) config.get(Stack.PARAMETERS);
            assertTrue(String.valueOf(parameters.get("VpcId")).contains("stack_output"));
        }

        @Test
        @DisplayName("generate renders the template of each selected stack")
        void generate() {
            PlanResult result = run("dev/vpc", Operation.GENERATE);
            assertTrue(String.valueOf(result.result("dev/vpc").output()).contains("vpc-${Name}"));
        }
    }

    @Nested
    @DisplayName("change sets and diff")
    class ChangeSetTests {

        private final PlanOptions release = PlanOptions.defaults().withChangeSet("release-1");

        @Test
        @DisplayName("a change set creates the stack once executed")
        void createThenExecute() {
            PlanResult created = service.execute("dev/vpc", Operation.CREATE_CHANGE_SET, release);
            assertEquals(ChangeSetStatus.READY, created.result("dev/vpc").output());
            assertEquals(StackActions.PENDING, run("dev/vpc", Operation.STATUS).result("dev/vpc").output());

            PlanResult executed = service.execute("dev/vpc", Operation.EXECUTE_CHANGE_SET, release);

            assertTrue(executed.isSuccessful());
            assertEquals("CREATE_COMPLETE", run("dev/vpc", Operation.STATUS).result("dev/vpc").output());
            assertEquals(List.of(), run("dev/vpc", Operation.LIST_CHANGE_SETS).result("dev/vpc").output());
        }

        @Test
        @DisplayName("change set operations need a change set name")
        void nameRequired() {
            assertThrows(InvalidConfigurationException.class,
                    () -> run("dev/vpc", Operation.CREATE_CHANGE_SET));
            assertThrows(InvalidConfigurationException.class,
                    () -> service.execute("dev/vpc", Operation.EXECUTE_CHANGE_SET,
                            PlanOptions.defaults().withChangeSet(" ")));
        }

        @Test
        @DisplayName("diff tracks the deployed stack")
        void diff() throws IOException {
            var before = (StackDiff) run("dev/vpc", Operation.DIFF).result("dev/vpc").output();
            assertFalse(before.deployed());

            run("dev/vpc", Operation.LAUNCH);
            var launched = (StackDiff) run("dev/vpc", Operation.DIFF).result("dev/vpc").output();
            assertTrue(launched.deployed());
            assertFalse(launched.hasDifference());

            write("config/dev/vpc.yaml", """
                    template_path: vpc.yaml
                    parameters:
                      Name: edge
                    """);
            var changed = (StackDiff) run("dev/vpc", Operation.DIFF).result("dev/vpc").output();
            assertEquals(List.of("parameters.Name"),
                    changed.configDiff().stream().map(Difference::path).toList());
        }
    }
}
