package io.neocli.cli;

import io.neocli.command.FakeCommand;
import io.neocli.errors.Result;
import io.neocli.plugin.LifecycleHooks;
import io.neocli.plugin.PluginState;
import io.neocli.plugin.FakePlugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NeoCommandTest {
    @TempDir
    Path tempDir;

    private CliHarness harness;

    @BeforeEach
    void setUp() {
        harness = new CliHarness(tempDir);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void pluginCommandReceivesParsedOptionsAndArguments() throws Exception {
        DeployCommand deploy = new DeployCommand();
        harness.install(new FakePlugin("ops", "1.0.0").withCommand(deploy));

        int code = harness.run("deploy", "--force", "-b", "release", "staging");

        assertEquals(0, code);
        assertEquals(Map.of("branch", "release", "force", true, "dryRun", false), withoutNulls(deploy.options));
        assertNull(deploy.options.get("tag"));
        assertEquals(List.of("staging"), deploy.args);
        assertFalse(harness.terminator.terminated());
    }

    @Test
    void defaultsAndAliasesApply() throws Exception {
        DeployCommand deploy = new DeployCommand();
        harness.install(new FakePlugin("ops", "1.0.0").withCommand(deploy));

        assertEquals(0, harness.run("dp", "prod", "eu-west"));

        assertEquals("main", deploy.options.get("branch"));
        assertEquals(List.of("prod", "eu-west"), deploy.args);
    }

    @Test
    void failedResultReportsAndTerminates() throws Exception {
        DeployCommand deploy = new DeployCommand();
        deploy.result = DeployCommand.rejected();
        harness.install(new FakePlugin("ops", "1.0.0").withCommand(deploy));

        int code = harness.run("deploy", "prod");

        assertEquals(1, code);
        assertEquals(List.of(1), harness.terminator.statuses());
        assertTrue(harness.err().contains("✖ Deployment rejected\n  • Ask for approval"));
    }

    @Test
    void invalidOptionsSkipExecution() throws Exception {
        DeployCommand deploy = new DeployCommand();
        deploy.valid = false;
        harness.install(new FakePlugin("ops", "1.0.0").withCommand(deploy));

        assertEquals(1, harness.run("deploy", "prod"));

        assertNull(deploy.args);
        assertTrue(harness.err().contains("Invalid options for command \"deploy\""));
        assertEquals(List.of(1), harness.terminator.statuses());
    }

    @Test
    void thrownErrorRunsOnErrorHooksAndHandler() throws Exception {
        List<String> seen = new ArrayList<>();
        DeployCommand deploy = new DeployCommand();
        deploy.failure = new IllegalStateException("cluster unreachable");
        harness.install(new FakePlugin("ops", "1.0.0").withCommand(deploy).withHooks(new LifecycleHooks() {
            @Override
            public void onError(Throwable error) {
                seen.add(error.getMessage());
            }
        }));

        assertEquals(1, harness.run("deploy", "prod"));

        assertEquals(List.of("cluster unreachable"), seen);
        assertEquals(List.of(1), harness.terminator.statuses());
        assertTrue(harness.err().startsWith("✖ cluster unreachable"));
        assertTrue(harness.err().contains("Code: UNKNOWN_ERROR"));
    }

    @Test
    void hooksWrapCommandExecution() throws Exception {
        List<String> seen = new ArrayList<>();
        harness.install(new FakePlugin("ops", "1.0.0").withCommand(new FakeCommand("hello")).withHooks(new LifecycleHooks() {
            @Override
            public void beforeCommand(String commandName, Object options) {
                seen.add("before:" + commandName);
            }

            @Override
            public void afterCommand(String commandName, Result<Void> result) {
                seen.add("after:" + commandName + ":" + result.isSuccess());
            }
        }));

        assertEquals(0, harness.run("hello"));
        assertEquals(List.of("before:hello", "after:hello:true"), seen);
    }

    @Test
    void pluginCommandCannotShadowBuiltIn() throws Exception {
        FakeCommand shadow = new FakeCommand("plugins");
        harness.install(new FakePlugin("sneaky", "1.0.0").withCommand(shadow));

        assertEquals(0, harness.run("plugins", "dir"));

        assertEquals(0, shadow.executions());
    }

    @Test
    void pluginsDirPrintsResolvedDirectory() {
        assertEquals(0, harness.run("plugins", "dir"));
        assertEquals(harness.runtime.config().pluginsDir() + "\n", harness.out());
    }

    @Test
    void pluginsListWithoutPlugins() {
        assertEquals(0, harness.run("plugins", "list"));
        assertTrue(harness.out().startsWith("No plugins loaded from "));
    }

    @Test
    void pluginsListShowsStateAndPath() throws Exception {
        harness.install(new FakePlugin("good", "1.2.0"));
        harness.install(new FakePlugin("bad", "0.1.0").failingInitialize(new Exception("nope")));

        assertEquals(0, harness.run("plugins", "list"));

        String out = harness.out();
        assertTrue(out.contains("bad@0.1.0  ERROR  " + harness.runtime.config().pluginsDir().resolve("bad")));
        assertTrue(out.contains("good@1.2.0  INITIALIZED  "));
        assertEquals(PluginState.ERROR, harness.runtime.pluginRegistry().getState("bad").orElseThrow());
    }

    @Test
    void pluginsListAsJson() throws Exception {
        harness.install(new FakePlugin("good", "1.2.0"));

        assertEquals(0, harness.run("plugins", "list", "--json"));

        String out = harness.out();
        assertTrue(out.trim().startsWith("["));
        assertTrue(out.contains("\"name\" : \"good\""));
        assertTrue(out.contains("\"state\" : \"INITIALIZED\""));
    }

    @Test
    void commandsListsGroupsAndSkipsHidden() throws Exception {
        harness.install(new FakePlugin("ops", "1.0.0").withCommand(new FakeCommand("deploy", "Deploy it")));
        harness.install(new FakePlugin("git", "1.0.0").withCommand(new FakeCommand("sync", "Sync branches"))
                .withCommand(new FakeCommand("secret") {
                    @Override
                    public boolean hidden() {
                        return true;
                    }
                }));

        assertEquals(0, harness.run("commands"));
        String all = harness.out();
        assertTrue(all.contains("deploy"));
        assertTrue(all.contains("Sync branches"));
        assertFalse(all.contains("secret"));

        harness.run("commands", "--group", "ops");
        String grouped = harness.out().substring(all.length());
        assertTrue(grouped.contains("deploy"));
        assertFalse(grouped.contains("sync"));
    }

    @Test
    void rootWithoutSubcommandPrintsUsage() {
        assertEquals(0, harness.run());
        assertTrue(harness.out().contains("Usage: neo"));
    }

    @Test
    void pluginCommandHelpShowsDeclaredSyntax() throws Exception {
        harness.install(new FakePlugin("ops", "1.0.0").withCommand(new DeployCommand()));

        assertEquals(0, harness.run("deploy", "--help"));

        String help = harness.out();
        assertTrue(help.contains("--branch=<name>"));
        assertTrue(help.contains("Deploy a target"));
        assertTrue(help.contains("neo deploy staging --force"));
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> options) {
        Map<String, Object> out = new LinkedHashMap<>();
        options.forEach((key, value) -> {
            if (value != null) {
                out.put(key, value);
            }
        });
        return out;
    }
}
