package io.neocli.cli;

import io.neocli.command.CliCommand;
import io.neocli.command.CommandMetadata;
import io.neocli.config.NeoVersion;
import io.neocli.errors.ConsoleUi;
import io.neocli.errors.ErrorHandler;
import io.neocli.plugin.Plugin;
import io.neocli.plugin.PluginRegistry;
import io.neocli.runtime.NeoRuntime;
import io.neocli.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "neo",
        mixinStandardHelpOptions = true,
        versionProvider = NeoCommand.VersionProvider.class,
        description = "Developer productivity CLI with a plugin runtime",
        subcommands = {
                NeoCommand.PluginsCommand.class,
                NeoCommand.CommandsCommand.class
        }
)
public final class NeoCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(NeoCommand.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging")
    boolean verbose;

    @Option(names = {"--config-dir"}, description = "Configuration directory (default: $NEO_CONFIG_DIR or ~/.config/neo)")
    String configDir;

    @Spec
    CommandSpec spec;

    private final NeoRuntime runtime;

    NeoCommand(NeoRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    NeoRuntime runtime() {
        return runtime;
    }

    /**
     * Builds the command line with every registered plugin command mounted as a subcommand.
     */
    public static CommandLine commandLine(NeoRuntime runtime, ConsoleUi ui) {
        CommandLine cli = new CommandLine(new NeoCommand(runtime));
        PicocliCommandAdapter adapter = new PicocliCommandAdapter(runtime.pluginRegistry(), runtime.errorHandler(), ui);
        for (CliCommand command : runtime.commandRegistry().getAll()) {
            if (cli.getSubcommands().containsKey(command.name())) {
                log.warn("Plugin command \"{}\" clashes with a built-in command; skipping", command.name());
                continue;
            }
            try {
                cli.addSubcommand(command.name(), adapter.toSpec(command), command.aliases().toArray(new String[0]));
                log.debug("Registered plugin command: {}", command.name());
            } catch (CommandLine.InitializationException | IllegalArgumentException e) {
                log.warn("Failed to mount command \"{}\": {}", command.name(), e.getMessage());
            }
        }
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            runtime.pluginRegistry().executeOnError(ex);
            runtime.errorHandler().handle(ex);
            // recovered errors still fail the command
            return ErrorHandler.FAILURE_EXIT_CODE;
        });
        return cli;
    }

    static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[]{"neo " + NeoVersion.current()};
        }
    }

    @Command(name = "plugins", description = "Inspect installed plugins", subcommands = {
            NeoCommand.PluginsListCommand.class,
            NeoCommand.PluginsDirCommand.class
    })
    static final class PluginsCommand implements Runnable {
        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            spec.commandLine().usage(spec.commandLine().getOut());
        }
    }

    @Command(name = "list", description = "List loaded plugins and their state")
    static final class PluginsListCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Option(names = {"--json"}, description = "Print JSON instead of a table")
        boolean json;

        @Override
        public Integer call() {
            NeoCommand root = (NeoCommand) spec.root().userObject();
            PluginRegistry registry = root.runtime().pluginRegistry();
            PrintWriter out = spec.commandLine().getOut();

            List<Map<String, Object>> rows = new ArrayList<>();
            for (Plugin plugin : registry.getLoadedPlugins()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("name", plugin.name());
                row.put("version", plugin.version());
                row.put("state", registry.getState(plugin.name()).map(Enum::name).orElse("UNKNOWN"));
                row.put("path", registry.getPath(plugin.name()).map(Object::toString).orElse(""));
                rows.add(row);
            }
            if (json) {
                out.println(Jsons.toJson(rows));
            } else if (rows.isEmpty()) {
                out.println("No plugins loaded from " + root.runtime().pluginLoader().pluginsDir());
            } else {
                for (Map<String, Object> row : rows) {
                    out.printf("%s@%s  %s  %s%n", row.get("name"), row.get("version"), row.get("state"), row.get("path"));
                }
            }
            out.flush();
            return 0;
        }
    }

    @Command(name = "dir", description = "Print the plugins directory")
    static final class PluginsDirCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            NeoCommand root = (NeoCommand) spec.root().userObject();
            PrintWriter out = spec.commandLine().getOut();
            out.println(root.runtime().pluginLoader().pluginsDir());
            out.flush();
            return 0;
        }
    }

    @Command(name = "commands", description = "List commands contributed by plugins")
    static final class CommandsCommand implements Callable<Integer> {
        @ParentCommand
        NeoCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--group"}, description = "Only commands of this group (plugin name)")
        String group;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            List<CliCommand> commands = group == null
                    ? parent.runtime().commandRegistry().getAll()
                    : parent.runtime().commandRegistry().getByGroup(group);
            for (CliCommand command : commands) {
                if (command.hidden()) {
                    continue;
                }
                String owner = parent.runtime().commandRegistry().getMetadata(command.name())
                        .map(CommandMetadata::group)
                        .orElse("-");
                out.printf("%-20s %-16s %s%n", command.name(), owner, command.description());
            }
            out.flush();
            return 0;
        }
    }
}
