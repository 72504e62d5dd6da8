package io.neocli;

import io.neocli.cli.NeoCommand;
import io.neocli.config.NeoConfig;
import io.neocli.errors.ErrorHandler;
import io.neocli.errors.PrintStreamConsoleUi;
import io.neocli.logging.LogLevel;
import io.neocli.runtime.NeoRuntime;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        BootOptions boot = BootOptions.scan(args);
        NeoRuntime runtime = new NeoRuntime(NeoConfig.fromDirectory(boot.configDir()));
        if (boot.verbose() || "true".equalsIgnoreCase(System.getenv("NEO_VERBOSE"))) {
            runtime.logger().setLevel(LogLevel.DEBUG);
        }

        int code;
        try {
            runtime.loadPlugins();
            code = NeoCommand.commandLine(runtime, PrintStreamConsoleUi.stderr()).execute(args);
        } catch (RuntimeException e) {
            runtime.errorHandler().handle(e);
            code = ErrorHandler.FAILURE_EXIT_CODE;
        }
        runtime.shutdown(code);
        System.exit(code);
    }

    /**
     * Options needed before the command line exists: plugin commands are mounted at build time,
     * so the configuration directory has to be known first.
     */
    record BootOptions(boolean verbose, String configDir) {
        static BootOptions scan(String[] args) {
            boolean verbose = false;
            String configDir = null;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if ("--".equals(arg)) {
                    break;
                }
                if ("-v".equals(arg) || "--verbose".equals(arg)) {
                    verbose = true;
                } else if ("--config-dir".equals(arg) && i + 1 < args.length) {
                    configDir = args[++i];
                } else if (arg.startsWith("--config-dir=")) {
                    configDir = arg.substring("--config-dir=".length());
                }
            }
            return new BootOptions(verbose, configDir);
        }
    }
}
