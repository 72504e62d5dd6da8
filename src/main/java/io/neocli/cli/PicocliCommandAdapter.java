package io.neocli.cli;

import io.neocli.command.CliCommand;
import io.neocli.command.CommandArgument;
import io.neocli.command.CommandOption;
import io.neocli.errors.ConsoleUi;
import io.neocli.errors.ErrorHandler;
import io.neocli.errors.Result;
import io.neocli.errors.ValidationError;
import io.neocli.plugin.PluginRegistry;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Model.PositionalParamSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Mounts registry commands on picocli. Option flags use the {@code "-f, --force <value>"} syntax:
 * a {@code <label>} takes a required value, a {@code [label]} an optional one, no label makes a switch.
 */
final class PicocliCommandAdapter {
    private final PluginRegistry pluginRegistry;
    private final ErrorHandler errorHandler;
    private final ConsoleUi ui;

    PicocliCommandAdapter(PluginRegistry pluginRegistry, ErrorHandler errorHandler, ConsoleUi ui) {
        this.pluginRegistry = pluginRegistry;
        this.errorHandler = errorHandler;
        this.ui = ui;
    }

    CommandSpec toSpec(CliCommand command) {
        Invocation invocation = new Invocation(command);
        CommandSpec spec = CommandSpec.wrapWithoutInspection(invocation);
        invocation.spec = spec;
        spec.mixinStandardHelpOptions(true);
        if (command.version() != null) {
            spec.version(command.version());
        }
        spec.usageMessage().description(command.description() == null ? "" : command.description());
        spec.usageMessage().hidden(command.hidden());
        if (!command.examples().isEmpty()) {
            List<String> footer = new ArrayList<>();
            footer.add("%nExamples:");
            for (String example : command.examples()) {
                footer.add("  " + example);
            }
            spec.usageMessage().footer(footer.toArray(new String[0]));
        }

        for (CommandOption option : command.options()) {
            spec.addOption(toOptionSpec(option));
        }
        int index = 0;
        for (CommandArgument argument : command.arguments()) {
            spec.addPositional(toPositionalSpec(argument, index++));
        }
        return spec;
    }

    static OptionSpec toOptionSpec(CommandOption option) {
        FlagSyntax syntax = FlagSyntax.parse(option.flags());
        OptionSpec.Builder builder = OptionSpec.builder(syntax.names().toArray(new String[0]))
                .description(option.description() == null ? "" : option.description())
                .required(option.required());
        if (syntax.takesValue()) {
            builder.type(String.class)
                    .paramLabel(syntax.label())
                    .arity(syntax.valueOptional() ? "0..1" : "1");
            if (option.defaultValue() != null) {
                builder.defaultValue(String.valueOf(option.defaultValue()));
            }
        } else {
            builder.type(boolean.class)
                    .arity("0")
                    .defaultValue(option.defaultValue() == null ? "false" : String.valueOf(option.defaultValue()));
        }
        return builder.build();
    }

    static PositionalParamSpec toPositionalSpec(CommandArgument argument, int index) {
        PositionalParamSpec.Builder builder = PositionalParamSpec.builder()
                .index(String.valueOf(index))
                .paramLabel("<" + argument.name() + ">")
                .arity(argument.required() ? "1" : "0..1")
                .type(String.class)
                .description(argument.description() == null ? "" : argument.description());
        if (argument.defaultValue() != null) {
            builder.defaultValue(String.valueOf(argument.defaultValue()));
        }
        return builder.build();
    }

    /**
     * Option key as handed to {@link CliCommand#execute}: the longest name without dashes, camel-cased.
     */
    static String optionKey(String longestName) {
        String bare = longestName.replaceFirst("^-+", "");
        StringBuilder sb = new StringBuilder(bare.length());
        boolean upper = false;
        for (int i = 0; i < bare.length(); i++) {
            char ch = bare.charAt(i);
            if (ch == '-') {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(ch) : ch);
            upper = false;
        }
        return sb.toString();
    }

    private final class Invocation implements Callable<Integer> {
        private final CliCommand command;
        private CommandSpec spec;

        private Invocation(CliCommand command) {
            this.command = command;
        }

        @Override
        public Integer call() throws Exception {
            Map<String, Object> options = new LinkedHashMap<>();
            for (OptionSpec option : spec.options()) {
                if (option.usageHelp() || option.versionHelp()) {
                    continue;
                }
                options.put(optionKey(option.longestName()), option.getValue());
            }
            List<String> args = new ArrayList<>();
            for (PositionalParamSpec positional : spec.positionalParameters()) {
                Object value = positional.getValue();
                if (value != null) {
                    args.add(String.valueOf(value));
                }
            }

            pluginRegistry.executeBeforeCommand(command.name(), options);
            if (!command.validate(options)) {
                errorHandler.handleCommandResult(Result.failure(new ValidationError(
                        "Invalid options for command \"" + command.name() + "\"", null, options)), ui);
                return ErrorHandler.FAILURE_EXIT_CODE;
            }

            Result<Void> result = command.execute(options, args);
            if (result == null) {
                result = Result.ok();
            }
            pluginRegistry.executeAfterCommand(command.name(), result);
            errorHandler.handleCommandResult(result, ui);
            return result.isSuccess() ? 0 : ErrorHandler.FAILURE_EXIT_CODE;
        }
    }

    record FlagSyntax(List<String> names, String label, boolean valueOptional) {
        boolean takesValue() {
            return label != null;
        }

        static FlagSyntax parse(String flags) {
            if (flags == null || flags.isBlank()) {
                throw new IllegalArgumentException("option flags cannot be empty");
            }
            List<String> names = new ArrayList<>();
            String label = null;
            boolean optional = false;
            for (String token : flags.trim().split("[,\\s]+")) {
                if (token.startsWith("<") && token.endsWith(">")) {
                    label = token;
                } else if (token.startsWith("[") && token.endsWith("]")) {
                    label = "<" + token.substring(1, token.length() - 1) + ">";
                    optional = true;
                } else if (token.startsWith("-")) {
                    names.add(token);
                } else if (!token.isEmpty()) {
                    throw new IllegalArgumentException("Unrecognized token \"" + token + "\" in option flags: " + flags);
                }
            }
            if (names.isEmpty()) {
                throw new IllegalArgumentException("option flags declare no names: " + flags);
            }
            return new FlagSyntax(List.copyOf(names), label, optional);
        }
    }
}
