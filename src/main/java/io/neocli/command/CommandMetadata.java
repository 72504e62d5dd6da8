package io.neocli.command;

import java.util.List;

public record CommandMetadata(
        String name,
        String description,
        String group,
        int priority,
        boolean experimental,
        boolean deprecated,
        String deprecationMessage,
        List<String> aliases,
        boolean hidden
) {
    public CommandMetadata {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public static CommandMetadata grouped(CliCommand command, String group) {
        return new CommandMetadata(
                command.name(),
                command.description(),
                group,
                0,
                false,
                false,
                null,
                command.aliases(),
                command.hidden()
        );
    }
}
