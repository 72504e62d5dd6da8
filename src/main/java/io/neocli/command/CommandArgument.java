package io.neocli.command;

public record CommandArgument(
        String name,
        String description,
        boolean required,
        Object defaultValue
) {
    public static CommandArgument required(String name, String description) {
        return new CommandArgument(name, description, true, null);
    }

    public static CommandArgument optional(String name, String description) {
        return new CommandArgument(name, description, false, null);
    }
}
