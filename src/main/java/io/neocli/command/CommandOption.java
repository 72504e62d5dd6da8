package io.neocli.command;

/**
 * Option declaration in the familiar {@code "-f, --force <value>"} flag syntax.
 */
public record CommandOption(
        String flags,
        String description,
        Object defaultValue,
        boolean required
) {
    public static CommandOption of(String flags, String description) {
        return new CommandOption(flags, description, null, false);
    }

    public static CommandOption required(String flags, String description) {
        return new CommandOption(flags, description, null, true);
    }

    public static CommandOption withDefault(String flags, String description, Object defaultValue) {
        return new CommandOption(flags, description, defaultValue, false);
    }
}
