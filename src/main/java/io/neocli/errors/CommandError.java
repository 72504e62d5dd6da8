package io.neocli.errors;

public class CommandError extends AppError {
    private final String commandName;

    public CommandError(String message, String commandName) {
        this(message, commandName, ErrorOptions.NONE);
    }

    public CommandError(String message, String commandName, ErrorOptions options) {
        super(message, options);
        this.commandName = commandName;
    }

    public String commandName() {
        return commandName;
    }

    @Override
    public String code() {
        return "COMMAND_ERROR";
    }

    @Override
    public ErrorSeverity severity() {
        return ErrorSeverity.MEDIUM;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.COMMAND;
    }
}
