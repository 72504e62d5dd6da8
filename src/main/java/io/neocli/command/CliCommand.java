package io.neocli.command;

import io.neocli.errors.Result;

import java.util.List;
import java.util.Map;

/**
 * Unit registered for dispatch. {@link #name()} is the unique registry key.
 */
public interface CliCommand {
    String name();

    String description();

    default String version() {
        return null;
    }

    default List<String> aliases() {
        return List.of();
    }

    default List<CommandOption> options() {
        return List.of();
    }

    default List<CommandArgument> arguments() {
        return List.of();
    }

    default List<String> examples() {
        return List.of();
    }

    default boolean hidden() {
        return false;
    }

    Result<Void> execute(Map<String, Object> options, List<String> args) throws Exception;

    default boolean validate(Map<String, Object> options) {
        return true;
    }

    default String help() {
        return null;
    }
}
