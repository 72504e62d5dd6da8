package io.neocli.command;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class CommandRegistry {
    private record Registered(CliCommand command, CommandMetadata metadata) {
    }

    private final Map<String, Registered> commands = new LinkedHashMap<>();

    public void register(CliCommand command) {
        register(command, null);
    }

    /**
     * @throws IllegalArgumentException if a command with the same name is already registered
     */
    public void register(CliCommand command, CommandMetadata metadata) {
        Objects.requireNonNull(command, "command");
        String name = command.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Command name must be non-blank");
        }
        if (commands.containsKey(name)) {
            throw new IllegalArgumentException("Command \"" + name + "\" is already registered");
        }
        commands.put(name, new Registered(command, metadata));
    }

    public void unregister(String commandName) {
        commands.remove(commandName);
    }

    public Optional<CliCommand> get(String commandName) {
        Registered registered = commands.get(commandName);
        return registered == null ? Optional.empty() : Optional.of(registered.command());
    }

    public List<CliCommand> getAll() {
        List<CliCommand> out = new ArrayList<>(commands.size());
        for (Registered registered : commands.values()) {
            out.add(registered.command());
        }
        return out;
    }

    public List<CliCommand> getByGroup(String group) {
        List<CliCommand> out = new ArrayList<>();
        for (Registered registered : commands.values()) {
            if (registered.metadata() != null && Objects.equals(group, registered.metadata().group())) {
                out.add(registered.command());
            }
        }
        return out;
    }

    public boolean hasCommand(String commandName) {
        return commands.containsKey(commandName);
    }

    public Optional<CommandMetadata> getMetadata(String commandName) {
        Registered registered = commands.get(commandName);
        return registered == null ? Optional.empty() : Optional.ofNullable(registered.metadata());
    }

    public List<String> getNames() {
        return List.copyOf(commands.keySet());
    }

    public void clear() {
        commands.clear();
    }

    public int size() {
        return commands.size();
    }
}
