package io.neocli.errors;

@FunctionalInterface
public interface ProcessTerminator {
    ProcessTerminator SYSTEM = System::exit;

    void exit(int status);
}
