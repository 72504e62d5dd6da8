package io.neocli.errors;

public interface ErrorRecoveryStrategy {
    boolean canRecover(AppError error);

    /**
     * Returns normally when the error was recovered; throws when recovery failed.
     */
    void recover(AppError error) throws Exception;
}
