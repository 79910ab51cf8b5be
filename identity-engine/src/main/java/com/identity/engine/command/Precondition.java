package com.identity.engine.command;

import com.identity.core.exception.IdentityException;
import com.identity.core.writemodel.ExistenceWriteModel;
import java.util.function.Supplier;

/**
 * Check evaluated before a command appends anything.
 * Each precondition reduces its own write-model through the executor.
 */
@FunctionalInterface
public interface Precondition {

    /**
     * @throws IdentityException describing why the command must not run
     */
    void check(CommandExecutor executor);

    static Precondition exists(ExistenceWriteModel model, Supplier<? extends IdentityException> error) {
        return executor -> {
            if (!executor.exists(model)) {
                throw error.get();
            }
        };
    }

    static Precondition notExists(ExistenceWriteModel model, Supplier<? extends IdentityException> error) {
        return executor -> {
            if (executor.exists(model)) {
                throw error.get();
            }
        };
    }
}
