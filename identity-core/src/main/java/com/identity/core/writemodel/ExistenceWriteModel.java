package com.identity.core.writemodel;

/**
 * Write-model whose only question is whether the aggregate currently exists.
 */
public interface ExistenceWriteModel extends AppendReducer {

    boolean exists();
}
