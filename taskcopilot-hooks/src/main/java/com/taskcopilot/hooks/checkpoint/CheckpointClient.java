package com.taskcopilot.hooks.checkpoint;

/**
 * Persistence client that stores task checkpoints.
 */
@FunctionalInterface
public interface CheckpointClient {

    /**
     * Persist a checkpoint.
     *
     * @return the id of the stored checkpoint
     */
    String createCheckpoint(CheckpointRequest request);
}
