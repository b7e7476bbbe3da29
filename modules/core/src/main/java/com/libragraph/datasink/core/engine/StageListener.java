package com.libragraph.datasink.core.engine;

/**
 * Notified when a workflow enters a stage, before the stage does any work.
 * An exception thrown here fails the workflow at that stage.
 */
@FunctionalInterface
public interface StageListener {

    StageListener NONE = (operation, stage) -> { };

    void onStage(String operation, Enum<?> stage);
}
