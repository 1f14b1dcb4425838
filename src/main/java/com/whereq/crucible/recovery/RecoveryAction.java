package com.whereq.crucible.recovery;

/**
 * Attempt to clear an unresolved error
 */
@FunctionalInterface
public interface RecoveryAction {
    /**
     * @param event unresolved error of the category the action is registered for
     * @return true if the cause is gone and the error can be resolved
     * @throws Exception if the attempt itself failed
     */
    boolean attempt(ErrorEvent event) throws Exception;
}
