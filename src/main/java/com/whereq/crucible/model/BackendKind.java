package com.whereq.crucible.model;

/**
 * Kind of execution backend behind an environment
 */
public enum BackendKind {
    /**
     * Lightweight container sharing the host kernel facilities
     */
    CONTAINER,

    /**
     * Full-machine emulator booting its own kernel
     */
    EMULATOR,

    /**
     * Bare-metal development board
     */
    PHYSICAL;

    public boolean isLightweight() {
        return this == CONTAINER;
    }
}
