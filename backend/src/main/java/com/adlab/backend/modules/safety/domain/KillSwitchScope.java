package com.adlab.backend.modules.safety.domain;

public enum KillSwitchScope {
    GLOBAL,
    WORKSPACE
}
