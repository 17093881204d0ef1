package com.adlab.backend.modules.snapshot.domain;

public enum IngestionStatus {
    PASS,
    WARN,
    FAIL
}
