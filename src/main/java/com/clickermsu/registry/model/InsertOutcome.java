package com.clickermsu.registry.model;

public enum InsertOutcome {
    OK,
    CONFLICT
}
