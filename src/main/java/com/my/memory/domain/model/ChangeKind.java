package com.my.memory.domain.model;

public enum ChangeKind {
    CREATED,
    MODIFIED,
    DELETED,
    MOVED
}
