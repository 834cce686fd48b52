package com.my.memory.domain.model;

public record WriteResult(Entity entity, String permalink, boolean created) {
}
