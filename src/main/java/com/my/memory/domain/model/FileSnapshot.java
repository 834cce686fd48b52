package com.my.memory.domain.model;

import java.time.Instant;

public record FileSnapshot(String path, String checksum, Instant modifiedAt) {
}
