package com.my.memory.domain.port.in;

import com.my.memory.domain.model.ContextRequest;
import com.my.memory.domain.model.GraphSnapshot;

public interface BuildContextUseCase {
    GraphSnapshot buildContext(ContextRequest request);
}
