package com.my.memory.domain.port.out;

import com.my.memory.domain.model.ProjectScope;

public interface ChangeWatcherPort {

    void watch(ProjectScope scope, ChangeListener listener);

    void unwatch(long projectId);
}
