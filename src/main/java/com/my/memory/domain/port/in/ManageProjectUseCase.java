package com.my.memory.domain.port.in;

import com.my.memory.domain.model.Project;

import java.nio.file.Path;
import java.util.List;

public interface ManageProjectUseCase {

    Project createProject(String name, Path rootPath, boolean makeDefault);

    List<Project> listProjects();

    void removeProject(String project);

    Project setDefaultProject(String project);
}
