package com.my.memory.domain.port.in;

import com.my.memory.domain.model.Entity;
import com.my.memory.domain.model.EntityContent;
import com.my.memory.domain.model.WriteEntityCommand;
import com.my.memory.domain.model.WriteResult;

/**
 * 도구 계층이 노트를 쓰고, 읽고, 옮기고, 지우는 진입점. project 가 null 이면 기본 프로젝트를 쓴다.
 */
public interface ManageEntityUseCase {

    WriteResult writeEntity(WriteEntityCommand command);

    EntityContent readEntity(String identifier, String project);

    Entity moveEntity(String identifier, String destinationPath, String project);

    boolean deleteEntity(String identifier, String project);
}
