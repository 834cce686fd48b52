package com.my.memory.domain.port.out;

import com.my.memory.domain.model.Entity;
import com.my.memory.domain.model.EntityWrite;
import com.my.memory.domain.model.Observation;
import com.my.memory.domain.model.Relation;
import com.my.memory.domain.model.SearchQuery;
import com.my.memory.domain.model.SearchResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 지식 그래프 영속 계층. 모든 연산은 projectId 범위 안에서 트랜잭션으로 수행된다.
 */
public interface KnowledgeStorePort {

    /**
     * 엔티티 행, 관찰, 나가는 관계, 검색 색인을 하나의 트랜잭션으로 갱신한다.
     */
    Entity upsertEntity(long projectId, EntityWrite write);

    /**
     * 파일 경로만 바꾼다. newPermalink 와 newChecksum 이 null 이면 기존 값을 유지한다.
     */
    Entity moveEntity(long projectId, long entityId, String newPath, String newPermalink, String newChecksum);

    /**
     * 관찰과 나가는 관계를 함께 지우고, 들어오는 관계는 대상 없음 상태로 되돌린다.
     */
    void deleteEntity(long projectId, long entityId);

    /**
     * 대상 없는 관계 중 이제 해석 가능한 것을 연결하고 그 수를 돌려준다.
     */
    int resolveDanglingRelations(long projectId);

    void rebuildSearchIndex(long projectId);

    /**
     * 관련도 순(텍스트가 없으면 최근 수정 순)으로 limit 건을 돌려준다.
     */
    List<SearchResult> search(long projectId, SearchQuery query, int limit, int offset);

    Optional<Entity> findById(long projectId, long entityId);

    Optional<Entity> findByPermalink(long projectId, String permalink);

    Optional<Entity> findByFilePath(long projectId, String filePath);

    /**
     * 대소문자를 무시하고 찾되 정확히 일치하는 제목을 먼저 돌려준다.
     */
    List<Entity> findByTitle(long projectId, String title);

    List<Entity> findByIds(long projectId, Collection<Long> entityIds);

    /**
     * '*' 와일드카드를 포함한 permalink 또는 파일 경로 패턴으로 찾는다.
     */
    List<Entity> findByPattern(long projectId, String pattern, int limit, int offset);

    /**
     * file_path → checksum. 전체 스캔의 비교 기준이다.
     */
    Map<String, String> fileChecksums(long projectId);

    Map<Long, List<Observation>> observationsFor(Collection<Long> entityIds);

    /**
     * 주어진 엔티티에서 나가거나 들어오는 관계를 모두 돌려준다.
     */
    List<Relation> relationsTouching(long projectId, Collection<Long> entityIds);

    List<Relation> danglingRelations(long projectId);

    long countEntities(long projectId);
}
