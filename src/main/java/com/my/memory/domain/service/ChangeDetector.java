package com.my.memory.domain.service;

import com.my.memory.domain.model.ChangeEvent;
import com.my.memory.domain.model.FileSnapshot;
import com.my.memory.domain.model.ProjectScope;
import com.my.memory.domain.model.ScanReport;
import com.my.memory.domain.port.out.FilePort;
import com.my.memory.domain.port.out.KnowledgeStorePort;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 디스크 상태와 저장된 checksum 을 비교해 이동, 삭제, 생성, 수정을 분류한다.
 * 사라진 경로와 같은 checksum 을 가진 새 경로는 이동으로 본다.
 */
public class ChangeDetector {

    private final FilePort files;
    private final KnowledgeStorePort store;

    public ChangeDetector(FilePort files, KnowledgeStorePort store) {
        this.files = files;
        this.store = store;
    }

    public ScanReport scan(ProjectScope scope) {
        Map<String, String> errors = new TreeMap<>();
        Map<String, String> onDisk = new TreeMap<>();
        for (FileSnapshot snapshot : files.walk(scope, errors)) {
            onDisk.put(snapshot.path(), snapshot.checksum());
        }
        Map<String, String> known = new TreeMap<>(store.fileChecksums(scope.projectId()));

        List<String> vanished = new ArrayList<>();
        for (String path : known.keySet()) {
            if (!onDisk.containsKey(path) && !errors.containsKey(path)) {
                vanished.add(path);
            }
        }
        Map<String, Deque<String>> newPathsByChecksum = new TreeMap<>();
        List<ChangeEvent> modifications = new ArrayList<>();
        for (Map.Entry<String, String> entry : onDisk.entrySet()) {
            String previous = known.get(entry.getKey());
            if (previous == null) {
                newPathsByChecksum.computeIfAbsent(entry.getValue(), k -> new ArrayDeque<>()).add(entry.getKey());
            } else if (!previous.equals(entry.getValue())) {
                modifications.add(ChangeEvent.modified(entry.getKey()));
            }
        }

        List<ChangeEvent> moves = new ArrayList<>();
        List<ChangeEvent> deletions = new ArrayList<>();
        for (String path : vanished) {
            Deque<String> candidates = newPathsByChecksum.get(known.get(path));
            if (candidates != null && !candidates.isEmpty()) {
                moves.add(ChangeEvent.moved(path, candidates.poll()));
            } else {
                deletions.add(ChangeEvent.deleted(path));
            }
        }
        List<String> created = new ArrayList<>();
        newPathsByChecksum.values().forEach(created::addAll);
        created.sort(null);
        List<ChangeEvent> creations = new ArrayList<>();
        for (String path : created) {
            creations.add(ChangeEvent.created(path));
        }
        return new ScanReport(moves, deletions, creations, modifications, onDisk, errors);
    }
}
