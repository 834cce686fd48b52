package com.my.memory.adapter.out.sqlite;

import com.my.memory.domain.exception.ProjectNotFoundException;
import com.my.memory.domain.exception.StoreConsistencyException;
import com.my.memory.domain.model.Project;
import com.my.memory.domain.port.out.ProjectStorePort;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class SqliteProjectStore implements ProjectStorePort {

    private static final String SELECT_PROJECT = "SELECT id, name, permalink, root_path, is_default, created_at FROM project ";
    private static final String INSERT_SQL =
            "INSERT INTO project(name, permalink, root_path, is_default, created_at) VALUES (?, ?, ?, ?, ?)";
    private static final String CLEAR_DEFAULT_SQL = "UPDATE project SET is_default = 0 WHERE is_default = 1";
    private static final String SET_DEFAULT_SQL = "UPDATE project SET is_default = 1 WHERE id = ?";
    private static final String DELETE_SEARCH_SQL = "DELETE FROM search_index WHERE project_id = ?";
    private static final String DELETE_SQL = "DELETE FROM project WHERE id = ?";

    private final DataSource dataSource;

    public SqliteProjectStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    public void init() {
        SqliteSchema.apply(dataSource);
    }

    @Override
    public Project create(String name, String permalink, Path rootPath, boolean isDefault) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (isDefault) {
                    try (PreparedStatement ps = conn.prepareStatement(CLEAR_DEFAULT_SQL)) {
                        ps.executeUpdate();
                    }
                }
                try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
                    ps.setString(1, name);
                    ps.setString(2, permalink);
                    ps.setString(3, rootPath.toString());
                    ps.setInt(4, isDefault ? 1 : 0);
                    ps.setLong(5, Instant.now().toEpochMilli());
                    ps.executeUpdate();
                }
                Project project = selectOne(conn, SELECT_PROJECT + "WHERE permalink = ? COLLATE NOCASE", permalink)
                        .orElseThrow(() -> new StoreConsistencyException("저장한 프로젝트를 찾을 수 없습니다: " + permalink));
                conn.commit();
                return project;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreConsistencyException("프로젝트 생성 실패: " + permalink, e);
        }
    }

    @Override
    public Optional<Project> findByPermalink(String permalink) {
        try (Connection conn = dataSource.getConnection()) {
            return selectOne(conn, SELECT_PROJECT + "WHERE permalink = ? COLLATE NOCASE", permalink);
        } catch (SQLException e) {
            throw new StoreConsistencyException("프로젝트 조회 실패", e);
        }
    }

    @Override
    public Optional<Project> findById(long projectId) {
        try (Connection conn = dataSource.getConnection()) {
            return selectOne(conn, SELECT_PROJECT + "WHERE id = ?", projectId);
        } catch (SQLException e) {
            throw new StoreConsistencyException("프로젝트 조회 실패", e);
        }
    }

    @Override
    public Optional<Project> findDefault() {
        try (Connection conn = dataSource.getConnection()) {
            return selectAll(conn, SELECT_PROJECT + "WHERE is_default = 1 ORDER BY id LIMIT 1").stream().findFirst();
        } catch (SQLException e) {
            throw new StoreConsistencyException("기본 프로젝트 조회 실패", e);
        }
    }

    @Override
    public List<Project> findAll() {
        try (Connection conn = dataSource.getConnection()) {
            return selectAll(conn, SELECT_PROJECT + "ORDER BY id");
        } catch (SQLException e) {
            throw new StoreConsistencyException("프로젝트 목록 조회 실패", e);
        }
    }

    @Override
    public void setDefault(long projectId) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement(CLEAR_DEFAULT_SQL)) {
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(SET_DEFAULT_SQL)) {
                    ps.setLong(1, projectId);
                    if (ps.executeUpdate() == 0) {
                        throw new ProjectNotFoundException(String.valueOf(projectId));
                    }
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreConsistencyException("기본 프로젝트 변경 실패", e);
        }
    }

    @Override
    public void remove(long projectId) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement(DELETE_SEARCH_SQL)) {
                    ps.setLong(1, projectId);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(DELETE_SQL)) {
                    ps.setLong(1, projectId);
                    ps.executeUpdate();
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreConsistencyException("프로젝트 삭제 실패", e);
        }
    }

    private Optional<Project> selectOne(Connection conn, String sql, Object key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (key instanceof Long id) {
                ps.setLong(1, id);
            } else {
                ps.setString(1, String.valueOf(key));
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private List<Project> selectAll(Connection conn, String sql) throws SQLException {
        List<Project> projects = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                projects.add(map(rs));
            }
        }
        return projects;
    }

    private static Project map(ResultSet rs) throws SQLException {
        return new Project(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("permalink"),
                Path.of(rs.getString("root_path")),
                rs.getInt("is_default") == 1,
                Instant.ofEpochMilli(rs.getLong("created_at")));
    }
}
