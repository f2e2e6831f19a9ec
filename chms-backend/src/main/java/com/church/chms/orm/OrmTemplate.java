package com.church.chms.orm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.BeanPropertyRowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 基于 NamedParameterJdbcTemplate 的通用数据访问：单表增删改查 + 执行 {@link QueryBuilder}。
 * <p>
 * 写操作不自带事务，由调用方的 {@code @Transactional} 决定边界。
 */
@Slf4j
@Component
public class OrmTemplate {

    private final NamedParameterJdbcTemplate jdbc;

    public OrmTemplate(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<Map<String, Object>> getAll(String table) {
        return select(QueryBuilder.from(table));
    }

    public List<Map<String, Object>> getWhere(String table, Map<String, ?> conditions) {
        QueryBuilder builder = QueryBuilder.from(table);
        conditions.forEach(builder::where);
        return select(builder);
    }

    /**
     * 插入一行，返回自增主键 (表没有自增主键时返回 null)
     */
    public Long insert(String table, Map<String, ?> data) {
        if (data.isEmpty()) {
            throw new IllegalArgumentException("No data to insert into " + table);
        }
        QueryBuilder.requireIdentifier(table);
        data.keySet().forEach(QueryBuilder::requireIdentifier);

        String columns = String.join(", ", data.keySet());
        String values = data.keySet().stream().map(c -> ":" + c).collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + table + " (" + columns + ") VALUES (" + values + ")";

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(sql, new MapSqlParameterSource(data), keyHolder);
        List<Map<String, Object>> keys = keyHolder.getKeyList();
        if (keys.isEmpty() || keys.get(0).isEmpty()) {
            return null;
        }
        Object key = keys.get(0).values().iterator().next();
        return key instanceof Number ? ((Number) key).longValue() : null;
    }

    /**
     * 按条件更新，返回受影响行数
     */
    public int update(String table, Map<String, ?> data, Map<String, ?> conditions) {
        if (data.isEmpty() || conditions.isEmpty()) {
            throw new IllegalArgumentException("Update of " + table + " needs data and conditions");
        }
        QueryBuilder.requireIdentifier(table);
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> sets = new ArrayList<>();
        data.forEach((column, value) -> {
            QueryBuilder.requireIdentifier(column);
            sets.add(column + " = :set_" + column);
            params.addValue("set_" + column, value);
        });
        String sql = "UPDATE " + table + " SET " + String.join(", ", sets) + whereClause(conditions, params);
        return jdbc.update(sql, params);
    }

    /**
     * 按条件删除，返回受影响行数；条件为空时拒绝执行
     */
    public int delete(String table, Map<String, ?> conditions) {
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("Delete from " + table + " needs conditions");
        }
        QueryBuilder.requireIdentifier(table);
        MapSqlParameterSource params = new MapSqlParameterSource();
        return jdbc.update("DELETE FROM " + table + whereClause(conditions, params), params);
    }

    /**
     * 执行任意带命名参数的语句；SELECT 返回行列表，其余返回空列表
     */
    public List<Map<String, Object>> runQuery(String sql, Map<String, ?> params) {
        if (sql.trim().toUpperCase().startsWith("SELECT")) {
            return jdbc.queryForList(sql, params);
        }
        int affected = jdbc.update(sql, params);
        log.debug("语句执行完成, 影响 {} 行", affected);
        return List.of();
    }

    public List<Map<String, Object>> select(QueryBuilder builder) {
        return jdbc.queryForList(builder.toSql(), builder.getParams());
    }

    public <T> List<T> select(QueryBuilder builder, Class<T> rowType) {
        return jdbc.query(builder.toSql(), builder.getParams(), BeanPropertyRowMapper.newInstance(rowType));
    }

    /**
     * 取第一行，没有结果时返回 null
     */
    public <T> T selectOne(QueryBuilder builder, Class<T> rowType) {
        List<T> rows = select(builder.limit(1), rowType);
        return rows.isEmpty() ? null : rows.get(0);
    }

    public long count(QueryBuilder builder) {
        Long total = jdbc.queryForObject(builder.countQuery(), builder.getParams(), Long.class);
        return total == null ? 0 : total;
    }

    public PageResult<Map<String, Object>> paginate(QueryBuilder builder, int page, int limit) {
        long total = count(builder);
        List<Map<String, Object>> rows = select(builder.limit(limit).offset(offsetOf(page, limit)));
        return PageResult.of(rows, page, limit, total);
    }

    public <T> PageResult<T> paginate(QueryBuilder builder, int page, int limit, Class<T> rowType) {
        long total = count(builder);
        List<T> rows = select(builder.limit(limit).offset(offsetOf(page, limit)), rowType);
        return PageResult.of(rows, page, limit, total);
    }

    /**
     * 页码从 1 开始；用 long 计算，避免大页码时 int 溢出成负数
     */
    static long offsetOf(int page, int limit) {
        return (long) (Math.max(page, 1) - 1) * limit;
    }

    private String whereClause(Map<String, ?> conditions, MapSqlParameterSource params) {
        List<String> parts = new ArrayList<>();
        conditions.forEach((column, value) -> {
            QueryBuilder.requireIdentifier(column);
            String param = "where_" + column.replace('.', '_');
            parts.add(column + " = :" + param);
            params.addValue(param, value);
        });
        return " WHERE " + String.join(" AND ", parts);
    }
}
