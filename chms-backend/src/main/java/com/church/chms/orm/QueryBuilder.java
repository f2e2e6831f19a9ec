package com.church.chms.orm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 可组合的 SELECT 构建器：字段、连接、条件、分组、排序与分页。
 * <p>
 * 所有取值都以命名参数的形式绑定，标识符 (表名、列名) 在拼接前做格式校验。
 * 构建器本身不执行 SQL，交给 {@link OrmTemplate} 运行。
 */
public class QueryBuilder {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private static final Set<String> OPERATORS = Set.of("=", "!=", "<", "<=", ">", ">=", "LIKE");

    private final String baseTable;
    private final String baseAlias;
    private final List<String> fields = new ArrayList<>();
    private final List<String> joins = new ArrayList<>();
    private final List<String> conditions = new ArrayList<>();
    private final List<String> groupBy = new ArrayList<>();
    private final List<String> orderBy = new ArrayList<>();
    private final Map<String, Object> params = new LinkedHashMap<>();
    private int limit;
    private long offset;

    private QueryBuilder(String baseTable, String baseAlias) {
        this.baseTable = requireIdentifier(baseTable);
        this.baseAlias = baseAlias == null ? null : requireIdentifier(baseAlias);
    }

    public static QueryBuilder from(String table) {
        return new QueryBuilder(table, null);
    }

    public static QueryBuilder from(String table, String alias) {
        return new QueryBuilder(table, alias);
    }

    /**
     * 校验 SQL 标识符，非法时抛出 IllegalArgumentException
     */
    public static String requireIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        }
        return identifier;
    }

    /**
     * 选择字段；表达式原样输出 (如 "COUNT(gm.mbr_id) AS member_count")，只能由代码写死传入
     */
    public QueryBuilder select(String... expressions) {
        Collections.addAll(fields, expressions);
        return this;
    }

    public QueryBuilder join(String table, String alias, String on) {
        return addJoin("JOIN", table, alias, on);
    }

    public QueryBuilder leftJoin(String table, String alias, String on) {
        return addJoin("LEFT JOIN", table, alias, on);
    }

    private QueryBuilder addJoin(String type, String table, String alias, String on) {
        joins.add(type + " " + requireIdentifier(table) + " " + requireIdentifier(alias) + " ON " + on);
        return this;
    }

    /**
     * column op :param 形式的条件
     */
    public QueryBuilder where(String column, String operator, Object value) {
        String op = operator.toUpperCase();
        if (!OPERATORS.contains(op)) {
            throw new IllegalArgumentException("Unsupported operator: " + operator);
        }
        String param = nextParamName(requireIdentifier(column));
        conditions.add(column + " " + op + " :" + param);
        params.put(param, value);
        return this;
    }

    public QueryBuilder where(String column, Object value) {
        return where(column, "=", value);
    }

    /**
     * 仅在取值非空时追加条件，用于可选的过滤器
     */
    public QueryBuilder whereIfPresent(String column, String operator, Object value) {
        if (value == null || (value instanceof String && ((String) value).isBlank())) {
            return this;
        }
        return where(column, operator, value);
    }

    public QueryBuilder whereIfPresent(String column, Object value) {
        return whereIfPresent(column, "=", value);
    }

    /**
     * 原始谓词 (如 "c.deleted = FALSE")，可带命名参数
     */
    public QueryBuilder whereRaw(String predicate) {
        conditions.add(predicate);
        return this;
    }

    public QueryBuilder whereRaw(String predicate, Map<String, ?> namedParams) {
        conditions.add(predicate);
        params.putAll(namedParams);
        return this;
    }

    public QueryBuilder groupBy(String... columns) {
        for (String column : columns) {
            groupBy.add(requireIdentifier(column));
        }
        return this;
    }

    /**
     * 排序方向只认 DESC，其余一律视为 ASC
     */
    public QueryBuilder orderBy(String column, String direction) {
        String dir = "DESC".equalsIgnoreCase(direction == null ? "" : direction.trim()) ? "DESC" : "ASC";
        orderBy.add(requireIdentifier(column) + " " + dir);
        return this;
    }

    public QueryBuilder orderBy(String column) {
        return orderBy(column, "ASC");
    }

    public QueryBuilder limit(int limit) {
        this.limit = limit;
        return this;
    }

    public QueryBuilder offset(long offset) {
        this.offset = offset;
        return this;
    }

    public String toSql() {
        StringBuilder sql = new StringBuilder(baseQuery());
        if (!orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderBy));
        }
        if (limit > 0) {
            sql.append(" LIMIT ").append(limit);
            if (offset > 0) {
                sql.append(" OFFSET ").append(offset);
            }
        }
        return sql.toString();
    }

    /**
     * 与当前查询同条件的计数语句，不含排序与分页
     */
    public String countQuery() {
        return "SELECT COUNT(*) FROM (" + baseQuery() + ") t";
    }

    public Map<String, Object> getParams() {
        return Collections.unmodifiableMap(params);
    }

    private String baseQuery() {
        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append(fields.isEmpty() ? "*" : String.join(", ", fields));
        sql.append(" FROM ").append(baseTable);
        if (baseAlias != null) {
            sql.append(' ').append(baseAlias);
        }
        for (String join : joins) {
            sql.append(' ').append(join);
        }
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupBy));
        }
        return sql.toString();
    }

    private String nextParamName(String column) {
        String base = column.replace('.', '_');
        String name = base;
        int i = 1;
        while (params.containsKey(name)) {
            name = base + "_" + i++;
        }
        return name;
    }
}
