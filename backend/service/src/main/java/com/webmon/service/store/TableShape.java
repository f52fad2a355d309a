package com.webmon.service.store;

import com.webmon.core.schema.PrimaryKey;
import com.webmon.core.schema.Unique;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class TableShape<T extends Record> {
    private final Class<T> type;
    private final List<Column> columns;
    private final Constructor<T> constructor;

    private TableShape(Class<T> type, List<Column> columns, Constructor<T> constructor) {
        this.type = type;
        this.columns = List.copyOf(columns);
        this.constructor = constructor;
    }

    public static <T extends Record> TableShape<T> of(Class<T> type) {
        RecordComponent[] components = type.getRecordComponents();
        if (components == null) {
            throw new IllegalArgumentException(type.getName() + " is not a record");
        }
        List<Column> columns = new ArrayList<>();
        int primaryKeys = 0;
        for (RecordComponent component : components) {
            Role role = Role.PLAIN;
            if (component.isAnnotationPresent(PrimaryKey.class)) {
                if (component.getType() != int.class && component.getType() != long.class) {
                    throw new IllegalArgumentException("@PrimaryKey " + component.getName() + " must be int or long");
                }
                role = Role.PRIMARY_KEY;
                primaryKeys++;
            } else if (component.isAnnotationPresent(Unique.class)) {
                role = Role.UNIQUE;
            }
            columns.add(new Column(component, snakeCase(component.getName()), sqlType(component.getType()), role));
        }
        if (primaryKeys > 1) {
            throw new IllegalArgumentException(type.getName() + " declares more than one @PrimaryKey");
        }
        Class<?>[] parameterTypes = Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);
        try {
            Constructor<T> constructor = type.getDeclaredConstructor(parameterTypes);
            return new TableShape<>(type, columns, constructor);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("No canonical constructor on " + type.getName(), e);
        }
    }

    public List<Column> insertColumns() {
        return columns.stream().filter(column -> column.role() != Role.PRIMARY_KEY).toList();
    }

    public boolean hasUniqueColumns() {
        return columns.stream().anyMatch(column -> column.role() == Role.UNIQUE);
    }

    public String createTableSql(String table) {
        String definitions = columns.stream()
                .map(Column::definition)
                .collect(Collectors.joining(", "));
        return "CREATE TABLE IF NOT EXISTS " + table + " (" + definitions + ")";
    }

    public String insertSql(String table) {
        List<Column> insertable = insertColumns();
        String names = insertable.stream().map(Column::name).collect(Collectors.joining(", "));
        String placeholders = insertable.stream().map(column -> "?").collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + table + " (" + names + ") VALUES (" + placeholders + ")";
        return hasUniqueColumns() ? sql + " ON CONFLICT DO NOTHING" : sql;
    }

    public String selectAllSql(String table) {
        String names = columns.stream().map(Column::name).collect(Collectors.joining(", "));
        String orderBy = columns.stream()
                .filter(column -> column.role() == Role.PRIMARY_KEY)
                .map(column -> " ORDER BY " + column.name())
                .findFirst()
                .orElse("");
        return "SELECT " + names + " FROM " + table + orderBy;
    }

    public List<Object> insertValues(T row) {
        List<Object> values = new ArrayList<>();
        for (Column column : insertColumns()) {
            values.add(toSql(column.read(row)));
        }
        return values;
    }

    public T fromRow(Map<String, Object> row) {
        Object[] args = new Object[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            args[i] = fromSql(row.get(column.name()), column.component().getType());
        }
        try {
            return constructor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw new StorageException("Row does not form a valid " + type.getSimpleName() + ": " + row, e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new StorageException("Cannot build " + type.getSimpleName(), e);
        }
    }

    static String snakeCase(String name) {
        StringBuilder out = new StringBuilder();
        for (char c : name.toCharArray()) {
            if (Character.isUpperCase(c)) {
                out.append('_').append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    static String sqlType(Class<?> javaType) {
        if (javaType == String.class) {
            return "VARCHAR";
        }
        if (javaType == int.class || javaType == Integer.class || javaType.isEnum()) {
            return "INTEGER";
        }
        if (javaType == long.class || javaType == Long.class) {
            return "BIGINT";
        }
        if (javaType == double.class || javaType == Double.class) {
            return "DOUBLE PRECISION";
        }
        if (javaType == boolean.class || javaType == Boolean.class) {
            return "BOOLEAN";
        }
        if (javaType == Instant.class) {
            return "TIMESTAMP WITH TIME ZONE";
        }
        throw new IllegalArgumentException("No column type for " + javaType.getName());
    }

    private static Object toSql(Object value) {
        if (value instanceof Enum<?> constant) {
            return constant.ordinal();
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        return value;
    }

    private static Object fromSql(Object value, Class<?> javaType) {
        if (javaType == String.class) {
            return value == null ? "" : value.toString();
        }
        if (javaType == int.class || javaType == Integer.class) {
            return value == null ? 0 : ((Number) value).intValue();
        }
        if (javaType == long.class || javaType == Long.class) {
            return value == null ? 0L : ((Number) value).longValue();
        }
        if (javaType == double.class || javaType == Double.class) {
            return value == null ? 0.0 : ((Number) value).doubleValue();
        }
        if (javaType == boolean.class || javaType == Boolean.class) {
            return value != null && (Boolean) value;
        }
        if (javaType.isEnum()) {
            Object[] constants = javaType.getEnumConstants();
            int ordinal = value == null ? 0 : ((Number) value).intValue();
            if (ordinal < 0 || ordinal >= constants.length) {
                throw new StorageException("Stored value " + ordinal + " is not a " + javaType.getSimpleName());
            }
            return constants[ordinal];
        }
        if (javaType == Instant.class) {
            if (value == null) {
                return Instant.EPOCH;
            }
            if (value instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            if (value instanceof Timestamp timestamp) {
                return timestamp.toInstant();
            }
            return Instant.parse(value.toString());
        }
        throw new IllegalArgumentException("No conversion for " + javaType.getName());
    }

    public enum Role {
        PRIMARY_KEY,
        UNIQUE,
        PLAIN
    }

    public record Column(RecordComponent component, String name, String sqlType, Role role) {
        String definition() {
            return switch (role) {
                case PRIMARY_KEY -> name + " " + sqlType + " GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";
                case UNIQUE -> name + " " + sqlType + " NOT NULL UNIQUE";
                case PLAIN -> name + " " + sqlType;
            };
        }

        Object read(Record row) {
            try {
                return component.getAccessor().invoke(row);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot read " + name + " from " + row, e);
            }
        }
    }
}
