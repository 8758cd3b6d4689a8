package org.lupenghan.parser.statement;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * CREATE TABLE 括号中的一项：普通列、PRIMARY KEY 或 FOREIGN KEY 声明。
 */
@Value
@Builder
public class ColumnDefinition {

    public enum Kind {
        PLAIN,
        PRIMARY,
        FOREIGN
    }

    @Builder.Default
    Kind kind = Kind.PLAIN;

    // 普通列
    String name;
    DataType type;
    boolean notNull;
    int varlen;             // VARCHAR(n) / VARBINARY(n) 的 n，其余为 0

    // PRIMARY
    boolean unique;
    @Builder.Default
    List<String> primaryKey = List.of();

    // FOREIGN
    String referencedTable;
    @Builder.Default
    List<String> foreignKeySource = List.of();
    @Builder.Default
    List<String> foreignKeySink = List.of();

    public static ColumnDefinition column(String name, DataType type) {
        return ColumnDefinition.builder().name(name).type(type).build();
    }

    public static ColumnDefinition primaryKey(boolean unique, String... keys) {
        return ColumnDefinition.builder()
                .kind(Kind.PRIMARY)
                .unique(unique)
                .primaryKey(List.of(keys))
                .build();
    }

    public static ColumnDefinition foreignKey(List<String> source, String referencedTable, List<String> sink) {
        return ColumnDefinition.builder()
                .kind(Kind.FOREIGN)
                .foreignKeySource(source)
                .referencedTable(referencedTable)
                .foreignKeySink(sink)
                .build();
    }
}
