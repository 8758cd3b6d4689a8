package org.lupenghan.parser.statement;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 解析后的 CREATE 语句（不可变）。
 * TABLE 使用 columns；INDEX 使用 tableName / indexAttrs / unique；DATABASE 只用 name。
 */
@Value
@Builder(toBuilder = true)
public class CreateStatement {
    CreateType type;
    String name;
    boolean ifNotExists;

    @Builder.Default
    List<ColumnDefinition> columns = List.of();

    String tableName;
    List<String> indexAttrs;    // 为 null 表示语句未给出键列
    boolean unique;

    public static CreateStatement database(String name) {
        return CreateStatement.builder().type(CreateType.DATABASE).name(name).build();
    }

    public static CreateStatement table(String name, List<ColumnDefinition> columns) {
        return CreateStatement.builder().type(CreateType.TABLE).name(name).columns(columns).build();
    }

    public static CreateStatement index(String name, String tableName, boolean unique, List<String> indexAttrs) {
        return CreateStatement.builder()
                .type(CreateType.INDEX)
                .name(name)
                .tableName(tableName)
                .unique(unique)
                .indexAttrs(indexAttrs)
                .build();
    }
}
