package org.lupenghan.query.validation;

import lombok.Value;
import org.lupenghan.catalogdb.catalog.models.Column;
import org.lupenghan.catalogdb.catalog.models.Table;

import java.util.List;

@Value
public class ForeignKeyPlan implements TablePlan.Step {
    List<String> sourceKeys;        // 本表列名
    Table referencedTable;          // 已存在的被引用表
    List<Column> sinkColumns;       // 被引用表上已解析的列
}
