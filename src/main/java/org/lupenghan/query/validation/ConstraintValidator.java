package org.lupenghan.query.validation;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.catalogdb.catalog.models.Column;
import org.lupenghan.catalogdb.catalog.models.Database;
import org.lupenghan.catalogdb.catalog.models.Table;
import org.lupenghan.catalogdb.catalog.models.ValueType;
import org.lupenghan.parser.statement.ColumnDefinition;
import org.lupenghan.parser.statement.DataType;
import org.lupenghan.query.models.DdlException;

import java.util.ArrayList;
import java.util.List;

/**
 * 建表前的约束校验，不修改任何目录状态。
 *
 * 按声明顺序逐项检查，维护一个"到目前为止的普通列名"列表：
 * <ul>
 *   <li>PRIMARY：每个键名都必须已在列表中</li>
 *   <li>FOREIGN：源列必须已在列表中；被引用表必须已存在于数据库；汇列必须是被引用表上的列</li>
 *   <li>普通列：不能与列表中已有的名字重复，通过后追加到列表</li>
 * </ul>
 * 遇到第一个违规即抛出 {@link DdlException}。
 */
@Slf4j
public class ConstraintValidator {

    public TablePlan validate(List<ColumnDefinition> definitions, Database database) throws DdlException {
        List<String> columns = new ArrayList<>();
        List<TablePlan.Step> steps = new ArrayList<>();

        for (ColumnDefinition definition : definitions) {
            switch (definition.getKind()) {
                case PRIMARY -> steps.add(validatePrimaryKey(definition, columns));
                case FOREIGN -> steps.add(validateForeignKey(definition, columns, database));
                case PLAIN -> {
                    ColumnPlan column = validateColumn(definition, columns);
                    columns.add(column.getName());
                    steps.add(column);
                }
            }
        }

        if (columns.isEmpty()) {
            throw DdlException.validation("Table has no columns");
        }
        log.debug("建表计划校验通过：{} 列，{} 步", columns.size(), steps.size());
        return new TablePlan(steps);
    }

    private PrimaryKeyPlan validatePrimaryKey(ColumnDefinition definition, List<String> columns) throws DdlException {
        List<String> keys = definition.getPrimaryKey();
        if (keys == null || keys.isEmpty()) {
            throw DdlException.validation("Primary key :: empty key list");
        }
        for (String key : keys) {
            if (!columns.contains(key)) {
                throw DdlException.validation("Primary key :: column not in table : " + key);
            }
        }
        return new PrimaryKeyPlan(List.copyOf(keys), definition.isUnique());
    }

    private ForeignKeyPlan validateForeignKey(ColumnDefinition definition, List<String> columns,
                                              Database database) throws DdlException {
        List<String> source = definition.getForeignKeySource();
        List<String> sink = definition.getForeignKeySink();
        if (source == null || source.isEmpty() || sink == null || sink.isEmpty()) {
            throw DdlException.validation("Foreign key :: empty key list");
        }
        if (source.size() != sink.size()) {
            throw DdlException.validation("Foreign key :: " + source.size() + " source columns but "
                    + sink.size() + " sink columns");
        }

        // 校验源列
        for (String key : source) {
            if (!columns.contains(key)) {
                throw DdlException.validation("Foreign key :: source column not in table : " + key);
            }
        }

        // 校验被引用表及汇列
        String referencedName = definition.getReferencedTable();
        Table referenced = referencedName == null ? null : database.getTable(referencedName);
        if (referenced == null) {
            throw DdlException.validation("Foreign table does not exist : " + referencedName);
        }
        List<Column> sinkColumns = new ArrayList<>(sink.size());
        for (String key : sink) {
            Column column = referenced.getColumn(key);
            if (column == null) {
                throw DdlException.validation("Foreign key :: sink column not in foreign table "
                        + referencedName + " : " + key);
            }
            sinkColumns.add(column);
        }
        return new ForeignKeyPlan(List.copyOf(source), referenced, sinkColumns);
    }

    private ColumnPlan validateColumn(ColumnDefinition definition, List<String> columns) throws DdlException {
        String name = definition.getName();
        if (name == null) {
            throw new IllegalStateException("column definition without a name");
        }
        if (columns.contains(name)) {
            throw DdlException.validation("Duplicate column name : " + name);
        }
        DataType type = definition.getType();
        if (type == null) {
            throw DdlException.validation("Column has no type : " + name);
        }
        return new ColumnPlan(name, type.getValueType(), columnLength(definition),
                definition.isNotNull(), definition.getVarlen() != 0);
    }

    /**
     * 定长类型取其规范长度；CHAR 固定为 1；VARCHAR / VARBINARY 取声明长度
     */
    static int columnLength(ColumnDefinition definition) throws DdlException {
        DataType type = definition.getType();
        if (type == DataType.CHAR) {
            return 1;
        }
        ValueType valueType = type.getValueType();
        if (valueType.isVariableLength()) {
            if (definition.getVarlen() <= 0) {
                throw DdlException.validation("Variable length column needs a positive length : " + definition.getName());
            }
            return definition.getVarlen();
        }
        return valueType.getSize();
    }
}
