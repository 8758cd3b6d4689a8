package org.lupenghan.query.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.catalogdb.catalog.models.Column;
import org.lupenghan.catalogdb.catalog.models.ColumnInfo;
import org.lupenghan.catalogdb.catalog.models.Constraint;
import org.lupenghan.catalogdb.catalog.models.Index;
import org.lupenghan.catalogdb.catalog.models.IndexType;
import org.lupenghan.catalogdb.catalog.models.Schema;
import org.lupenghan.catalogdb.catalog.models.Table;
import org.lupenghan.catalogdb.index.interfaces.IndexFactory;
import org.lupenghan.catalogdb.index.models.IndexMetadata;
import org.lupenghan.catalogdb.index.models.PhysicalIndex;
import org.lupenghan.catalogdb.lock.models.LockGuard;
import org.lupenghan.catalogdb.storage.interfaces.StorageManager;
import org.lupenghan.catalogdb.storage.models.PhysicalTable;
import org.lupenghan.query.models.DdlException;
import org.lupenghan.query.validation.ColumnPlan;
import org.lupenghan.query.validation.ForeignKeyPlan;
import org.lupenghan.query.validation.PrimaryKeyPlan;
import org.lupenghan.query.validation.TablePlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 按校验过的 {@link TablePlan} 构建一张尚未挂到数据库上的表。
 * 任何一步失败都会销毁这张表（连同已拿到的物理句柄）后再抛出。
 */
@Slf4j
class TableBuilder {
    private final StorageManager storageManager;
    private final IndexFactory indexFactory;
    private final boolean requirePhysicalIndex;

    TableBuilder(StorageManager storageManager, IndexFactory indexFactory, boolean requirePhysicalIndex) {
        this.storageManager = storageManager;
        this.indexFactory = indexFactory;
        this.requirePhysicalIndex = requirePhysicalIndex;
    }

    Table build(String tableName, TablePlan plan, int databaseId) throws DdlException {
        Table table = new Table(tableName);
        try (LockGuard ignored = table.getLock().write()) {
            List<ColumnInfo> physicalColumns = addSteps(table, plan);

            // 物理表
            Schema schema = new Schema(physicalColumns);
            PhysicalTable physicalTable = storageManager.createPhysicalTable(databaseId, schema);
            table.setPhysicalTable(physicalTable);

            bindPrimaryIndexes(table, schema);
        } catch (DdlException | RuntimeException e) {
            table.destroy();
            throw e;
        }
        return table;
    }

    private List<ColumnInfo> addSteps(Table table, TablePlan plan) throws DdlException {
        List<ColumnInfo> physicalColumns = new ArrayList<>();
        int offset = 0;
        int constraintId = 0;
        int indexId = 0;

        for (TablePlan.Step step : plan.getSteps()) {
            if (step instanceof PrimaryKeyPlan primary) {
                List<Column> columns = resolve(table, primary.getKeys());
                Index index = new Index("INDEX_" + indexId++, IndexType.BTREE_MULTIMAP, primary.isUnique(), columns);
                Constraint constraint = Constraint.primary("PK_" + constraintId++, index);
                if (!table.addConstraint(constraint)) {
                    throw DdlException.conflict("Could not create constraint : " + constraint.getName());
                }
                if (!table.addIndex(index)) {
                    throw DdlException.conflict("Could not create index : " + index.getName());
                }
            } else if (step instanceof ForeignKeyPlan foreign) {
                List<Column> sourceColumns = resolve(table, foreign.getSourceKeys());
                Constraint constraint = Constraint.foreign("FK_" + constraintId++,
                        foreign.getReferencedTable(), sourceColumns, foreign.getSinkColumns());
                if (!table.addConstraint(constraint)) {
                    throw DdlException.conflict("Could not create constraint : " + constraint.getName());
                }
            } else if (step instanceof ColumnPlan plain) {
                Column column = new Column(plain.getName(), plain.getType(), offset++, plain.getLength(), plain.isNotNull());
                physicalColumns.add(new ColumnInfo(plain.getType(), plain.getLength(), plain.getName(),
                        !plain.isNotNull(), plain.isVariableLength()));
                if (!table.addColumn(column)) {
                    throw DdlException.conflict("Could not create column : " + column.getName());
                }
            } else {
                throw new IllegalStateException("unknown plan step: " + step);
            }
        }
        return physicalColumns;
    }

    // 主键索引在物理表就绪后再向索引引擎申请句柄
    private void bindPrimaryIndexes(Table table, Schema schema) throws DdlException {
        for (Index index : table.getIndexes()) {
            List<Integer> keyAttrs = new ArrayList<>();
            for (Column column : index.getKeyColumns()) {
                keyAttrs.add(column.getOffset());
            }
            IndexMetadata metadata = new IndexMetadata(index.getName(), index.getIndexType(), schema,
                    Schema.copySchema(schema, keyAttrs), index.isUnique());
            Optional<PhysicalIndex> physical = indexFactory.createPhysicalIndex(metadata);
            if (physical.isPresent()) {
                index.bindPhysicalIndex(physical.get());
            } else if (requirePhysicalIndex) {
                throw DdlException.resource("Physical index unavailable : " + table.getName() + "." + index.getName());
            } else {
                log.warn("表 {} 的主键索引 {} 暂无物理索引，等待绑定", table.getName(), index.getName());
            }
        }
    }

    private static List<Column> resolve(Table table, List<String> names) {
        List<Column> columns = new ArrayList<>(names.size());
        for (String name : names) {
            Column column = table.getColumn(name);
            if (column == null) {
                // 计划已校验过，走到这里说明计划与表不一致
                throw new IllegalStateException("planned column missing from table " + table.getName() + " : " + name);
            }
            columns.add(column);
        }
        return columns;
    }
}
