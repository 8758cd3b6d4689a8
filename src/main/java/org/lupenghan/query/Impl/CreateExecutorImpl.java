package org.lupenghan.query.Impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.catalogdb.catalog.interfaces.Catalog;
import org.lupenghan.catalogdb.catalog.models.Column;
import org.lupenghan.catalogdb.catalog.models.Database;
import org.lupenghan.catalogdb.catalog.models.Index;
import org.lupenghan.catalogdb.catalog.models.IndexType;
import org.lupenghan.catalogdb.catalog.models.Schema;
import org.lupenghan.catalogdb.catalog.models.Table;
import org.lupenghan.catalogdb.index.interfaces.IndexFactory;
import org.lupenghan.catalogdb.index.models.IndexMetadata;
import org.lupenghan.catalogdb.index.models.PhysicalIndex;
import org.lupenghan.catalogdb.lock.models.LockGuard;
import org.lupenghan.catalogdb.storage.interfaces.StorageManager;
import org.lupenghan.config.CatalogConfig;
import org.lupenghan.config.ExistingTablePolicy;
import org.lupenghan.parser.statement.CreateStatement;
import org.lupenghan.query.interfaces.CreateExecutor;
import org.lupenghan.query.models.DdlException;
import org.lupenghan.query.models.ExecutionResult;
import org.lupenghan.query.validation.ConstraintValidator;
import org.lupenghan.query.validation.TablePlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Slf4j
public class CreateExecutorImpl implements CreateExecutor {
    @Getter
    private final Catalog catalog;
    private final IndexFactory indexFactory;
    private final CatalogConfig config;
    private final ConstraintValidator validator = new ConstraintValidator();
    private final TableBuilder tableBuilder;

    public CreateExecutorImpl(Catalog catalog, StorageManager storageManager, IndexFactory indexFactory, CatalogConfig config) {
        this.catalog = catalog;
        this.indexFactory = indexFactory;
        this.config = config;
        this.tableBuilder = new TableBuilder(storageManager, indexFactory, config.isRequirePhysicalIndex());
    }

    @Override
    public boolean execute(CreateStatement statement) {
        return run(statement).isSuccess();
    }

    @Override
    public ExecutionResult run(CreateStatement statement) {
        Objects.requireNonNull(statement, "statement");
        if (statement.getName() == null) {
            throw new IllegalStateException("CREATE " + statement.getType() + " without a name");
        }

        // 默认数据库必须存在
        Database database = catalog.getDatabase(config.getDefaultDatabaseName());
        if (database == null) {
            throw new IllegalStateException("default database missing: " + config.getDefaultDatabaseName());
        }

        try {
            return switch (statement.getType()) {
                case TABLE -> createTable(database, statement);
                case DATABASE -> createDatabase(statement);
                case INDEX -> createIndex(database, statement);
            };
        } catch (DdlException e) {
            log.error("CREATE {} {} rejected [{}]: {}", statement.getType(), statement.getName(), e.getKind(), e.getMessage());
            return ExecutionResult.failure(e.getKind(), e.getMessage());
        }
    }

    //===------------------------------------------------------------===//
    // TABLE
    //===------------------------------------------------------------===//

    private ExecutionResult createTable(Database database, CreateStatement statement) throws DdlException {
        String name = statement.getName();
        TablePlan plan = validator.validate(statement.getColumns(), database);

        if (database.getTable(name) != null) {
            switch (config.getExistingTablePolicy()) {
                case REJECT_IF_NOT_EXISTS -> {
                    // 旧行为：不带 IF NOT EXISTS 时继续构建，由 addTable 的重名检查拒绝
                    if (statement.isIfNotExists()) {
                        throw DdlException.conflict("Table already exists : " + name);
                    }
                }
                case STANDARD_SQL -> {
                    if (!statement.isIfNotExists()) {
                        throw DdlException.conflict("Table already exists : " + name);
                    }
                    log.info("表 {} 已存在，IF NOT EXISTS 跳过", name);
                    return ExecutionResult.success("Table already exists, skipped : " + name);
                }
            }
        }

        Table table = tableBuilder.build(name, plan, database.getId());

        boolean added;
        try (LockGuard ignored = database.getLock().write()) {
            added = database.addTable(table);
        }
        if (!added) {
            table.destroy();
            // 检查之后被其他建表者抢先提交
            if (config.getExistingTablePolicy() == ExistingTablePolicy.STANDARD_SQL && statement.isIfNotExists()) {
                log.info("表 {} 已存在，IF NOT EXISTS 跳过", name);
                return ExecutionResult.success("Table already exists, skipped : " + name);
            }
            throw DdlException.conflict("Could not create table : " + name);
        }

        log.info("Created table : {} ({} columns, {} constraints, {} indexes)", name,
                table.getColumns().size(), table.getConstraints().size(), table.getIndexes().size());
        return ExecutionResult.success("Created table : " + name);
    }

    //===------------------------------------------------------------===//
    // DATABASE
    //===------------------------------------------------------------===//

    private ExecutionResult createDatabase(CreateStatement statement) throws DdlException {
        String name = statement.getName();
        if (catalog.getDatabase(name) != null) {
            throw DdlException.conflict("Database already exists : " + name);
        }

        Database database = new Database(catalog.allocateDatabaseId(), name);
        boolean added;
        try (LockGuard ignored = catalog.getLock().write()) {
            added = catalog.addDatabase(database);
        }
        if (!added) {
            database.destroy();
            throw DdlException.conflict("Could not create database : " + name);
        }

        log.info("Created database : {}", name);
        return ExecutionResult.success("Created database : " + name);
    }

    //===------------------------------------------------------------===//
    // INDEX
    //===------------------------------------------------------------===//

    private ExecutionResult createIndex(Database database, CreateStatement statement) throws DdlException {
        String name = statement.getName();
        String tableName = statement.getTableName();
        Table table = tableName == null ? null : database.getTable(tableName);
        if (table == null) {
            throw DdlException.validation("Table does not exist : " + tableName);
        }

        List<String> attrs = statement.getIndexAttrs();
        if (attrs == null || attrs.isEmpty()) {
            throw DdlException.validation("No index attributes defined for index : " + name);
        }

        List<Integer> keyAttrs = new ArrayList<>();
        List<Column> keyColumns = new ArrayList<>();
        for (String key : attrs) {
            Column column = table.getColumn(key);
            if (column == null) {
                throw DdlException.validation("Index attribute does not exist in table : " + key + " " + tableName);
            }
            keyAttrs.add(column.getOffset());
            keyColumns.add(column);
        }

        // 物理索引
        Schema tupleSchema = table.getSchema();
        if (tupleSchema == null) {
            throw new IllegalStateException("committed table without physical table: " + tableName);
        }
        Schema keySchema = Schema.copySchema(tupleSchema, keyAttrs);
        IndexMetadata metadata = new IndexMetadata(name, IndexType.BTREE_MULTIMAP, tupleSchema, keySchema, statement.isUnique());

        Optional<PhysicalIndex> physicalIndex = indexFactory.createPhysicalIndex(metadata);
        if (physicalIndex.isEmpty()) {
            if (config.isRequirePhysicalIndex()) {
                throw DdlException.resource("Physical index unavailable : " + name);
            }
            log.warn("索引 {} 暂无物理索引，注册为待绑定", name);
        }

        Index index = new Index(name, IndexType.BTREE_MULTIMAP, statement.isUnique(), keyColumns);
        boolean added;
        try (LockGuard ignored = table.getLock().write()) {
            added = table.addIndex(index);
        }
        if (!added) {
            index.destroy();
            physicalIndex.ifPresent(PhysicalIndex::release);
            throw DdlException.conflict("Could not create index : " + name);
        }

        physicalIndex.ifPresent(index::bindPhysicalIndex);

        log.info("Created index : {} on {} {}", name, tableName, attrs);
        return ExecutionResult.success("Created index : " + name);
    }
}
