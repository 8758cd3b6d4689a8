package org.lupenghan.query.interfaces;

import org.lupenghan.catalogdb.catalog.interfaces.Catalog;
import org.lupenghan.parser.statement.CreateStatement;
import org.lupenghan.query.models.ExecutionResult;

/**
 * CREATE TABLE / DATABASE / INDEX 的执行入口。
 * 每条语句独立执行：成功则提交到目录，失败则目录保持调用前的状态。
 */
public interface CreateExecutor {

    /**
     * @return 提交成功返回 true，任何拒绝或失败返回 false
     */
    boolean execute(CreateStatement statement);

    /**
     * 与 {@link #execute} 相同，但返回失败种类和原因
     */
    ExecutionResult run(CreateStatement statement);

    Catalog getCatalog();
}
