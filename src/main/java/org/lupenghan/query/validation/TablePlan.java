package org.lupenghan.query.validation;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 校验通过的建表计划，按声明顺序保存每一步。
 * 构建阶段只消费计划，不会再因引用问题失败。
 */
public class TablePlan {

    /**
     * 计划中的一步：{@link ColumnPlan}、{@link PrimaryKeyPlan} 或 {@link ForeignKeyPlan}
     */
    public interface Step {
    }

    @Getter
    private final List<Step> steps;

    public TablePlan(List<Step> steps) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public List<ColumnPlan> getColumns() {
        List<ColumnPlan> columns = new ArrayList<>();
        for (Step step : steps) {
            if (step instanceof ColumnPlan column) {
                columns.add(column);
            }
        }
        return columns;
    }
}
