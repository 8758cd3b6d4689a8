package org.lupenghan.query.validation;

import lombok.Value;

import java.util.List;

@Value
public class PrimaryKeyPlan implements TablePlan.Step {
    List<String> keys;      // 均已出现在之前的普通列中
    boolean unique;
}
