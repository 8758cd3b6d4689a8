package org.lupenghan.parser.statement;

public enum CreateType {
    TABLE,
    DATABASE,
    INDEX
}
