package org.lupenghan.catalogdb.catalog.models;

public enum ConstraintType {
    PRIMARY,
    FOREIGN
}
