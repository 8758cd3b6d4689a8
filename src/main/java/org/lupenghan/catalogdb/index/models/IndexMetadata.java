package org.lupenghan.catalogdb.index.models;

import lombok.Value;
import org.lupenghan.catalogdb.catalog.models.IndexType;
import org.lupenghan.catalogdb.catalog.models.Schema;

/**
 * 交给索引引擎的建索引请求
 */
@Value
public class IndexMetadata {
    String name;
    IndexType indexType;
    Schema tupleSchema;     // 整行布局
    Schema keySchema;       // 键列投影
    boolean unique;
}
