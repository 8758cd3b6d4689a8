package org.lupenghan.catalogdb.catalog.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 把目录快照写成 JSON 文件，每个数据库一个 {@code <name>.catalog.json}。
 * 只做元数据导出和读回，不参与 DDL 的执行路径。
 */
@Slf4j
public class CatalogSnapshotStore {
    public static final String FILE_SUFFIX = ".catalog.json";

    private final Path catalogDir;
    private final ObjectMapper mapper = new ObjectMapper();

    public CatalogSnapshotStore(String catalogDir) throws IOException {
        this.catalogDir = Paths.get(catalogDir);
        Files.createDirectories(this.catalogDir);
    }

    /**
     * 覆盖写入快照。目录中不属于本次快照的旧数据库文件会被删除，
     * 保证 {@link #load()} 读回的正是这次保存的内容。
     */
    public void save(CatalogSnapshot snapshot) throws IOException {
        Set<String> written = new HashSet<>();
        for (DatabaseSnapshot database : snapshot.getDatabases()) {
            String fileName = database.getName() + FILE_SUFFIX;
            mapper.writerWithDefaultPrettyPrinter().writeValue(catalogDir.resolve(fileName).toFile(), database);
            written.add(fileName);
        }
        File[] existing = catalogDir.toFile().listFiles((d, name) -> name.endsWith(FILE_SUFFIX));
        if (existing != null) {
            for (File file : existing) {
                if (!written.contains(file.getName())) {
                    Files.delete(file.toPath());
                    log.info("删除过期快照文件 {}", file.getName());
                }
            }
        }
        log.info("目录快照已保存到 {}，共 {} 个数据库", catalogDir, snapshot.getDatabases().size());
    }

    /**
     * 读回目录下所有快照文件，按数据库ID排序
     */
    public CatalogSnapshot load() throws IOException {
        File[] files = catalogDir.toFile().listFiles((d, name) -> name.endsWith(FILE_SUFFIX));
        List<DatabaseSnapshot> databases = new ArrayList<>();
        if (files != null) {
            Arrays.sort(files);
            for (File file : files) {
                databases.add(mapper.readValue(file, DatabaseSnapshot.class));
            }
        }
        databases.sort(Comparator.comparingInt(DatabaseSnapshot::getId));
        return new CatalogSnapshot(databases);
    }

    public String toJson(CatalogSnapshot snapshot) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
    }
}
