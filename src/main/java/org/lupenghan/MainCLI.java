package org.lupenghan;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.catalogdb.catalog.Impl.CatalogImpl;
import org.lupenghan.catalogdb.catalog.interfaces.Catalog;
import org.lupenghan.catalogdb.catalog.snapshot.CatalogSnapshotStore;
import org.lupenghan.catalogdb.index.Impl.IndexFactoryImpl;
import org.lupenghan.catalogdb.storage.Impl.StorageManagerImpl;
import org.lupenghan.config.CatalogConfig;
import org.lupenghan.config.ConfigurationLoader;
import org.lupenghan.parser.SQLParser;
import org.lupenghan.parser.statement.CreateStatement;
import org.lupenghan.query.Impl.CreateExecutorImpl;
import org.lupenghan.query.interfaces.CreateExecutor;
import org.lupenghan.query.models.ExecutionResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

@Slf4j
public class MainCLI {

    private final CreateExecutor executor;
    private final CatalogSnapshotStore snapshotStore;
    private final PrintStream out;

    public MainCLI(CreateExecutor executor, CatalogSnapshotStore snapshotStore, PrintStream out) {
        this.executor = executor;
        this.snapshotStore = snapshotStore;
        this.out = out;
    }

    public void run(BufferedReader in) throws IOException {
        out.println("欢迎使用 CatalogDB。输入 CREATE 语句，.dump 查看目录，.save 保存目录，exit 退出。");

        String line;
        while (true) {
            out.print("\n> ");
            line = in.readLine();
            if (line == null) break;
            line = line.trim();
            if (line.equalsIgnoreCase("exit") || line.equalsIgnoreCase("quit")) break;
            if (line.isEmpty()) continue;
            handle(line);
        }

        out.println("再见！");
    }

    /**
     * 处理一行输入
     * @return 语句是否执行成功
     */
    public boolean handle(String line) {
        try {
            switch (line) {
                case ".dump" -> {
                    out.println(snapshotStore.toJson(executor.getCatalog().snapshot()));
                    return true;
                }
                case ".save" -> {
                    snapshotStore.save(executor.getCatalog().snapshot());
                    out.println("目录已保存");
                    return true;
                }
                default -> {
                    CreateStatement statement = SQLParser.parse(line);
                    ExecutionResult result = executor.run(statement);
                    if (result.isSuccess()) {
                        out.println("OK: " + result.getMessage());
                    } else {
                        out.println("FAILED [" + result.getErrorKind() + "]: " + result.getMessage());
                    }
                    return result.isSuccess();
                }
            }
        } catch (IllegalArgumentException e) {
            out.println("语法错误：" + e.getMessage());
            return false;
        } catch (IOException e) {
            log.error("目录读写失败", e);
            out.println("目录读写失败：" + e.getMessage());
            return false;
        }
    }

    public static void main(String[] args) throws Exception {
        CatalogConfig config = new ConfigurationLoader().loadConfiguration(args);

        // 初始化组件
        Catalog catalog = CatalogImpl.bootstrap(config.getDefaultDatabaseName());
        var storageManager = new StorageManagerImpl();
        var indexFactory = new IndexFactoryImpl(config.isIndexEngineEnabled());
        var snapshotStore = new CatalogSnapshotStore(config.getCatalogDir());
        CreateExecutor executor = new CreateExecutorImpl(catalog, storageManager, indexFactory, config);

        try {
            new MainCLI(executor, snapshotStore, System.out)
                    .run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        } finally {
            catalog.shutdown();
        }
    }
}
