package org.lupenghan;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lupenghan.catalogdb.catalog.Impl.CatalogImpl;
import org.lupenghan.catalogdb.catalog.snapshot.CatalogSnapshotStore;
import org.lupenghan.catalogdb.index.Impl.IndexFactoryImpl;
import org.lupenghan.catalogdb.storage.Impl.StorageManagerImpl;
import org.lupenghan.config.CatalogConfig;
import org.lupenghan.query.Impl.CreateExecutorImpl;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import javax.xml.parsers.DocumentBuilderFactory;

import org.w3c.dom.Document;
import org.w3c.dom.NodeList;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class MainCLITest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private CatalogImpl catalog;
    private ByteArrayOutputStream buffer;
    private MainCLI cli;
    private File catalogDir;

    @Before
    public void setUp() throws Exception {
        catalog = CatalogImpl.bootstrap(CatalogConfig.DEFAULT_DB_NAME);
        catalogDir = folder.newFolder("catalog");
        buffer = new ByteArrayOutputStream();
        cli = new MainCLI(
                new CreateExecutorImpl(catalog, new StorageManagerImpl(), new IndexFactoryImpl(false), CatalogConfig.defaults()),
                new CatalogSnapshotStore(catalogDir.getPath()),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @After
    public void tearDown() {
        catalog.shutdown();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testHandleStatements() {
        assertTrue(cli.handle("CREATE TABLE orders (id INT, cust_id INT, PRIMARY KEY (id))"));
        assertFalse(cli.handle("CREATE TABLE bad (amount INT, amount INT)"));
        assertFalse(cli.handle("DROP TABLE orders"));

        String out = output();
        assertTrue(out.contains("OK: Created table : orders"));
        assertTrue(out.contains("FAILED [VALIDATION]"));
        assertTrue(out.contains("语法错误"));
    }

    @Test
    public void testRunSessionWithDumpAndSave() throws Exception {
        String session = String.join("\n",
                "CREATE DATABASE sales;",
                "CREATE TABLE orders (id INT, cust_id INT, PRIMARY KEY (id));",
                "CREATE INDEX idx_cust ON orders (cust_id);",
                ".dump",
                ".save",
                "exit");

        cli.run(new BufferedReader(new StringReader(session)));

        String out = output();
        assertTrue(out.contains("Created database : sales"));
        assertTrue(out.contains("Created index : idx_cust"));
        assertTrue(out.contains("\"idx_cust\""));
        assertTrue(new File(catalogDir, "sales" + CatalogSnapshotStore.FILE_SUFFIX).exists());
        assertTrue(new File(catalogDir, "default" + CatalogSnapshotStore.FILE_SUFFIX).exists());
    }

    @Test
    public void testLogOutputGoesToStderr() throws Exception {
        // 日志不能混进命令行的 OK / FAILED 输出
        try (InputStream in = MainCLI.class.getResourceAsStream("/logback.xml")) {
            assertNotNull(in);
            Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(in);
            NodeList targets = doc.getElementsByTagName("target");
            assertEquals(1, targets.getLength());
            assertEquals("System.err", targets.item(0).getTextContent().trim());
        }
    }
}
