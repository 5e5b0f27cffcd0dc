package utils;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import ef.EfValueTable;
import init.Config;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import solver.EfContext;
import values.ModelValueConverter;
import values.ModelValueStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableExporterTest {
    @TempDir
    Path tempDir;

    private EfContext ef;
    private Context ctx;
    private ModelValueStore store;
    private EfValueTable table;
    private Sort t;

    @BeforeEach
    void setUp() {
        ef = new EfContext();
        ctx = ef.getContext();
        store = new ModelValueStore(ef.getTerms());
        table = new EfValueTable(ef.getTerms(), store, new ModelValueConverter(ef.getTerms(), store));
        t = ctx.mkUninterpretedSort("T");
    }

    @AfterEach
    void tearDown() {
        Config.dumpValueTable = false;
        Config.valueTableDumpPath = "output/ef_value_table.json";
        ef.close();
    }

    private void fillTwoValues() {
        FuncDecl x1 = ctx.mkFuncDecl("x1", new Sort[0], t);
        FuncDecl x2 = ctx.mkFuncDecl("x2", new Sort[0], t);
        int a = store.intern(ctx.mkConst("Va", t));
        int b = store.intern(ctx.mkConst("Vb", t));
        table.fill(new FuncDecl[]{x1, x2}, new int[]{a, b});
    }

    @Test
    void writesOneJsonObjectPerSnapshot() throws IOException {
        fillTwoValues();
        Path out = tempDir.resolve("nested/dir/table.json");

        try (TableExporter exporter = new TableExporter(out.toString())) {
            exporter.writeSnapshot(table.snapshot());
            exporter.writeSnapshot(table.snapshot());
        }

        List<String> lines = Files.readAllLines(out);
        assertEquals(2, lines.size());
        JSONObject json = JSON.parseObject(lines.get(0));
        assertEquals("x1", json.getJSONObject("representatives").getString("Va"));
        assertEquals("x2", json.getJSONObject("representatives").getString("Vb"));
        assertEquals(0, json.getJSONObject("priorities").getIntValue("Va"));
        assertEquals(2, json.getJSONObject("types").getJSONArray("T").size());
    }

    @Test
    void fillDumpsTableWhenEnabled() throws IOException {
        Path out = tempDir.resolve("dump.json");
        Config.dumpValueTable = true;
        Config.valueTableDumpPath = out.toString();

        fillTwoValues();

        assertTrue(Files.exists(out));
        JSONObject json = JSON.parseObject(Files.readAllLines(out).get(0));
        assertEquals("x1", json.getJSONObject("representatives").getString("Va"));
    }
}
