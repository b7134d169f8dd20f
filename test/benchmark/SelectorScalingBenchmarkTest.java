package benchmark;

import domain.model.ArmorItem;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SelectorScalingBenchmarkTest {

    @Test
    void testRun_OneRowPerSize() {
        List<ArmorItem> database = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            database.add(new ArmorItem("piece " + i, i, 10.0 * i));
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        int rows = SelectorScalingBenchmark.run(database, 6.0, 4, new PrintStream(buffer, true));

        String[] lines = new String(buffer.toByteArray(), StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(4, rows);
        assertEquals(5, lines.length);
        assertEquals(SelectorScalingBenchmark.CSV_HEADER, lines[0]);
        assertTrue(lines[1].startsWith("1,"));
        assertTrue(lines[4].startsWith("4,"));
    }

    @Test
    void testRun_StopsWhenDatabaseRunsOut() {
        List<ArmorItem> database = new ArrayList<>();
        database.add(new ArmorItem("only", 1.0, 5.0));
        database.add(new ArmorItem("zero", 1.0, 0.0));
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        int rows = SelectorScalingBenchmark.run(database, 10.0, 3, new PrintStream(buffer, true));

        assertEquals(1, rows);
    }
}
