package infrastructure.io;

import domain.model.ArmorItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileArmorReaderTest {

    @TempDir
    Path tempDir;

    private final FileArmorReader reader = new FileArmorReader();

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("armor.csv");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void testReadArmors_ValidRecords() throws IOException {
        Path file = write(
            "description^cost^defense\n" +
            "new enchanted helmet^12.5^40\n" +
            "rusty greaves^3^7.25\n");

        List<ArmorItem> armors = reader.readArmors(file.toString());

        assertEquals(2, armors.size());
        assertEquals("new enchanted helmet", armors.get(0).getDescription());
        assertEquals(12.5, armors.get(0).getCost());
        assertEquals(40.0, armors.get(0).getDefense());
        assertEquals("rusty greaves", armors.get(1).getDescription());
        assertEquals(7.25, armors.get(1).getDefense());
    }

    @Test
    void testReadArmors_HeaderIsSkippedEvenIfParseable() throws IOException {
        Path file = write("looks^1^2\nreal^3^4\n");
        List<ArmorItem> armors = reader.readArmors(file.toString());
        assertEquals(1, armors.size());
        assertEquals("real", armors.get(0).getDescription());
    }

    @Test
    void testReadArmors_DescriptionMayContainCommas() throws IOException {
        Path file = write("header\nshield, round, oak^8^11\n");
        List<ArmorItem> armors = reader.readArmors(file.toString());
        assertEquals("shield, round, oak", armors.get(0).getDescription());
    }

    @Test
    void testReadArmors_SkipsMalformedRecordsAndContinues() throws IOException {
        Path file = write(
            "description^cost^defense\n" +
            "ok one^1^1\n" +
            "too few^2\n" +
            "too^many^3^4\n" +
            "bad cost^abc^5\n" +
            "bad defense^5^\n" +
            "free^0^5\n" +
            "cursed^5^-3\n" +
            "^5^5\n" +
            "\n" +
            "ok two^2^2\n");

        List<ArmorItem> armors = reader.readArmors(file.toString());

        assertEquals(2, armors.size());
        assertEquals("ok one", armors.get(0).getDescription());
        assertEquals("ok two", armors.get(1).getDescription());
    }

    @Test
    void testReadArmors_HeaderOnlyGivesEmpty() throws IOException {
        Path file = write("description^cost^defense\n");
        assertTrue(reader.readArmors(file.toString()).isEmpty());
    }

    @Test
    void testReadArmors_MissingFileThrows() {
        String missing = tempDir.resolve("nope.csv").toString();
        assertThrows(IOException.class, () -> reader.readArmors(missing));
    }
}
