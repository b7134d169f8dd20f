package infrastructure.io;

import domain.model.ArmorItem;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * File-based implementation of {@link ArmorReader}.
 *
 * <p>Reads a UTF-8 text file line by line. The first line is a header and is skipped.
 *
 * <h3>Error handling</h3>
 * <ul>
 *   <li>Blank lines are ignored.</li>
 *   <li>Lines with a field count other than 3, unparseable numbers, an empty description,
 *       a non-positive cost or a negative defense produce a stderr warning and are skipped.</li>
 *   <li>A missing or unreadable file raises {@link IOException}.</li>
 * </ul>
 */
public final class FileArmorReader implements ArmorReader {

    /** Field separator; not a comma so descriptions may contain commas. */
    public static final char FIELD_SEPARATOR = '^';

    private static final int FIELD_COUNT = 3;

    /**
     * Reads all valid armor items from the given file path.
     *
     * @param filePath path to the armor database file
     * @return armor items in file order
     * @throws IOException if the file cannot be opened or read
     */
    @Override
    public List<ArmorItem> readArmors(String filePath) throws IOException {
        List<ArmorItem> armors = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(Paths.get(filePath), StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1) continue;  // Header row
                if (line.trim().isEmpty()) continue;

                ArmorItem armor = parseLine(line, lineNumber);
                if (armor != null) {
                    armors.add(armor);
                }
            }
        }

        return armors;
    }

    /**
     * Parses one {@code description^cost^defense} record.
     *
     * @param line       raw line from the file
     * @param lineNumber 1-based line number, for warnings
     * @return the parsed item, or {@code null} if the record is malformed
     */
    private ArmorItem parseLine(String line, int lineNumber) {
        List<String> fields = split(line);
        if (fields.size() != FIELD_COUNT) {
            warn(lineNumber, "want " + FIELD_COUNT + " fields but got " + fields.size());
            return null;
        }

        try {
            double cost = Double.parseDouble(fields.get(1).trim());
            double defense = Double.parseDouble(fields.get(2).trim());
            return new ArmorItem(fields.get(0), cost, defense);
        } catch (NumberFormatException e) {
            warn(lineNumber, "invalid number (" + e.getMessage() + ")");
        } catch (IllegalArgumentException e) {
            warn(lineNumber, e.getMessage());
        }
        return null;
    }

    /**
     * Splits on {@link #FIELD_SEPARATOR}, keeping empty fields (unlike {@code String.split}
     * with its trailing-empty removal and regex semantics).
     */
    private static List<String> split(String line) {
        List<String> fields = new ArrayList<>(FIELD_COUNT);
        int start = 0;
        int sep;
        while ((sep = line.indexOf(FIELD_SEPARATOR, start)) >= 0) {
            fields.add(line.substring(start, sep));
            start = sep + 1;
        }
        fields.add(line.substring(start));
        return fields;
    }

    private static void warn(int lineNumber, String reason) {
        System.err.println("Warning: Skipping armor record at line " + lineNumber + ": " + reason);
    }
}
