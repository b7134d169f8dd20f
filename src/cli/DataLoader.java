package cli;

import domain.model.ArmorItem;
import infrastructure.io.ArmorReader;
import infrastructure.io.FileArmorReader;

import java.io.IOException;
import java.util.List;

/**
 * Loads armor databases for the CLI tools.
 *
 * <p>All file I/O errors are propagated as {@link IOException} for consistent error
 * handling across the CLI entry points. Stateless and thread-safe.
 */
public final class DataLoader {

    private final ArmorReader reader;

    public DataLoader() {
        this(new FileArmorReader());
    }

    /**
     * @param reader the reader used to parse armor sources
     */
    public DataLoader(ArmorReader reader) {
        this.reader = reader;
    }

    /**
     * Loads an armor database from a file.
     *
     * @param armorPath path to the armor database file
     * @return valid armor items in file order
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if armorPath is null or empty
     */
    public List<ArmorItem> loadArmors(String armorPath) throws IOException {
        if (armorPath == null || armorPath.trim().isEmpty()) {
            throw new IllegalArgumentException("Armor file path cannot be null or empty");
        }
        return reader.readArmors(armorPath);
    }
}
