package infrastructure.io;

import domain.model.ArmorItem;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction for loading armor databases.
 *
 * <p>Implementations parse the physical format and produce the armor list the selectors
 * work on. The default file-based implementation is {@link FileArmorReader}.
 *
 * <h3>Expected format (default)</h3>
 * <pre>
 *   description^cost^defense        (header row, ignored)
 *   new enchanted helmet^12.5^40
 *   rusty greaves^3^7.25
 * </pre>
 * Fields are separated by {@code '^'} so descriptions may contain commas.
 *
 * @see FileArmorReader
 */
public interface ArmorReader {

    /**
     * Reads all valid armor items from the specified source.
     *
     * @param source source identifier (e.g., file path)
     * @return armor items in source order; never {@code null}
     * @throws IOException if the source cannot be opened or read
     */
    List<ArmorItem> readArmors(String source) throws IOException;
}
