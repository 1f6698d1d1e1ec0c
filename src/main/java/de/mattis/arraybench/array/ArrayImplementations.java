package de.mattis.arraybench.array;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongFunction;

/**
 * Registry aller Array-Implementierungen, die im Benchmark ausgewählt werden können.
 *
 * <p>Die Menge ist geschlossen: ein unbekannter Name ist ein Konfigurationsfehler und
 * führt zum Abbruch, bevor irgendein Run startet.</p>
 */
public final class ArrayImplementations {

    private static final Map<String, LongFunction<InitializableArray>> FACTORIES = new LinkedHashMap<>();

    static {
        FACTORIES.put(LongArray.NAME, LongArray::new);
        FACTORIES.put(ChunkedLongArray.NAME, ChunkedLongArray::new);
        FACTORIES.put(PairBlockInPlaceArray.NAME, PairBlockInPlaceArray::new);
        FACTORIES.put(QuadBlockInPlaceArray.NAME, QuadBlockInPlaceArray::new);
    }

    private ArrayImplementations() {}

    /**
     * @return alle bekannten Namen in Registrierungs-Reihenfolge
     */
    public static List<String> names() {
        return List.copyOf(FACTORIES.keySet());
    }

    /**
     * Prüft einen Namen gegen die Registry.
     *
     * @param name Implementierungs-Name (z. B. {@code java_long_array})
     * @return den getrimmten, gültigen Namen
     * @throws IllegalArgumentException wenn der Name unbekannt ist
     */
    public static String requireKnown(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (!FACTORIES.containsKey(trimmed)) {
            throw new IllegalArgumentException("Unknown implementation: " + name + " (use: " + String.join("|", names()) + ")");
        }
        return trimmed;
    }

    /**
     * Erzeugt eine frische, mit {@code 0} gefüllte Instanz.
     *
     * @param name Implementierungs-Name
     * @param n    Anzahl der Slots
     * @return neue Instanz
     * @throws IllegalArgumentException wenn der Name unbekannt ist oder die Implementierung {@code n} nicht unterstützt
     */
    public static InitializableArray create(String name, long n) {
        return FACTORIES.get(requireKnown(name)).apply(n);
    }
}
