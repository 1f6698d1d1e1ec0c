package de.mattis.arraybench.bench;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Beschreibt das Benchmark-Szenario, also <b>welches Zugriffsmuster</b>
 * während einer Ausführung gegen das Array läuft.
 *
 * <p>Der Katalog ist geschlossen. Die {@code MIXED_*}-Varianten tragen den Lese-Anteil in
 * Prozent im Namen ({@code MIXED_R70W30} = 70 % Reads, 30 % Writes) und zusätzlich als Feld
 * {@link #readPercent()}.</p>
 *
 * <p>Was genau jedes Szenario vorbereitet und misst, steht in {@link ScenarioEngine}.</p>
 */
public enum Scenario {
    INIT_ONLY,
    READ_UNWRITTEN,
    WRITE_SEQUENTIAL,
    WRITE_RANDOM,
    MIXED_R90W10(90),
    MIXED_R80W20(80),
    MIXED_R70W30(70),
    MIXED_R50W50(50),
    MIXED_R30W70(30),
    MIXED_R10W90(10),
    ADVERSARIAL_HOTSPOT;

    private final int readPercent;

    Scenario() {
        this(-1);
    }

    Scenario(int readPercent) {
        this.readPercent = readPercent;
    }

    /**
     * @return {@code true} für die {@code MIXED_*}-Familie
     */
    public boolean isMixed() {
        return readPercent >= 0;
    }

    /**
     * Lese-Anteil in Prozent.
     *
     * @return Wert in {@code [0, 100]}
     * @throws IllegalStateException wenn das Szenario keine {@code MIXED_*}-Variante ist
     */
    public int readPercent() {
        if (!isMixed()) {
            throw new IllegalStateException(name() + " has no read percentage");
        }
        return readPercent;
    }

    /**
     * Parst einen Szenario-Namen (exakt, Groß-/Kleinschreibung zählt).
     *
     * <p>Ein unbekannter Name ist ein fataler Konfigurationsfehler. Es wird bewusst nicht
     * still übersprungen.</p>
     *
     * @param raw Name, z. B. {@code "MIXED_R70W30"}
     * @return passendes Szenario
     * @throws IllegalArgumentException wenn der Name nicht im Katalog ist
     */
    public static Scenario fromName(String raw) {
        String name = raw == null ? "" : raw.trim();
        for (Scenario s : values()) {
            if (s.name().equals(name)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown scenario: " + raw + " (use: " + catalogue() + ")");
    }

    private static String catalogue() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining("|"));
    }
}
