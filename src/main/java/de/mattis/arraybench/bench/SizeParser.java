package de.mattis.arraybench.bench;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Parst Größenangaben wie {@code "10k,2.5m,1g"} in Array-Größen.
 *
 * <p>Regeln:</p>
 * <ul>
 *   <li>Einträge sind durch Kommas getrennt, Whitespace um einen Eintrag wird ignoriert.</li>
 *   <li>Optionales Suffix: {@code k/K} (×1e3), {@code m/M} (×1e6), {@code g/G} (×1e9).</li>
 *   <li>Dezimalzahlen sind erlaubt, das Ergebnis wird Richtung 0 abgeschnitten.</li>
 *   <li>Leere, nicht parsebare oder nicht positive Einträge werden still verworfen.</li>
 * </ul>
 */
public final class SizeParser {

    public static final List<Long> DEFAULT_SIZES = List.of(10_000L, 100_000L, 1_000_000L);

    private static final BigDecimal MAX_SIZE = BigDecimal.valueOf(Long.MAX_VALUE);

    private SizeParser() {}

    /**
     * @param raw Komma-Liste (kann null sein)
     * @return alle gültigen Größen in Eingabe-Reihenfolge, evtl. leer
     */
    public static List<Long> parse(String raw) {
        List<Long> out = new ArrayList<>();
        if (raw == null) return out;

        for (String part : raw.split(",")) {
            String tok = part.trim();
            if (tok.isEmpty()) continue;

            long mult = 1;
            char last = tok.charAt(tok.length() - 1);
            switch (last) {
                case 'k', 'K' -> mult = 1_000L;
                case 'm', 'M' -> mult = 1_000_000L;
                case 'g', 'G' -> mult = 1_000_000_000L;
                default -> { }
            }
            if (mult != 1) {
                tok = tok.substring(0, tok.length() - 1).trim();
            }

            Long value = toSize(tok, mult);
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }

    /**
     * Wie {@link #parse(String)}, fällt aber auf {@link #DEFAULT_SIZES} zurück, wenn nichts Gültiges übrig bleibt.
     *
     * @param raw Komma-Liste (kann null sein)
     * @return nie leere Liste von Größen
     */
    public static List<Long> parseOrDefault(String raw) {
        List<Long> sizes = parse(raw);
        return sizes.isEmpty() ? DEFAULT_SIZES : sizes;
    }

    private static Long toSize(String number, long mult) {
        if (number.isEmpty()) return null;
        try {
            BigDecimal scaled = new BigDecimal(number).multiply(BigDecimal.valueOf(mult));
            if (scaled.compareTo(BigDecimal.ONE) < 0 || scaled.compareTo(MAX_SIZE) > 0) return null;
            return scaled.longValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
