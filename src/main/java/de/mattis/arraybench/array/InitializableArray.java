package de.mattis.arraybench.array;

/**
 * Fixe, zufällig adressierbare Sequenz von {@code N} vorzeichenbehafteten 64-Bit-Werten.
 *
 * <p>Das ist die Abstraktion, gegen die alle Benchmark-Szenarien laufen. Die Szenarien kennen
 * nur dieses Interface, dadurch kann die Speicher-Darstellung (ein Array, Pages, ...)
 * ausgetauscht werden, ohne die Mess-Logik anzufassen.</p>
 *
 * <p>Vertrag für alle Implementierungen:</p>
 * <ul>
 *   <li>{@code N} ist nach dem Konstruktor fix und ändert sich nie.</li>
 *   <li>Nach dem Konstruktor sind alle Slots {@code 0}.</li>
 *   <li>{@link #read(long)} und {@link #write(long, long)} sind O(1), {@link #init(long)} ist O(N).</li>
 *   <li>Ein {@code write} ist sofort für das nächste {@code read} sichtbar (kein Puffern, kein Umsortieren).</li>
 *   <li>Indizes außerhalb von {@code [0, N)} sind ein Fehler des Aufrufers. Die Implementierung
 *       muss das nicht selbst prüfen.</li>
 * </ul>
 */
public interface InitializableArray {

    /**
     * Setzt alle Slots in Index-Reihenfolge auf {@code value}.
     *
     * @param value neuer Wert für jeden Slot
     * @return Dauer des Durchlaufs in Nanosekunden
     */
    long init(long value);

    /**
     * @param index Slot im Bereich {@code [0, N)}
     * @return aktueller Wert des Slots
     */
    long read(long index);

    /**
     * @param index Slot im Bereich {@code [0, N)}
     * @param value neuer Wert
     */
    void write(long index, long value);

    /**
     * @return Anzahl der Slots {@code N}
     */
    long size();

    /**
     * Name der Implementierung, so wie er in der Spalte {@code impl_name} exportiert wird.
     *
     * @return stabiler Implementierungs-Name
     */
    String name();
}
