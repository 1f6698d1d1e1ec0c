package de.mattis.arraybench.bench;

/**
 * Eine Array-Implementierung konnte für ein {@code N} nicht angelegt werden
 * (Größe nicht unterstützt oder Heap erschöpft).
 */
public class ArrayAllocationException extends RuntimeException {

    private final String implName;
    private final long n;

    public ArrayAllocationException(String implName, long n, Throwable cause) {
        super("cannot allocate " + implName + " with N=" + n + ": " + cause.getMessage(), cause);
        this.implName = implName;
        this.n = n;
    }

    public String implName() {
        return implName;
    }

    public long n() {
        return n;
    }
}
