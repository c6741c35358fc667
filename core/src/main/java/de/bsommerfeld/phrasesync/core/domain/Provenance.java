package de.bsommerfeld.phrasesync.core.domain;

/**
 * Origin of a stored translation.
 *
 * <p>
 * {@link #MANUAL} translations were corrected by a human and are protected
 * from being overwritten by the sync path. The only legal transition is
 * {@code AUTOMATIC -> MANUAL}, performed by an explicit operator action.
 *
 * <p>
 * The persisted form keeps the values written by earlier tooling
 * ({@code azure} / {@code manual}) so existing databases stay readable.
 */
public enum Provenance {

    AUTOMATIC("azure"),
    MANUAL("manual");

    private final String storageValue;

    Provenance(String storageValue) {
        this.storageValue = storageValue;
    }

    public String storageValue() {
        return storageValue;
    }

    /**
     * Resolves the persisted string back to a provenance.
     *
     * @throws IllegalArgumentException if the value is not a known provenance
     */
    public static Provenance fromStorageValue(String value) {
        for (Provenance p : values()) {
            if (p.storageValue.equals(value)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown provenance: " + value);
    }
}
