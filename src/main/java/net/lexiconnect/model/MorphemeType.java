package net.lexiconnect.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Locale;

/**
 * Lists the grammatical classes a morpheme can have.
 */
public enum MorphemeType {
    STEM("stem"),
    PREFIX("prefix"),
    SUFFIX("suffix"),
    INFIX("infix"),
    CIRCUMFIX("circumfix"),
    ROOT("root"),
    CLITIC("clitic"),
    REDUP("redup"),
    OTHER("other");

    private final String value;

    // FLEx writes a few informal variants of the type names
    private static final HashMap<String, MorphemeType> flexTypes = new HashMap<>();
    static {
        for (MorphemeType t : values())
            flexTypes.put(t.value, t);
        flexTypes.put("proclitic", CLITIC);
        flexTypes.put("enclitic", CLITIC);
        flexTypes.put("reduplication", REDUP);
    }

    MorphemeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }

    /**
     * Maps the type attribute of a FLEXText morph element onto a morpheme type.
     *
     * @param flexType - the attribute value, possibly null
     * @return the matching type, or STEM if the value is absent or unrecognized
     */
    public static MorphemeType fromFlexType(String flexType) {
        if (flexType == null) return STEM;
        MorphemeType found = flexTypes.get(flexType.trim().toLowerCase(Locale.ROOT));
        return found == null ? STEM : found;
    }

    /**
     * Like {@link #fromFlexType(String)}, but for values read back from storage, where
     * an absent type stays absent.
     */
    public static MorphemeType fromStoredValue(String stored) {
        if (stored == null || stored.trim().isEmpty()) return null;
        return fromFlexType(stored);
    }
}
