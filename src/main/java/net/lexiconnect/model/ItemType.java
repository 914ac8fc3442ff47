package net.lexiconnect.model;

import java.util.HashMap;

/**
 * The values of the type attribute on FLEXText item elements that we understand.
 */
public enum ItemType {
    TXT("txt"),         // surface form
    CF("cf"),           // citation form
    GLS("gls"),         // gloss
    MSA("msa"),         // morphosyntactic analysis
    POS("pos"),         // part of speech
    PUNCT("punct"),     // punctuation
    SEGNUM("segnum"),   // segment number
    TITLE("title"),     // text title
    SOURCE("source"),   // text source
    COMMENT("comment"); // text comment

    private final String code;

    private static final HashMap<String, ItemType> byCode = new HashMap<>();
    static {
        for (ItemType t : values())
            byCode.put(t.code, t);
    }

    ItemType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * @param code - the raw type attribute
     * @return the item type, or null if the code is not one we handle
     */
    public static ItemType fromCode(String code) {
        if (code == null) return null;
        return byCode.get(code.trim());
    }
}
