package com.eyelevel.bordereaux.model.canonical;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * ISO 4217 codes accepted in the {@code currency} canonical field, with the symbols and names partners use for
 * them.
 */
public enum CurrencyCode {
    USD("$", "US$", "US DOLLAR", "US DOLLARS", "DOLLAR", "DOLLARS"),
    EUR("€", "EURO", "EUROS"),
    GBP("£", "POUND", "POUNDS", "STERLING", "GB POUND"),
    CAD("CA$", "C$", "CANADIAN DOLLAR"),
    AUD("AU$", "A$", "AUSTRALIAN DOLLAR"),
    JPY("¥", "YEN"),
    CHF("SWISS FRANC", "FRANC"),
    ZAR("R", "RAND", "SOUTH AFRICAN RAND"),
    NGN("₦", "NAIRA"),
    GHS("GH₵", "₵", "CEDI"),
    KES("KSH", "KSHS", "SHILLING", "KENYAN SHILLING");

    private static final Map<String, CurrencyCode> LOOKUP = new HashMap<>();

    static {
        for (CurrencyCode code : values()) {
            LOOKUP.put(code.name(), code);
            for (String synonym : code.synonyms) {
                LOOKUP.put(synonym, code);
            }
        }
    }

    private final String[] synonyms;

    CurrencyCode(String... synonyms) {
        this.synonyms = synonyms;
    }

    public static Optional<CurrencyCode> resolve(final String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        final String key = raw.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        return Optional.ofNullable(LOOKUP.get(key));
    }

    public static String isoCodePattern() {
        return String.join("|", Arrays.stream(values()).map(Enum::name).toList());
    }
}
