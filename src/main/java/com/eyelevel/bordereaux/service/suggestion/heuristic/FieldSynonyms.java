package com.eyelevel.bordereaux.service.suggestion.heuristic;

import com.eyelevel.bordereaux.model.canonical.CanonicalField;
import com.eyelevel.bordereaux.service.matching.HeaderNormalizer;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Header spellings partners commonly use for each canonical field, stored in normalized form.
 */
final class FieldSynonyms {

    private static final Map<CanonicalField, Set<String>> SYNONYMS = new EnumMap<>(CanonicalField.class);

    static {
        register(CanonicalField.POLICY_NUMBER, "policy", "pol", "policy no", "policy #", "policy number", "pol no",
                 "pol #", "policy ref", "policy reference", "policy id", "certificate number", "cert no");
        register(CanonicalField.INSURED_NAME, "insured", "client", "customer", "insured name", "client name",
                 "assured", "assured name", "policyholder", "policy holder");
        register(CanonicalField.INCEPTION_DATE, "inception", "start", "start date", "effective", "effective date",
                 "incept", "commence", "commencement date", "inception dt", "from date", "period from");
        register(CanonicalField.EXPIRY_DATE, "expiry", "expire", "end", "end date", "expiration",
                 "expiration date", "exp date", "expiry dt", "to date", "period to");
        register(CanonicalField.PREMIUM_AMOUNT, "premium", "prem", "premium amount", "premium amt", "premium total",
                 "total premium", "gross premium", "gwp", "gross written premium");
        register(CanonicalField.CURRENCY, "currency", "curr", "ccy", "currency code", "curr code", "cur");
        register(CanonicalField.CLAIM_AMOUNT, "claim", "claim amount", "claim amt", "claim total", "loss",
                 "loss amount", "paid", "amount paid", "incurred", "total incurred");
        register(CanonicalField.COMMISSION_AMOUNT, "commission", "comm", "commission amount", "comm amt",
                 "brokerage amount", "commission amt");
        register(CanonicalField.NET_PREMIUM, "net", "net premium", "net prem", "net amount", "net written premium",
                 "nwp");
        register(CanonicalField.BROKER_NAME, "broker", "broker name", "brokerage", "intermediary", "agent",
                 "agent name", "producer");
        register(CanonicalField.PRODUCT_TYPE, "product", "product type", "product name", "line",
                 "line of business", "lob", "class of business");
        register(CanonicalField.COVERAGE_TYPE, "coverage", "cover", "coverage type", "cover type", "type",
                 "class");
        register(CanonicalField.RISK_LOCATION, "location", "loc", "risk location", "address", "premises",
                 "property", "risk address", "territory");
    }

    private FieldSynonyms() {
    }

    static boolean isSynonym(final CanonicalField field, final String normalizedHeader) {
        return SYNONYMS.getOrDefault(field, Set.of()).contains(normalizedHeader);
    }

    private static void register(final CanonicalField field, final String... spellings) {
        SYNONYMS.put(field, Stream.concat(Stream.of(field.getFieldName()), Stream.of(spellings))
                .map(HeaderNormalizer::normalize)
                .collect(Collectors.toUnmodifiableSet()));
    }
}
