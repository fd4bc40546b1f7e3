package com.eyelevel.bordereaux.model.canonical;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fixed canonical schema every mapped bordereau is converted into. Declaration order is the schema order
 * used by the suggestion generator and by proposals.
 */
public enum CanonicalField {
    POLICY_NUMBER("policy_number", FieldType.STRING, "Unique policy identifier"),
    INSURED_NAME("insured_name", FieldType.STRING, "Name of the insured party"),
    INCEPTION_DATE("inception_date", FieldType.DATE, "Policy start date"),
    EXPIRY_DATE("expiry_date", FieldType.DATE, "Policy end date"),
    PREMIUM_AMOUNT("premium_amount", FieldType.DECIMAL, "Gross premium amount"),
    CURRENCY("currency", FieldType.CURRENCY, "Currency code of the amounts (USD, EUR, GBP, ...)"),
    CLAIM_AMOUNT("claim_amount", FieldType.DECIMAL, "Claim amount, for claims bordereaux"),
    COMMISSION_AMOUNT("commission_amount", FieldType.DECIMAL, "Broker commission amount"),
    NET_PREMIUM("net_premium", FieldType.DECIMAL, "Premium net of commission"),
    BROKER_NAME("broker_name", FieldType.STRING, "Name of the placing broker"),
    PRODUCT_TYPE("product_type", FieldType.STRING, "Insurance product or line of business"),
    COVERAGE_TYPE("coverage_type", FieldType.STRING, "Type of coverage"),
    RISK_LOCATION("risk_location", FieldType.STRING, "Location of the insured risk");

    private static final Map<String, CanonicalField> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(CanonicalField::getFieldName, Function.identity()));

    private final String fieldName;
    private final FieldType type;
    private final String description;

    CanonicalField(String fieldName, FieldType type, String description) {
        this.fieldName = fieldName;
        this.type = type;
        this.description = description;
    }

    public String getFieldName() {
        return fieldName;
    }

    public FieldType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<CanonicalField> fromName(final String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(name.trim()));
    }

    public static boolean isKnown(final String name) {
        return fromName(name).isPresent();
    }

    public static List<String> fieldNames() {
        return Arrays.stream(values()).map(CanonicalField::getFieldName).toList();
    }
}
