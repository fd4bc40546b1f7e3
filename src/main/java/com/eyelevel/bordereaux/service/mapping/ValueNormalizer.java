package com.eyelevel.bordereaux.service.mapping;

import com.eyelevel.bordereaux.config.BordereauxProcessingConfig;
import com.eyelevel.bordereaux.model.canonical.CurrencyCode;
import com.eyelevel.bordereaux.model.canonical.FieldType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Converts raw cell text into canonical typed values. Stateless apart from the configured date formats, so it is
 * safe to share across threads.
 */
@Component
public class ValueNormalizer {

    private static final Pattern ISO_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ].*");
    private static final Pattern CURRENCY_TOKENS = Pattern.compile(
            "(?i)\\b(" + CurrencyCode.isoCodePattern() + ")\\b|[$€£¥₹₦]|^R(?=\\s*[-(\\d.,])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)");

    private final List<DateTimeFormatter> dateFormatters;

    @Autowired
    public ValueNormalizer(final BordereauxProcessingConfig config) {
        this(config.getNormalization().getDateFormats());
    }

    public ValueNormalizer(final List<String> datePatterns) {
        this.dateFormatters = datePatterns.stream()
                .map(pattern -> new DateTimeFormatterBuilder()
                        .parseCaseInsensitive()
                        .appendPattern(pattern)
                        .toFormatter(Locale.ENGLISH)
                        .withResolverStyle(ResolverStyle.STRICT))
                .toList();
    }

    /**
     * @param raw non-blank cell text
     */
    public NormalizedValue normalize(final FieldType type, final String raw) {
        return switch (type) {
            case STRING -> NormalizedValue.of(raw.trim());
            case DATE -> parseDate(raw).map(NormalizedValue::of)
                    .orElseGet(() -> NormalizedValue.failed("not a date in any accepted format"));
            case DECIMAL -> parseDecimal(raw).map(NormalizedValue::of)
                    .orElseGet(() -> NormalizedValue.failed("not a valid amount"));
            case CURRENCY -> CurrencyCode.resolve(raw).map(code -> NormalizedValue.of(code.name()))
                    .orElseGet(() -> NormalizedValue.failed("unknown currency"));
        };
    }

    public Optional<LocalDate> parseDate(final String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();
        if (ISO_DATE_TIME.matcher(text).matches()) {
            text = text.substring(0, 10);
        }
        for (DateTimeFormatter formatter : dateFormatters) {
            try {
                return Optional.of(LocalDate.parse(text, formatter));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    /**
     * Accepts currency symbols or codes, thousands separators, European decimal commas and accounting
     * parentheses for negatives: {@code "£1,234.50"}, {@code "1.234,50 EUR"}, {@code "(250.00)"}.
     */
    public Optional<BigDecimal> parseDecimal(final String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = CURRENCY_TOKENS.matcher(raw.trim()).replaceAll("");
        text = WHITESPACE.matcher(text).replaceAll("");

        boolean negative = false;
        if (text.length() > 1 && text.startsWith("(") && text.endsWith(")")) {
            negative = true;
            text = text.substring(1, text.length() - 1);
        }

        final int lastComma = text.lastIndexOf(',');
        final int lastDot = text.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0 && lastComma > lastDot) {
            text = text.replace(".", "").replace(',', '.');
        } else {
            text = text.replace(",", "");
        }

        if (!PLAIN_DECIMAL.matcher(text).matches()) {
            return Optional.empty();
        }
        final BigDecimal amount = new BigDecimal(text);
        return Optional.of(negative ? amount.negate() : amount);
    }
}
