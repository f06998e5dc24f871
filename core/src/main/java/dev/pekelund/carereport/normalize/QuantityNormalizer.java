package dev.pekelund.carereport.normalize;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses quantity fragments written on care reports ("5 oz", "1/2 cup", "1.5 h", "15 mins").
 *
 * <p>The first numeric token wins, including fractions and mixed numbers. The unit is taken from the
 * first unit keyword after that token; hours are converted to minutes. The normalizer never throws:
 * text without a number yields {@link NormalizedQuantity#NONE}.</p>
 */
public final class QuantityNormalizer {

    private static final Pattern NUMBER = Pattern.compile(
        "(?<whole>\\d+)\\s+(?<mixedNum>\\d+)\\s*/\\s*(?<mixedDen>\\d+)"
            + "|(?<num>\\d+)\\s*/\\s*(?<den>\\d+)"
            + "|(?<decimal>\\d+(?:[.,]\\d+)?|[.,]\\d+)");

    private static final Pattern UNIT = Pattern.compile(
        "\\b(?<ounce>oz|ounces?)\\b"
            + "|\\b(?<ml>ml|mls|millilit(?:er|re)s?)\\b"
            + "|\\b(?<minute>mins?|minutes?)\\b"
            + "|\\b(?<hour>h|hrs?|hours?)\\b");

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);
    private static final int FRACTION_SCALE = 4;

    private QuantityNormalizer() {
    }

    public static NormalizedQuantity normalize(String text) {
        if (text == null || text.isBlank()) {
            return NormalizedQuantity.NONE;
        }

        Matcher number = NUMBER.matcher(text);
        if (!number.find()) {
            return NormalizedQuantity.NONE;
        }

        BigDecimal amount = parseAmount(number);
        String remainder = text.substring(number.end()).toLowerCase(Locale.ROOT);
        QuantityUnit unit = detectUnit(remainder);
        if (unit == QuantityUnit.HOUR) {
            return new NormalizedQuantity(tidy(amount.multiply(MINUTES_PER_HOUR)), QuantityUnit.MINUTE);
        }
        return new NormalizedQuantity(amount, unit);
    }

    private static BigDecimal parseAmount(Matcher number) {
        if (number.group("whole") != null) {
            BigDecimal whole = new BigDecimal(number.group("whole"));
            return tidy(whole.add(fraction(number.group("mixedNum"), number.group("mixedDen"))));
        }
        if (number.group("num") != null) {
            return tidy(fraction(number.group("num"), number.group("den")));
        }
        String decimal = number.group("decimal").replace(',', '.');
        if (decimal.startsWith(".")) {
            decimal = "0" + decimal;
        }
        return tidy(new BigDecimal(decimal));
    }

    private static BigDecimal fraction(String numerator, String denominator) {
        BigDecimal top = new BigDecimal(numerator);
        BigDecimal bottom = new BigDecimal(denominator);
        if (bottom.signum() == 0) {
            // "3/0" is not a fraction; keep the leading number
            return top;
        }
        return top.divide(bottom, FRACTION_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal tidy(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    private static QuantityUnit detectUnit(String remainder) {
        Matcher unit = UNIT.matcher(remainder);
        if (!unit.find()) {
            return QuantityUnit.UNKNOWN;
        }
        if (unit.group("ounce") != null) {
            return QuantityUnit.OUNCE;
        }
        if (unit.group("ml") != null) {
            return QuantityUnit.MILLILITER;
        }
        if (unit.group("minute") != null) {
            return QuantityUnit.MINUTE;
        }
        return QuantityUnit.HOUR;
    }
}
