package com.example.grouping.format;

import com.example.grouping.model.Values;

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Currency;
import java.util.Locale;

/**
 * Maps an aggregate value and a {@link FormatSpec} to a display string.
 *
 * <p>Stateless and locale-independent: digits, grouping and decimal
 * separators always follow {@link Locale#US}, rounding is half-up.
 * A {@code null} value (an empty min/max, for example) renders as an empty
 * string; a {@code null} spec renders like {@link PlainFormatSpec}.
 *
 * <pre>{@code
 * ValueFormatter.format(1234.5, NumberFormatSpec.of(2, true));        // "1,234.50"
 * ValueFormatter.format(-1234.5, new CurrencyFormatSpec("USD", 2));    // "-$1,234.50"
 * ValueFormatter.format(12.5, new PercentageFormatSpec(2));            // "12.50%"
 * ValueFormatter.format(30.0, null);                                   // "30"
 * }</pre>
 */
public final class ValueFormatter {

    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);

    private ValueFormatter() {
    }

    public static String format(Double value, FormatSpec spec) {
        if (value == null) {
            return "";
        }
        double v = value;
        if (spec instanceof NumberFormatSpec number) {
            return number.prefix() + decimal(v, number.precision(), number.thousandsSeparator()) + number.suffix();
        }
        if (spec instanceof CurrencyFormatSpec currency) {
            String sign = v < 0 ? "-" : "";
            return sign + currencySymbol(currency.code()) + decimal(Math.abs(v), currency.precision(), true);
        }
        if (spec instanceof PercentageFormatSpec percentage) {
            return decimal(v, percentage.precision(), false) + "%";
        }
        return Values.formatNumber(v);
    }

    private static String decimal(double value, int precision, boolean grouping) {
        StringBuilder pattern = new StringBuilder(grouping ? "#,##0" : "0");
        if (precision > 0) {
            pattern.append('.').append("0".repeat(precision));
        }
        DecimalFormat format = new DecimalFormat(pattern.toString(), SYMBOLS);
        format.setRoundingMode(RoundingMode.HALF_UP);
        String text = format.format(value);
        // DecimalFormat keeps the sign of negative values that round to zero
        return text.startsWith("-") && format.format(0.0).equals(text.substring(1)) ? text.substring(1) : text;
    }

    private static String currencySymbol(String code) {
        try {
            return Currency.getInstance(code).getSymbol(Locale.US);
        } catch (IllegalArgumentException e) {
            return code + " ";
        }
    }
}
