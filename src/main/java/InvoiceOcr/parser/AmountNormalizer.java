package InvoiceOcr.parser;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
Normalisiert Beträge und Datumsangaben aus Modellantworten.
 * Vollbreite Zeichen, Währungszeichen, Tausendertrennzeichen (US und europäisch)
 * und chinesische Finanzziffern (壹贰叁...).

Normalizes amounts and dates found in model output.
 * Full-width characters, currency marks, thousands separators (US and European style)
 * and Chinese financial numerals.
*/
public final class AmountNormalizer {

    private static final Pattern NUMBER_TOKEN = Pattern.compile("\\d[\\d.,']*");

    private static final Map<Character, Integer> CHINESE_DIGITS = Map.ofEntries(
            Map.entry('零', 0), Map.entry('〇', 0),
            Map.entry('壹', 1), Map.entry('一', 1),
            Map.entry('贰', 2), Map.entry('貳', 2), Map.entry('二', 2), Map.entry('两', 2),
            Map.entry('叁', 3), Map.entry('參', 3), Map.entry('三', 3),
            Map.entry('肆', 4), Map.entry('四', 4),
            Map.entry('伍', 5), Map.entry('五', 5),
            Map.entry('陆', 6), Map.entry('陸', 6), Map.entry('六', 6),
            Map.entry('柒', 7), Map.entry('七', 7),
            Map.entry('捌', 8), Map.entry('八', 8),
            Map.entry('玖', 9), Map.entry('九', 9));

    private static final Map<Character, Long> CHINESE_SMALL_UNITS = Map.of(
            '拾', 10L, '十', 10L,
            '佰', 100L, '百', 100L,
            '仟', 1000L, '千', 1000L);

    private static final String FINANCIAL_CHARS = "壹贰貳叁參肆伍陆陸柒捌玖拾佰仟";
    private static final String LARGE_UNITS = "元圆圓万萬亿億";
    private static final String RUN_EXTRA_CHARS = "万萬亿億元圆圓角分整正";
    private static final String CURRENCY_MARKS = "¥￥$€";

    private static final DateTimeFormatter[] DATE_FORMATTERS = new DateTimeFormatter[] {
        strict("uuuu-M-d", Locale.ROOT),
        strict("uuuu/M/d", Locale.ROOT),
        strict("uuuu.M.d", Locale.ROOT),
        strict("uuuuMMdd", Locale.ROOT),
        strict("d.M.uuuu", Locale.ROOT),
        strict("M/d/uuuu", Locale.ROOT),
        strict("MMMM d, uuuu", Locale.ENGLISH),
        strict("MMM d, uuuu", Locale.ENGLISH),
        strict("d MMM uuuu", Locale.ENGLISH),
        strict("d MMMM uuuu", Locale.ENGLISH)
    };

    private AmountNormalizer() {
    }

    /**
     * Parst einen Betrag; leer, wenn keine Zahl erkennbar ist.
     * Das Ergebnis hat immer zwei Nachkommastellen. Ein direkt vorangestelltes Minus
     * ("-100", "¥-100", "-¥100") ergibt einen negativen Wert.
     */
    public static Optional<BigDecimal> parseAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = toHalfWidth(raw).replace('−', '-').trim();

        Matcher matcher = NUMBER_TOKEN.matcher(text);
        if (matcher.find()) {
            Optional<BigDecimal> value = parseNumberToken(matcher.group());
            if (hasLeadingMinus(text, matcher.start())) {
                return value.map(BigDecimal::negate);
            }
            return value;
        }
        return findChineseAmount(text);
    }

    /**
     * Parst ein Datum in einem der üblichen Formate, auch "2024年12月01日".
     */
    public static Optional<LocalDate> parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = toHalfWidth(raw).trim()
                .replace('年', '-')
                .replace('月', '-')
                .replace("日", "")
                .replaceAll("\\s+", " ")
                .trim();
        // Zeitanteil abschneiden (2024-12-01T10:00:00, 2024-12-01 10:00)
        text = text.replaceFirst("^(\\d{4}-\\d{1,2}-\\d{1,2})[T ].*$", "$1");

        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return Optional.of(LocalDate.parse(text, formatter));
            } catch (DateTimeParseException ignored) {
                // nächstes Format
            }
        }
        return Optional.empty();
    }

    /**
     * Wandelt vollbreite ASCII-Zeichen (０-９，．￥ ...) und das vollbreite Leerzeichen um.
     */
    public static String toHalfWidth(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '！' && c <= '～') {
                sb.append((char) (c - 0xFEE0));
            } else if (c == '　') {
                sb.append(' ');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static Optional<BigDecimal> parseNumberToken(String token) {
        String cleanStr = token.replace("'", "");
        // trailing separators from sentences like "1234.56."
        while (!cleanStr.isEmpty() && !Character.isDigit(cleanStr.charAt(cleanStr.length() - 1))) {
            cleanStr = cleanStr.substring(0, cleanStr.length() - 1);
        }

        int lastComma = cleanStr.lastIndexOf(',');
        int lastDot = cleanStr.lastIndexOf('.');

        if (lastComma > lastDot) {
            int digitsAfter = cleanStr.length() - lastComma - 1;
            boolean singleComma = cleanStr.indexOf(',') == lastComma;
            if (lastDot >= 0 || (singleComma && digitsAfter <= 2)) {
                // europäisch: 1.234,56 oder 12,5
                cleanStr = cleanStr.replace(".", "").replace(",", ".");
            } else {
                // 1,234 oder 1,234,567
                cleanStr = cleanStr.replace(",", "");
            }
        } else if (lastDot > lastComma) {
            boolean singleDot = cleanStr.indexOf('.') == lastDot;
            if (singleDot) {
                cleanStr = cleanStr.replace(",", "");
            } else {
                // 1.234.567
                cleanStr = cleanStr.replace(".", "").replace(",", "");
            }
        }

        try {
            return Optional.of(new BigDecimal(cleanStr).setScale(2, RoundingMode.HALF_UP));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /*
     * Minus unmittelbar vor der Zahl oder vor dem Währungszeichen; "Total - 100" zählt nicht.
     */
    private static boolean hasLeadingMinus(String text, int tokenStart) {
        int i = tokenStart - 1;
        while (i >= 0 && (CURRENCY_MARKS.indexOf(text.charAt(i)) >= 0 || text.charAt(i) == ' ')) {
            i--;
        }
        if (i < 0 || text.charAt(i) != '-') {
            return false;
        }
        return !Character.isWhitespace(text.charAt(i + 1));
    }

    /**
     * Sucht die erste zusammenhängende Folge aus chinesischen Ziffern und Einheiten, die wie ein Betrag
     * aussieht: mit Finanzziffer (壹, 拾 ...) oder Einheit (元, 万, 亿). Einzelne Alltagsziffern im
     * Fließtext ("下一页") zählen nicht.
     */
    static Optional<BigDecimal> findChineseAmount(String text) {
        int i = 0;
        while (i < text.length()) {
            if (!isNumeralRunChar(text.charAt(i))) {
                i++;
                continue;
            }
            int start = i;
            while (i < text.length() && isNumeralRunChar(text.charAt(i))) {
                i++;
            }
            String run = text.substring(start, i);
            if (looksLikeAmount(run)) {
                Optional<BigDecimal> value = parseChineseNumerals(run);
                if (value.isPresent()) {
                    return value;
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isNumeralRunChar(char c) {
        return CHINESE_DIGITS.containsKey(c) || CHINESE_SMALL_UNITS.containsKey(c) || RUN_EXTRA_CHARS.indexOf(c) >= 0;
    }

    private static boolean looksLikeAmount(String run) {
        for (int i = 0; i < run.length(); i++) {
            char c = run.charAt(i);
            if (FINANCIAL_CHARS.indexOf(c) >= 0 || LARGE_UNITS.indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Chinesische Finanzziffern, z.B. "壹仟贰佰叁拾肆元伍角" = 1234.50.
     */
    static Optional<BigDecimal> parseChineseNumerals(String text) {
        long result = 0;
        long section = 0;
        long number = 0;
        boolean seenNumeral = false;
        boolean inFraction = false;
        BigDecimal fraction = BigDecimal.ZERO;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            Integer digit = CHINESE_DIGITS.get(c);
            if (digit != null) {
                number = digit;
                seenNumeral = true;
                continue;
            }
            if (inFraction) {
                if (c == '角') {
                    fraction = fraction.add(BigDecimal.valueOf(number).movePointLeft(1));
                    number = 0;
                } else if (c == '分') {
                    fraction = fraction.add(BigDecimal.valueOf(number).movePointLeft(2));
                    number = 0;
                }
                continue;
            }
            Long unit = CHINESE_SMALL_UNITS.get(c);
            if (unit != null) {
                if (number == 0 && unit == 10L) {
                    number = 1;
                }
                section += number * unit;
                number = 0;
                seenNumeral = true;
            } else if (c == '万' || c == '萬') {
                section += number;
                result += section * 10_000L;
                section = 0;
                number = 0;
                seenNumeral = true;
            } else if (c == '亿' || c == '億') {
                section += number;
                result = (result + section) * 100_000_000L;
                section = 0;
                number = 0;
                seenNumeral = true;
            } else if (c == '元' || c == '圆' || c == '圓') {
                result += section + number;
                section = 0;
                number = 0;
                inFraction = true;
            } else if (c == '角' || c == '分') {
                // kein 元: "伍角" oder "叁分"
                inFraction = true;
                i--;
            }
        }

        if (!seenNumeral) {
            return Optional.empty();
        }
        if (!inFraction) {
            result += section + number;
        }
        return Optional.of(BigDecimal.valueOf(result).add(fraction).setScale(2, RoundingMode.HALF_UP));
    }

    private static DateTimeFormatter strict(String pattern, Locale locale) {
        return DateTimeFormatter.ofPattern(pattern, locale).withResolverStyle(ResolverStyle.STRICT);
    }
}
