package InvoiceOcr.parser;

import InvoiceOcr.model.Classification;
import InvoiceOcr.model.ErrorTags;
import InvoiceOcr.model.ExtractionMode;
import InvoiceOcr.model.ExtractionStatus;
import InvoiceOcr.model.InvoiceRecord;
import InvoiceOcr.model.RiskLevel;
import InvoiceOcr.model.Verification;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
Verantwortlich für das Parsen der Antworten des Vision-Modells.
 * Zuerst strikt als JSON, danach tolerant über Schlüsselwörter (chinesisch und englisch).

Responsible for parsing the answers of the vision model.
 * Strict JSON first, then a tolerant keyword pass (Chinese and English labels).
*/
@Service
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    private static final String[] AMOUNT_KEYS = {"total", "amount_total", "total_amount", "gross_amount", "amount",
            "价税合计", "总金额", "合计金额"};
    private static final String[] DATE_KEYS = {"issue_date", "invoice_date", "date", "开票日期"};
    private static final String[] VENDOR_KEYS = {"seller", "vendor", "vendor_name", "company_name", "销售方"};
    private static final String[] BUYER_KEYS = {"buyer", "buyer_name", "购买方"};
    private static final String[] NUMBER_KEYS = {"invoice_no", "invoice_number", "number", "发票号码"};
    private static final String[] TAX_KEYS = {"tax", "tax_amount", "税额"};
    private static final String[] SUBTOTAL_KEYS = {"subtotal", "net_amount", "amount_without_tax", "不含税金额"};
    private static final String[] ITEMS_KEYS = {"items", "项目"};

    // Reihenfolge = Priorität
    private static final List<Pattern> AMOUNT_LABELS = labels(
            "价税合计", "合计金额", "总金额", "合计", "grand total", "total amount", "amount due", "total", "amount");
    private static final List<Pattern> DATE_LABELS = labels("开票日期", "invoice date", "issue date", "日期", "date");
    private static final List<Pattern> VENDOR_LABELS = labels("销售方名称", "销售方", "seller", "vendor");
    private static final List<Pattern> BUYER_LABELS = labels("购买方名称", "购买方", "buyer", "bill to");
    private static final List<Pattern> NUMBER_LABELS = labels("发票号码", "invoice no", "invoice number", "invoice #");
    private static final List<Pattern> TAX_LABELS = labels("税额", "tax");
    private static final List<Pattern> SUBTOTAL_LABELS = labels("不含税金额", "subtotal");

    private static final Pattern BARE_NUMBER = Pattern.compile("^[¥￥$€]?\\s*[\\d.,']+\\s*$");
    private static final Pattern DATE_ANYWHERE = Pattern.compile("\\d{4}\\s*[-/.年]\\s*\\d{1,2}\\s*[-/.月]\\s*\\d{1,2}\\s*日?");
    private static final String DATE_PLACEHOLDER = "YYYY-MM-DD";

    public InvoiceRecord parse(Path sourcePath, String rawText, ExtractionMode mode) {
        if (rawText == null || rawText.isBlank()) {
            return InvoiceRecord.failed(sourcePath, rawText,
                    List.of(ErrorTags.withDetail(ErrorTags.AMOUNT_NOT_FOUND, "empty model output")));
        }

        Fields fields = parseStrict(rawText)
                .map(strict -> hasAmount(strict) ? strict : strict.completeFrom(parseTolerant(rawText)))
                .orElseGet(() -> parseTolerant(rawText));

        Optional<BigDecimal> amount = AmountNormalizer.parseAmount(fields.amount);
        if (amount.isPresent() && amount.get().signum() < 0) {
            log.debug("{}: negative amount {} in model output", sourcePath.getFileName(), amount.get());
            return InvoiceRecord.failed(sourcePath, rawText,
                    List.of(ErrorTags.withDetail(ErrorTags.AMOUNT_NOT_FOUND, "negative")));
        }
        if (amount.isEmpty() || amount.get().signum() == 0) {
            log.debug("{}: no amount in model output", sourcePath.getFileName());
            return InvoiceRecord.failed(sourcePath, rawText, List.of(ErrorTags.AMOUNT_NOT_FOUND));
        }

        if (mode == ExtractionMode.SIMPLE) {
            return new InvoiceRecord(sourcePath, amount.get(), null, null, null, null,
                    rawText, ExtractionStatus.SUCCESS, List.of());
        }

        List<String> errors = new ArrayList<>();

        LocalDate date = null;
        if (isBlank(fields.date) || DATE_PLACEHOLDER.equalsIgnoreCase(fields.date.trim())) {
            errors.add(ErrorTags.DATE_NOT_FOUND);
        } else {
            date = AmountNormalizer.parseDate(fields.date).orElse(null);
            if (date == null) {
                errors.add(ErrorTags.withDetail(ErrorTags.DATE_INVALID, fields.date.trim()));
            }
        }

        String vendor = blankToNull(fields.vendor);
        if (vendor == null) {
            errors.add(ErrorTags.VENDOR_NOT_FOUND);
        }
        String buyer = blankToNull(fields.buyer);
        if (buyer == null) {
            errors.add(ErrorTags.BUYER_NOT_FOUND);
        }
        String number = blankToNull(fields.number);
        if (number == null) {
            errors.add(ErrorTags.INVOICE_NUMBER_NOT_FOUND);
        }

        // Steuer, Zwischensumme, Positionen: optional, ohne Fehler-Tag
        BigDecimal tax = optionalAmount(fields.tax);
        BigDecimal subtotal = optionalAmount(fields.subtotal);
        String items = blankToNull(fields.items);

        ExtractionStatus status = errors.isEmpty() ? ExtractionStatus.SUCCESS : ExtractionStatus.PARTIAL_FAILURE;
        return new InvoiceRecord(sourcePath, amount.get(), date, vendor, buyer, number, rawText, status, errors,
                tax, subtotal, items, null, null);
    }

    /**
     * Liest die Antwort der Echtheitsprüfung. Fehlende Schlüssel bekommen die unauffälligen
     * Standardwerte (low, Stempel vorhanden, gute Bildqualität); leer, wenn kein JSON-Objekt lesbar ist.
     */
    public Optional<Verification> parseVerification(String rawText) {
        Optional<JSONObject> parsed = parseObject(rawText);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        JSONObject obj = parsed.get();
        RiskLevel riskLevel = obj.has("risk_level") ? RiskLevel.fromCode(obj.optString("risk_level")) : RiskLevel.LOW;
        boolean hasStamp = readBoolean(obj, "has_stamp").orElse(true);
        String quality = obj.optString("image_quality", Verification.QUALITY_GOOD);
        String notes = obj.optString("risk_notes", "");
        return Optional.of(new Verification(riskLevel, hasStamp, quality, notes));
    }

    /**
     * Liest die Antwort der Klassifizierung; leer, wenn kein JSON-Objekt lesbar ist.
     */
    public Optional<Classification> parseClassification(String rawText) {
        Optional<JSONObject> parsed = parseObject(rawText);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        JSONObject obj = parsed.get();
        if (!obj.has("invoice_type") && !obj.has("expense_category")) {
            return Optional.empty();
        }
        return Optional.of(new Classification(
                obj.optString("invoice_type", Classification.OTHER.invoiceType()),
                obj.optString("invoice_type_name", null),
                obj.optString("expense_category", Classification.OTHER.expenseCategory()),
                obj.optString("expense_category_name", null)));
    }

    /**
     * Liest die Antwort der Rechnungs-Vorabprüfung. Leer, wenn die Antwort nicht eindeutig ist.
     */
    public Optional<Boolean> parseIsInvoice(String rawText) {
        return parseObject(rawText).flatMap(obj -> readBoolean(obj, "is_invoice"));
    }

    Optional<Fields> parseStrict(String rawText) {
        String json = extractJsonObject(cleanJsonResponse(rawText));
        if (json == null) {
            return Optional.empty();
        }
        try {
            JSONObject obj = new JSONObject(json);
            Fields fields = new Fields();
            fields.amount = firstValue(obj, AMOUNT_KEYS);
            fields.date = firstValue(obj, DATE_KEYS);
            fields.vendor = firstValue(obj, VENDOR_KEYS);
            fields.buyer = firstValue(obj, BUYER_KEYS);
            fields.number = firstValue(obj, NUMBER_KEYS);
            fields.tax = firstValue(obj, TAX_KEYS);
            fields.subtotal = firstValue(obj, SUBTOTAL_KEYS);
            fields.items = itemsValue(obj);
            return Optional.of(fields);
        } catch (JSONException e) {
            log.debug("Model output is not valid JSON ({}), falling back to keyword search", e.getMessage());
            return Optional.empty();
        }
    }

    Fields parseTolerant(String rawText) {
        String text = AmountNormalizer.toHalfWidth(rawText);
        String[] lines = text.split("\\R");

        Fields fields = new Fields();
        fields.amount = findAmount(lines, AMOUNT_LABELS);
        if (fields.amount == null && BARE_NUMBER.matcher(text.trim()).matches()) {
            fields.amount = text.trim();
        }
        fields.date = findLabelled(lines, DATE_LABELS);
        if (fields.date == null) {
            Matcher matcher = DATE_ANYWHERE.matcher(text);
            if (matcher.find()) {
                fields.date = matcher.group();
            }
        }
        fields.vendor = findLabelled(lines, VENDOR_LABELS);
        fields.buyer = findLabelled(lines, BUYER_LABELS);
        fields.number = findLabelled(lines, NUMBER_LABELS);
        fields.tax = findAmount(lines, TAX_LABELS);
        fields.subtotal = findAmount(lines, SUBTOTAL_LABELS);
        return fields;
    }

    private static boolean hasAmount(Fields fields) {
        return AmountNormalizer.parseAmount(fields.amount).filter(value -> value.signum() != 0).isPresent();
    }

    private static BigDecimal optionalAmount(String value) {
        return AmountNormalizer.parseAmount(value).filter(amount -> amount.signum() >= 0).orElse(null);
    }

    private static String findAmount(String[] lines, List<Pattern> labels) {
        for (Pattern label : labels) {
            for (String line : lines) {
                Matcher matcher = label.matcher(line);
                if (matcher.find()) {
                    String value = line.substring(matcher.end());
                    if (AmountNormalizer.parseAmount(value).filter(v -> v.signum() != 0).isPresent()) {
                        return value;
                    }
                }
            }
        }
        return null;
    }

    private static String findLabelled(String[] lines, List<Pattern> labels) {
        for (Pattern label : labels) {
            for (String line : lines) {
                Matcher matcher = label.matcher(line);
                if (matcher.find()) {
                    String value = cleanValue(line.substring(matcher.end()));
                    if (value != null) {
                        return value;
                    }
                }
            }
        }
        return null;
    }

    private static String firstValue(JSONObject obj, String[] keys) {
        for (String key : keys) {
            if (!obj.has(key) || obj.isNull(key)) {
                continue;
            }
            Object raw = obj.get(key);
            // 1.0E7 -> 10000000
            String value = raw instanceof Number
                    ? new BigDecimal(raw.toString()).toPlainString()
                    : raw.toString().trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    /*
     * "items" darf ein String oder eine Liste sein: ["Beratung", "Reisekosten"] -> "Beratung, Reisekosten".
     */
    private static String itemsValue(JSONObject obj) {
        for (String key : ITEMS_KEYS) {
            JSONArray array = obj.optJSONArray(key);
            if (array == null) {
                continue;
            }
            List<String> names = new ArrayList<>();
            for (int i = 0; i < array.length(); i++) {
                Object item = array.get(i);
                String name = item instanceof JSONObject
                        ? ((JSONObject) item).optString("name", item.toString())
                        : item.toString();
                if (!name.isBlank()) {
                    names.add(name.trim());
                }
            }
            return names.isEmpty() ? null : String.join(", ", names);
        }
        return firstValue(obj, ITEMS_KEYS);
    }

    private static Optional<Boolean> readBoolean(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return Optional.empty();
        }
        Object value = obj.get(key);
        if (value instanceof Boolean) {
            return Optional.of((Boolean) value);
        }
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
            return Optional.of(Boolean.parseBoolean(text));
        }
        return Optional.empty();
    }

    private static Optional<JSONObject> parseObject(String rawText) {
        if (rawText == null) {
            return Optional.empty();
        }
        String json = extractJsonObject(cleanJsonResponse(rawText));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new JSONObject(json));
        } catch (JSONException e) {
            log.debug("Check answer is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String cleanJsonResponse(String response) {
        String cleaned = response.trim();
        if (cleaned.startsWith("```json")) cleaned = cleaned.substring(7);
        else if (cleaned.startsWith("```")) cleaned = cleaned.substring(3);
        if (cleaned.endsWith("```")) cleaned = cleaned.substring(0, cleaned.length() - 3);
        return cleaned.trim();
    }

    private static String extractJsonObject(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }

    private static String cleanValue(String value) {
        String cleaned = value.trim()
                .replaceAll("^[\"'`*]+", "")
                .replaceAll("[\"'`*,;]+$", "")
                .trim();
        if (cleaned.startsWith("名称")) {
            cleaned = cleaned.substring(2).replaceFirst("^\\s*[:：]\\s*", "").trim();
        }
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Label gefolgt von optionalem "(小写)" und Doppelpunkt.
     */
    private static List<Pattern> labels(String... labels) {
        List<Pattern> patterns = new ArrayList<>();
        for (String label : labels) {
            patterns.add(Pattern.compile("(?i)(?<![a-z])" + Pattern.quote(label)
                    + "(?![a-z])\\s*(?:[(（][^)）]*[)）])?\\s*[:：]?\\s*"));
        }
        return patterns;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    static final class Fields {
        String amount;
        String date;
        String vendor;
        String buyer;
        String number;
        String tax;
        String subtotal;
        String items;

        /*
         * JSON ohne brauchbaren Betrag: Betrag und leere Felder aus der Schlüsselwortsuche übernehmen.
         */
        Fields completeFrom(Fields tolerant) {
            if (tolerant.amount != null) {
                amount = tolerant.amount;
            }
            date = date != null ? date : tolerant.date;
            vendor = vendor != null ? vendor : tolerant.vendor;
            buyer = buyer != null ? buyer : tolerant.buyer;
            number = number != null ? number : tolerant.number;
            tax = tax != null ? tax : tolerant.tax;
            subtotal = subtotal != null ? subtotal : tolerant.subtotal;
            return this;
        }
    }
}
