package InvoiceOcr.model;

/**
 * Rechnungsart und Kostenart aus der optionalen Klassifizierung.
 *
 * Codes are the lower-case identifiers the model is asked for ({@code special_vat}, {@code travel}, ...);
 * the names are the display labels it returns alongside.
 */
public record Classification(String invoiceType, String invoiceTypeName,
                             String expenseCategory, String expenseCategoryName) {

    public static final String OTHER_CODE = "other";
    public static final Classification OTHER = new Classification(OTHER_CODE, "其他类型", OTHER_CODE, "其他");

    public Classification {
        invoiceType = orOther(invoiceType);
        invoiceTypeName = invoiceTypeName == null || invoiceTypeName.isBlank() ? invoiceType : invoiceTypeName.trim();
        expenseCategory = orOther(expenseCategory);
        expenseCategoryName = expenseCategoryName == null || expenseCategoryName.isBlank()
                ? expenseCategory : expenseCategoryName.trim();
    }

    private static String orOther(String code) {
        return code == null || code.isBlank() ? OTHER_CODE : code.trim();
    }
}
