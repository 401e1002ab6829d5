package InvoiceOcr.llm;

import InvoiceOcr.model.ExtractionMode;

/* Prompts für die Bild-Extraktion.
 * Die Modelle antworten am zuverlässigsten mit einem flachen JSON-Objekt; die Schlüssel
 * entsprechen dem, was ResponseParser zuerst sucht.

 * Prompts for image extraction.
 * The JSON keys below are the ones ResponseParser reads in its strict pass.
*/
public final class ExtractionPrompts {

    /**
     * Nur Betrag (SIMPLE).
     */
    public static final String SIMPLE = """
        You are an invoice recognition expert. Read the total amount including tax
        (价税合计) of the invoice in the image.
        Return JSON only: {"total": number}
        The amount must be exact, digits only, e.g. 1234.56
        If you cannot read it, return {"total": 0}
        Do not output anything else.
        """;

    /**
     * Alle Felder (FULL).
     */
    public static final String FULL = """
        You are an invoice recognition expert. Read the invoice in the image and return its data as JSON.

        MOST IMPORTANT: the total amount including tax (total) must be exact.
        Look for 价税合计, 合计 or 总金额, usually at the bottom of the invoice.

        FIELDS:
        - total: total including tax, digits only, e.g. 1234.56
        - invoice_no: invoice number (发票号码), e.g. 00123456
        - issue_date: issue date (开票日期) as YYYY-MM-DD
        - buyer: buyer name (购买方), exactly as printed
        - seller: seller name (销售方)
        - tax: tax amount, digits only, 0 if none
        - subtotal: amount before tax, digits only, 0 if none
        - items: goods or services, comma separated, at most 3
        - notes: leave empty

        RETURN FORMAT (JSON only, nothing else):
        {
          "invoice_no": "",
          "issue_date": "YYYY-MM-DD",
          "seller": "",
          "buyer": "",
          "total": 0,
          "tax": 0,
          "subtotal": 0,
          "items": "",
          "notes": ""
        }

        If a field cannot be read, use an empty string (or 0 for amounts).
        """;

    /**
     * Vorabprüfung: ist das Dokument überhaupt eine Rechnung?
     */
    public static final String VALIDATE = """
        Decide whether the document in the image is an invoice.
        If it is an invoice (VAT invoice, ordinary invoice, ...), return {"is_invoice": true}
        If it is not an invoice (itinerary, receipt, ...), return {"is_invoice": false}
        Do not output anything else.
        """;

    /**
     * Echtheits- und Vollständigkeitsprüfung.
     */
    public static final String VERIFY = """
        You are an invoice auditor. Check the authenticity and completeness of the invoice in the image:
        1. Is the official seal clearly visible?
        2. Are the invoice code and invoice number complete?
        3. Is the check code present (VAT invoices)?
        4. Is a QR code present (electronic invoices)?
        5. Is the image sharp and complete?
        6. Are there visible edits or signs of tampering?
        7. Do the amount in figures and the amount in words (大写) match?

        RETURN FORMAT (JSON only):
        {
          "risk_level": "low/medium/high",
          "has_stamp": true,
          "has_complete_code": true,
          "has_qrcode": false,
          "image_quality": "good/fair/poor",
          "has_tampering": false,
          "amount_consistent": true,
          "risk_notes": ""
        }

        risk_level:
        - low: complete, sharp, nothing unusual
        - medium: minor problems, e.g. slightly blurred or partly unreadable
        - high: serious problems, e.g. no seal, visible edits, amounts do not match
        """;

    /**
     * Rechnungsart und Kostenart.
     */
    public static final String CLASSIFY = """
        Identify the invoice type and the expense category of the invoice in the image.

        invoice_type:
        - special_vat: 增值税专用发票
        - general_vat: 增值税普通发票
        - electronic: 电子发票
        - toll: 通行费发票
        - taxi: 出租车发票
        - train: 火车票
        - flight: 机票行程单
        - other: 其他类型

        expense_category:
        - travel: 差旅
        - dining: 餐饮
        - office: 办公用品
        - transport: 交通
        - telecom: 通讯
        - conference: 会议
        - training: 培训
        - service: 服务费
        - material: 材料/设备
        - other: 其他

        RETURN FORMAT (JSON only):
        {
          "invoice_type": "code",
          "invoice_type_name": "Chinese name of the type",
          "expense_category": "code",
          "expense_category_name": "Chinese name of the category"
        }
        """;

    private ExtractionPrompts() {
    }

    public static String forMode(ExtractionMode mode) {
        return mode == ExtractionMode.FULL ? FULL : SIMPLE;
    }
}
