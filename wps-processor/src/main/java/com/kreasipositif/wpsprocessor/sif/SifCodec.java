package com.kreasipositif.wpsprocessor.sif;

import com.kreasipositif.wpsprocessor.domain.SalaryPeriod;
import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.domain.WpsLine;
import com.kreasipositif.wpsprocessor.exception.SifFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.file.transform.FieldSet;
import org.springframework.batch.item.file.transform.FixedLengthTokenizer;
import org.springframework.batch.item.file.transform.IncorrectLineLengthException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Encodes a {@link WpsBatch} into the WPS Salary Information File format and parses such files
 * back into a {@link SifDocument}.
 *
 * <p>Encoding is pure and deterministic: one EDR, then one SDR per line in line order, every
 * record terminated by {@code \n}, US-ASCII throughout. Any violation of the layout is reported
 * as a {@link SifFormatException}; nothing is rounded or silently corrected.
 */
@Slf4j
@Component
public class SifCodec {

    /** Subunit values closer than this to an integer are treated as integral. */
    static final BigDecimal SUBUNIT_TOLERANCE = new BigDecimal("0.000001");

    private static final DateTimeFormatter SALARY_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final char RECORD_SEPARATOR = '\n';

    // ─── Encoding ────────────────────────────────────────────────────────────

    public byte[] encode(WpsBatch batch) {
        requireText(batch.getEmployerId(), "employer ID");
        requireText(batch.getEmployerAccount(), "employer account");
        if (batch.getSalaryDate() == null) {
            throw new SifFormatException("Salary date is required");
        }
        if (batch.getPeriod() == null) {
            throw new SifFormatException("Salary period is required");
        }

        List<WpsLine> lines = batch.getLines();
        List<String> details = new ArrayList<>(lines.size());
        BigInteger lineTotal = BigInteger.ZERO;
        for (int i = 0; i < lines.size(); i++) {
            WpsLine line = lines.get(i);
            BigInteger net = toSubunits(line.getNetSalary(), "net salary", i);
            lineTotal = lineTotal.add(net);
            details.add(encodeDetail(line, batch.getSalaryDate(), net, i));
        }

        BigInteger headerTotal = toSubunits(batch.totalNetSalary(), "total net salary", -1);
        if (!headerTotal.equals(lineTotal)) {
            throw new SifFormatException("Header total %s does not match sum of detail records %s"
                    .formatted(headerTotal, lineTotal));
        }
        if (batch.employeeCount() != details.size()) {
            throw new SifFormatException("Header record count %d does not match %d detail records"
                    .formatted(batch.employeeCount(), details.size()));
        }

        StringBuilder out = new StringBuilder(SifLayout.EDR_LENGTH + 1 + details.size() * (SifLayout.SDR_LENGTH + 1));
        out.append(encodeHeader(batch, details.size(), headerTotal)).append(RECORD_SEPARATOR);
        details.forEach(d -> out.append(d).append(RECORD_SEPARATOR));

        log.debug("Encoded batch {} into SIF: {} detail record(s), total {} fils",
                batch.getReference(), details.size(), headerTotal);
        return out.toString().getBytes(StandardCharsets.US_ASCII);
    }

    /** {@code WPS_<employerId>_<YYYY><MM>.SIF} */
    public String fileName(WpsBatch batch) {
        SalaryPeriod period = batch.getPeriod();
        return "WPS_%s_%04d%s.SIF".formatted(batch.getEmployerId(), period.year(), period.monthCode());
    }

    private String encodeHeader(WpsBatch batch, int recordCount, BigInteger total) {
        SalaryPeriod period = batch.getPeriod();
        return render(SifLayout.EDR, Map.of(
                "employerId", batch.getEmployerId(),
                "bankCode", nullToEmpty(batch.getEmployerBankCode()),
                "account", batch.getEmployerAccount(),
                "month", BigInteger.valueOf(period.month()),
                "year", BigInteger.valueOf(period.year()),
                "recordCount", BigInteger.valueOf(recordCount),
                "totalNetSalary", total), "EDR");
    }

    private String encodeDetail(WpsLine line, LocalDate salaryDate, BigInteger net, int index) {
        String context = "SDR #" + (index + 1);
        requireText(line.employeeIdentifier(), context + " employee ID");
        int idWidth = SifLayout.field(SifLayout.SDR, "employeeId").width();
        if (line.employeeIdentifier().length() > idWidth) {
            // identifiers are never truncated
            throw new SifFormatException("%s employee ID %s is longer than %d characters"
                    .formatted(context, line.employeeIdentifier(), idWidth));
        }
        requireText(line.getBankCode(), context + " bank routing code");
        requireText(line.accountIdentifier(), context + " account/IBAN");
        if (line.getDaysWorked() < 0) {
            throw new SifFormatException(context + " days worked must not be negative");
        }

        return render(SifLayout.SDR, Map.of(
                "employeeId", line.employeeIdentifier(),
                "bankCode", line.getBankCode(),
                "account", line.accountIdentifier(),
                "salaryDate", new BigInteger(salaryDate.format(SALARY_DATE)),
                "daysWorked", BigInteger.valueOf(line.getDaysWorked()),
                "netSalary", net,
                "basicSalary", toSubunits(line.getBasicSalary(), "basic salary", index),
                "housingAllowance", toSubunits(line.getHousingAllowance(), "housing allowance", index),
                "otherAllowance", toSubunits(line.sifOtherAllowance(), "other allowance", index),
                "deductions", toSubunits(line.getDeductions(), "deductions", index)), context);
    }

    private String render(List<SifField> layout, Map<String, Object> values, String context) {
        StringBuilder record = new StringBuilder();
        for (SifField field : layout) {
            switch (field.kind()) {
                case LITERAL -> record.append(field.literal());
                case TEXT -> record.append(padText((String) values.get(field.name()), field, context));
                case NUMERIC -> record.append(padNumber((BigInteger) values.get(field.name()), field, context));
            }
        }
        return record.toString();
    }

    private static String padText(String value, SifField field, String context) {
        String text = nullToEmpty(value);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 0x20 || c > 0x7E) {
                throw new SifFormatException("%s %s contains a non-printable or non-ASCII character"
                        .formatted(context, field.name()));
            }
        }
        return ("%-" + field.width() + "." + field.width() + "s").formatted(text);
    }

    private static String padNumber(BigInteger value, SifField field, String context) {
        if (value.signum() < 0) {
            throw new SifFormatException("%s %s must not be negative".formatted(context, field.name()));
        }
        String digits = value.toString();
        if (digits.length() > field.width()) {
            throw new SifFormatException("%s %s value %s does not fit in %d digits"
                    .formatted(context, field.name(), digits, field.width()));
        }
        return "0".repeat(field.width() - digits.length()) + digits;
    }

    /**
     * Converts a dirham amount into integer fils. Amounts whose fils component is fractional
     * (beyond {@link #SUBUNIT_TOLERANCE}) are rejected rather than rounded.
     */
    static BigInteger toSubunits(BigDecimal amount, String fieldName, int lineIndex) {
        String where = lineIndex < 0 ? fieldName : "SDR #%d %s".formatted(lineIndex + 1, fieldName);
        if (amount == null) {
            return BigInteger.ZERO;
        }
        if (amount.signum() < 0) {
            throw new SifFormatException("%s must not be negative: %s".formatted(where, amount.toPlainString()));
        }
        BigDecimal scaled = amount.movePointRight(2);
        BigDecimal integral = scaled.setScale(0, RoundingMode.HALF_UP);
        if (scaled.subtract(integral).abs().compareTo(SUBUNIT_TOLERANCE) > 0) {
            throw new SifFormatException("%s has a fractional subunit component: %s"
                    .formatted(where, amount.toPlainString()));
        }
        return integral.toBigIntegerExact();
    }

    // ─── Decoding ────────────────────────────────────────────────────────────

    public SifDocument decode(byte[] content) {
        String text = new String(content, StandardCharsets.US_ASCII);
        if (text.isEmpty()) {
            throw new SifFormatException("SIF file is empty");
        }
        List<String> records = new ArrayList<>(List.of(text.split("\n", -1)));
        if (records.get(records.size() - 1).isEmpty()) {
            records.remove(records.size() - 1);
        }
        if (records.isEmpty()) {
            throw new SifFormatException("SIF file has no records");
        }

        FixedLengthTokenizer edrTokenizer = tokenizer(SifLayout.EDR);
        FixedLengthTokenizer sdrTokenizer = tokenizer(SifLayout.SDR);

        SifHeader header = decodeHeader(tokenize(edrTokenizer, records.get(0), SifLayout.EDR_LENGTH, 1));
        List<SifDetail> details = new ArrayList<>(records.size() - 1);
        for (int i = 1; i < records.size(); i++) {
            details.add(decodeDetail(tokenize(sdrTokenizer, records.get(i), SifLayout.SDR_LENGTH, i + 1), i + 1));
        }

        if (header.recordCount() != details.size()) {
            throw new SifFormatException("EDR declares %d record(s) but file contains %d SDR(s)"
                    .formatted(header.recordCount(), details.size()));
        }
        BigDecimal sum = details.stream().map(SifDetail::netSalary).reduce(BigDecimal.ZERO, BigDecimal::add);
        if (sum.compareTo(header.totalNetSalary()) != 0) {
            throw new SifFormatException("EDR total %s does not match sum of SDR net salaries %s"
                    .formatted(header.totalNetSalary().toPlainString(), sum.toPlainString()));
        }
        return new SifDocument(header, details);
    }

    private static FixedLengthTokenizer tokenizer(List<SifField> layout) {
        FixedLengthTokenizer tokenizer = new FixedLengthTokenizer();
        tokenizer.setNames(SifLayout.names(layout));
        tokenizer.setColumns(SifLayout.ranges(layout));
        tokenizer.setStrict(true);
        return tokenizer;
    }

    private static FieldSet tokenize(FixedLengthTokenizer tokenizer, String record, int expectedLength, int lineNo) {
        if (record.length() != expectedLength) {
            throw new SifFormatException("Record %d is %d bytes long, expected %d"
                    .formatted(lineNo, record.length(), expectedLength));
        }
        try {
            return tokenizer.tokenize(record);
        } catch (IncorrectLineLengthException e) {
            throw new SifFormatException("Record %d: %s".formatted(lineNo, e.getMessage()));
        }
    }

    private static SifHeader decodeHeader(FieldSet fs) {
        expectLiteral(fs, "recordType", SifLayout.EDR_TYPE, 1);
        expectLiteral(fs, "currency", SifLayout.CURRENCY, 1);
        int month = (int) readNumber(fs, "month", 1);
        int year = (int) readNumber(fs, "year", 1);
        SalaryPeriod period;
        try {
            period = new SalaryPeriod(month, year);
        } catch (IllegalArgumentException e) {
            throw new SifFormatException("Record 1: " + e.getMessage());
        }
        return new SifHeader(
                fs.readString("employerId"),
                fs.readString("bankCode"),
                fs.readString("account"),
                period,
                (int) readNumber(fs, "recordCount", 1),
                readAmount(fs, "totalNetSalary", 1));
    }

    private static SifDetail decodeDetail(FieldSet fs, int lineNo) {
        expectLiteral(fs, "recordType", SifLayout.SDR_TYPE, lineNo);
        expectLiteral(fs, "frequency", SifLayout.MONTHLY, lineNo);
        expectLiteral(fs, "currency", SifLayout.CURRENCY, lineNo);
        String rawDate = fs.readRawString("salaryDate");
        LocalDate salaryDate;
        try {
            salaryDate = LocalDate.parse(rawDate, SALARY_DATE);
        } catch (DateTimeParseException e) {
            throw new SifFormatException("Record %d: invalid salary date '%s'".formatted(lineNo, rawDate));
        }
        return new SifDetail(
                fs.readString("employeeId"),
                fs.readString("bankCode"),
                fs.readString("account"),
                salaryDate,
                (int) readNumber(fs, "daysWorked", lineNo),
                readAmount(fs, "netSalary", lineNo),
                readAmount(fs, "basicSalary", lineNo),
                readAmount(fs, "housingAllowance", lineNo),
                readAmount(fs, "otherAllowance", lineNo),
                readAmount(fs, "deductions", lineNo));
    }

    private static void expectLiteral(FieldSet fs, String name, String expected, int lineNo) {
        String actual = fs.readRawString(name);
        if (!expected.equals(actual)) {
            throw new SifFormatException("Record %d: expected %s '%s' but found '%s'"
                    .formatted(lineNo, name, expected, actual));
        }
    }

    private static long readNumber(FieldSet fs, String name, int lineNo) {
        String raw = fs.readRawString(name);
        if (!DIGITS.matcher(raw).matches()) {
            throw new SifFormatException("Record %d: %s '%s' is not numeric".formatted(lineNo, name, raw));
        }
        return Long.parseLong(raw);
    }

    private static BigDecimal readAmount(FieldSet fs, String name, int lineNo) {
        return BigDecimal.valueOf(readNumber(fs, name, lineNo), 2);
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new SifFormatException(what + " is required");
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
