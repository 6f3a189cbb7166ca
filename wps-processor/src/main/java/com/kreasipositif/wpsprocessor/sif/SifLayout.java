package com.kreasipositif.wpsprocessor.sif;

import com.kreasipositif.wpsprocessor.sif.SifField.Kind;
import org.springframework.batch.item.file.transform.Range;

import java.util.ArrayList;
import java.util.List;

/**
 * Column layout of the two SIF record types.
 *
 * <pre>
 *  EDR (91)  : EDR | employer id 15 | routing 9 | account 34 | MM | YYYY | records 6 | total net 15 | AED
 *  SDR (150) : SDR | employee id 15 | routing 9 | account 34 | YYYYMMDD | M | days 2
 *              | net 15 | basic 15 | housing 15 | other 15 | deductions 15 | AED
 * </pre>
 * Amount columns hold integer subunits (fils), i.e. the dirham amount times 100.
 */
public final class SifLayout {

    public static final String EDR_TYPE = "EDR";
    public static final String SDR_TYPE = "SDR";
    public static final String CURRENCY = "AED";
    public static final String MONTHLY = "M";

    public static final int EDR_LENGTH = 91;
    public static final int SDR_LENGTH = 150;

    public static final List<SifField> EDR = new Builder()
            .literal("recordType", EDR_TYPE)
            .text("employerId", 15)
            .text("bankCode", 9)
            .text("account", 34)
            .numeric("month", 2)
            .numeric("year", 4)
            .numeric("recordCount", 6)
            .numeric("totalNetSalary", 15)
            .literal("currency", CURRENCY)
            .build(EDR_LENGTH);

    public static final List<SifField> SDR = new Builder()
            .literal("recordType", SDR_TYPE)
            .text("employeeId", 15)
            .text("bankCode", 9)
            .text("account", 34)
            .numeric("salaryDate", 8)
            .literal("frequency", MONTHLY)
            .numeric("daysWorked", 2)
            .numeric("netSalary", 15)
            .numeric("basicSalary", 15)
            .numeric("housingAllowance", 15)
            .numeric("otherAllowance", 15)
            .numeric("deductions", 15)
            .literal("currency", CURRENCY)
            .build(SDR_LENGTH);

    private SifLayout() {
    }

    public static SifField field(List<SifField> layout, String name) {
        return layout.stream()
                .filter(f -> f.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown SIF column: " + name));
    }

    static String[] names(List<SifField> layout) {
        return layout.stream().map(SifField::name).toArray(String[]::new);
    }

    static Range[] ranges(List<SifField> layout) {
        return layout.stream().map(SifField::range).toArray(Range[]::new);
    }

    private static final class Builder {

        private final List<SifField> fields = new ArrayList<>();
        private int cursor = 1;

        Builder text(String name, int width) {
            return add(name, width, Kind.TEXT, null);
        }

        Builder numeric(String name, int width) {
            return add(name, width, Kind.NUMERIC, null);
        }

        Builder literal(String name, String value) {
            return add(name, value.length(), Kind.LITERAL, value);
        }

        private Builder add(String name, int width, Kind kind, String literal) {
            fields.add(new SifField(name, cursor, width, kind, literal));
            cursor += width;
            return this;
        }

        List<SifField> build(int expectedLength) {
            if (cursor - 1 != expectedLength) {
                throw new IllegalStateException("Layout is %d bytes wide, expected %d".formatted(cursor - 1, expectedLength));
            }
            return List.copyOf(fields);
        }
    }
}
