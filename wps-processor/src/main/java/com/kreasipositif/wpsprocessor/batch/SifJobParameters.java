package com.kreasipositif.wpsprocessor.batch;

/**
 * Parameter and context keys of {@code sifGenerationJob}.
 */
public final class SifJobParameters {

    public static final String JOB_NAME = "sifGenerationJob";

    public static final String BATCH_REFERENCE = "batchReference";
    public static final String COMPANY_ID = "companyId";
    public static final String ACTOR = "actor";
    /** {@code "false"} keeps the batch's current lines instead of rebuilding them from payroll. */
    public static final String ASSEMBLE = "assemble";
    public static final String STARTED_AT = "startedAt";

    public static final String EXIT_BLOCKED = "BLOCKED";

    public static final String CTX_LINE_COUNT = "lineCount";
    public static final String CTX_VALIDATION_STATUS = "validationStatus";
    public static final String CTX_ERROR_COUNT = "errorCount";
    public static final String CTX_WARNING_COUNT = "warningCount";
    public static final String CTX_FILE_NAME = "fileName";
    public static final String CTX_FILE_PATH = "filePath";

    private SifJobParameters() {
    }
}
