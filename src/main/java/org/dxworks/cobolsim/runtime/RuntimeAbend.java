package org.dxworks.cobolsim.runtime;

/**
 * Fatal runtime error. Thrown anywhere inside statement execution and caught only by the
 * step loop of {@link CobolRuntime}, which ends the run and records it in the error list.
 */
public class RuntimeAbend extends RuntimeException {

    public static final String INVALID_NUMERIC_DATA = "IGZ0020S";
    public static final String UNDEFINED_PROGRAM = "IGZ0002S";
    public static final String PARAMETER_MISMATCH = "IGZ0003S";
    public static final String REFERENCE_MODIFICATION = "IGZ0006S";
    public static final String DIVIDE_BY_ZERO = "IGZ0013S";
    public static final String DUPLICATE_KEY = "IGZ0022S";
    public static final String RECORD_NOT_FOUND = "IGZ0023S";
    public static final String OPEN_FAILED = "IGZ0035S";
    public static final String FILE_NOT_DECLARED = "IGZ0036S";
    public static final String FILE_ALREADY_OPEN = "IGZ0041S";
    public static final String FILE_NOT_OPEN = "IGZ0042S";
    public static final String WRONG_OPEN_MODE = "IGZ0047S";
    public static final String READ_PAST_END = "IGZ0048S";
    public static final String LIMIT_EXCEEDED = "IGZ0099S";
    public static final String UNDEFINED_VARIABLE = "IGYPS2001-E";
    public static final String CICS_ABEND = "DFHAC2206";

    private final String code;
    private final String detail;

    public RuntimeAbend(String code, String detail) {
        super(code + " " + detail);
        this.code = code;
        this.detail = detail;
    }

    public String getCode() {
        return code;
    }

    public String getDetail() {
        return detail;
    }

    static RuntimeAbend invalidNumeric(String value) {
        return new RuntimeAbend(INVALID_NUMERIC_DATA, "INVALID NUMERIC DATA '" + value + "'.");
    }

    static RuntimeAbend undefinedVariable(String name) {
        return new RuntimeAbend(UNDEFINED_VARIABLE, "REFERENCE TO UNDEFINED VARIABLE '" + name + "'.");
    }
}
