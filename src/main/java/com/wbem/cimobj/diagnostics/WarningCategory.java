package com.wbem.cimobj.diagnostics;

/**
 * Category of a non-fatal condition reported through {@link CimWarnings}.
 */
public enum WarningCategory {
    /** Recoverable but notable input, e.g. an unknown WBEM URI scheme. */
    USER,
    /** Use of a deprecated parameter or value form. */
    DEPRECATION
}
