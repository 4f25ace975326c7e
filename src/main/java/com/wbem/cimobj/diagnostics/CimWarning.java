package com.wbem.cimobj.diagnostics;

import lombok.Value;

/**
 * A warning raised by the object model.
 */
@Value
public class CimWarning {
    WarningCategory category;
    String message;
}
