package com.wbem.cimobj.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recognized configuration options of the CIM object model.
 *
 * <p>Validation code takes a {@code CimConfig} explicitly; the public constructors of the
 * object model pass {@link #global()}. The global instance is read with plain field
 * reads and is not thread safe: changing it while other threads construct objects has
 * undefined results.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CimConfig {

    private static final CimConfig GLOBAL = new CimConfig();

    /**
     * Accept keybindings with a null value or a null name.
     */
    @Builder.Default
    private boolean ignoreNullKeyValue = false;

    /**
     * Check that CIM integer values fit the range of their type.
     */
    @Builder.Default
    private boolean enforceIntegerRange = true;

    /**
     * The process-wide configuration.
     */
    public static CimConfig global() {
        return GLOBAL;
    }

    /**
     * Restore the defaults of the process-wide configuration.
     */
    public static void resetGlobal() {
        GLOBAL.setIgnoreNullKeyValue(false);
        GLOBAL.setEnforceIntegerRange(true);
    }
}
