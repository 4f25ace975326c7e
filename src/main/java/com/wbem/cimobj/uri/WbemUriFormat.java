package com.wbem.cimobj.uri;

/**
 * Output formats of WBEM URIs.
 */
public enum WbemUriFormat {
    /** DSP0207 format: {@code [//host]/[namespace]:classname[.keybindings]}. */
    STANDARD,
    /**
     * Standard format with host, namespace, class name and key names in lower case and
     * keybindings sorted by name, so that equal paths have equal URIs.
     */
    CANONICAL,
    /** DSP0004 object path format: the standard format without the authority. */
    CIMOBJECT,
    /** Format of {@code toString()}: {@code //host/namespace:...}, {@code namespace:...} or {@code classname...}. */
    HISTORICAL
}
