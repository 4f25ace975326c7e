package com.wbem.cimobj.uri;

import com.wbem.cimobj.util.NocaseDict;
import lombok.Builder;
import lombok.Value;

/**
 * Components of a parsed WBEM URI.
 */
@Value
@Builder
public class WbemUri {
    String scheme;
    String host;
    String namespace;
    String classname;
    /** Keybindings of an instance path; null if the URI has no keybinding part. */
    NocaseDict<Object> keybindings;

    public boolean isInstancePath() {
        return keybindings != null;
    }
}
