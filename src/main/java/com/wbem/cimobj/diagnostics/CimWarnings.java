package com.wbem.cimobj.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reports warnings of the object model.
 *
 * <p>Every warning is logged at WARN level. Callers that need to react to warnings
 * programmatically run their code inside {@link #capture(Runnable)}, which collects
 * the warnings raised on the current thread.
 */
public final class CimWarnings {
    private static final Logger log = LoggerFactory.getLogger(CimWarnings.class);

    private static final ThreadLocal<Deque<List<CimWarning>>> CAPTURES =
        ThreadLocal.withInitial(ArrayDeque::new);

    private CimWarnings() {
        // Utility class
    }

    public static void warn(WarningCategory category, String message) {
        CimWarning warning = new CimWarning(category, message);
        log.warn("[{}] {}", category, message);
        for (List<CimWarning> capture : CAPTURES.get()) {
            capture.add(warning);
        }
    }

    public static void userWarning(String message) {
        warn(WarningCategory.USER, message);
    }

    public static void deprecationWarning(String message) {
        warn(WarningCategory.DEPRECATION, message);
    }

    /**
     * Run the action and return the warnings it raised on this thread.
     * Captures nest; an outer capture also sees the warnings of inner ones.
     */
    public static List<CimWarning> capture(Runnable action) {
        List<CimWarning> captured = new ArrayList<>();
        Deque<List<CimWarning>> stack = CAPTURES.get();
        stack.push(captured);
        try {
            action.run();
        } finally {
            stack.pop();
            if (stack.isEmpty()) {
                CAPTURES.remove();
            }
        }
        return captured;
    }
}
