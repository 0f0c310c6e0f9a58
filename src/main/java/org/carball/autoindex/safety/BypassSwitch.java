package org.carball.autoindex.safety;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Operator kill switch. While enabled every CREATE is recorded as BYPASSED and
 * no DDL is issued. Shared by reference, never a global.
 */
@Slf4j
public class BypassSwitch {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public void enable(String why) {
        String text = why == null || why.isBlank() ? "operator request" : why;
        reason.set(text);
        log.warn("Mutation bypass enabled: {}", text);
    }

    public void disable() {
        if (reason.getAndSet(null) != null) {
            log.warn("Mutation bypass disabled");
        }
    }

    public boolean isEnabled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }
}
