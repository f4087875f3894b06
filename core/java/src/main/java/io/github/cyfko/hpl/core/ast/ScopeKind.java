package io.github.cyfko.hpl.core.ast;

/**
 * Observation window of a property.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ScopeKind {
    GLOBAL("globally", false, false),
    AFTER("after", true, false),
    UNTIL("until", false, true),
    AFTER_UNTIL("after-until", true, true);

    private final String keyword;
    private final boolean activated;
    private final boolean terminated;

    ScopeKind(String keyword, boolean activated, boolean terminated) {
        this.keyword = keyword;
        this.activated = activated;
        this.terminated = terminated;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * @return {@code true} if the window opens on an activator event
     */
    public boolean hasActivator() {
        return activated;
    }

    /**
     * @return {@code true} if the window closes on a terminator event
     */
    public boolean hasTerminator() {
        return terminated;
    }
}
