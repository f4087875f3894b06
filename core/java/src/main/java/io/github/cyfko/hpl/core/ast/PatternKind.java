package io.github.cyfko.hpl.core.ast;

/**
 * Temporal patterns a property can instantiate.
 * <p>
 * Safety patterns can be violated by a finite trace, liveness patterns only by a trace that
 * ends before the expected event happened.
 * </p>
 *
 * <table>
 *   <caption>Patterns</caption>
 *   <tr><th>Pattern</th><th>Reads as</th><th>Trigger</th></tr>
 *   <tr><td>EXISTENCE</td><td>{@code some B}</td><td>no</td></tr>
 *   <tr><td>ABSENCE</td><td>{@code no B}</td><td>no</td></tr>
 *   <tr><td>RESPONSE</td><td>{@code A causes B}</td><td>yes</td></tr>
 *   <tr><td>REQUIREMENT</td><td>{@code B requires A}</td><td>yes</td></tr>
 *   <tr><td>PREVENTION</td><td>{@code A forbids B}</td><td>yes</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum PatternKind {
    EXISTENCE("some", false, false),
    ABSENCE("no", false, true),
    RESPONSE("causes", true, false),
    REQUIREMENT("requires", true, true),
    PREVENTION("forbids", true, true);

    private final String keyword;
    private final boolean triggered;
    private final boolean safety;

    PatternKind(String keyword, boolean triggered, boolean safety) {
        this.keyword = keyword;
        this.triggered = triggered;
        this.safety = safety;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean requiresTrigger() {
        return triggered;
    }

    public boolean isSafety() {
        return safety;
    }

    public boolean isLiveness() {
        return !safety;
    }
}
