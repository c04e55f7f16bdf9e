package nl.bytesoflife.deltasdf.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One timing construct of an instance: a delay, a timing check or a timing-environment
 * constraint. Fields that do not apply to the entry's kind are null.
 */
public final class Entry {

    private final EntryKind kind;
    private final String fromPin;
    private final String toPin;
    private final Edge fromPinEdge;
    private final Edge toPinEdge;
    private final String condEquation;
    private final DelayMode delayMode;
    private final Map<String, Triple> delayPaths;
    private final List<Triple> retain;

    private Entry(Builder builder) {
        this.kind = builder.kind;
        this.fromPin = builder.fromPin;
        this.toPin = builder.toPin;
        this.fromPinEdge = builder.fromPinEdge;
        this.toPinEdge = builder.toPinEdge;
        this.condEquation = builder.condEquation;
        this.delayMode = builder.delayMode;
        this.delayPaths = Collections.unmodifiableMap(new LinkedHashMap<>(builder.delayPaths));
        this.retain = List.copyOf(builder.retain);
    }

    public static Builder builder(EntryKind kind) {
        return new Builder(kind);
    }

    public EntryKind getKind() {
        return kind;
    }

    public EntryFamily getFamily() {
        return kind.family();
    }

    public String getFromPin() {
        return fromPin;
    }

    public String getToPin() {
        return toPin;
    }

    public Edge getFromPinEdge() {
        return fromPinEdge;
    }

    public Edge getToPinEdge() {
        return toPinEdge;
    }

    public boolean isCond() {
        return condEquation != null;
    }

    public String getCondEquation() {
        return condEquation;
    }

    public DelayMode getDelayMode() {
        return delayMode;
    }

    public boolean isAbsolute() {
        return delayMode == DelayMode.ABSOLUTE;
    }

    public boolean isIncremental() {
        return delayMode == DelayMode.INCREMENT;
    }

    public boolean isTimingCheck() {
        return kind.family() == EntryFamily.TIMING_CHECK;
    }

    public boolean isTimingEnv() {
        return kind.family() == EntryFamily.TIMING_ENV;
    }

    /**
     * Named delay values in slot order (for example nominal, or rise and fall).
     */
    public Map<String, Triple> getDelayPaths() {
        return delayPaths;
    }

    public Triple getDelayPath(String slot) {
        return delayPaths.get(slot);
    }

    public List<Triple> getRetain() {
        return retain;
    }

    /**
     * Base part of the entry key: kind and pins, with incremental delays kept apart from
     * absolute ones.
     */
    public String keyBase() {
        StringBuilder sb = new StringBuilder();
        if (isIncremental()) {
            sb.append("increment_");
        }
        sb.append(kind.id())
            .append('_').append(fromPin != null ? fromPin : "")
            .append('_').append(toPin != null ? toPin : "");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entry other)) return false;
        return kind == other.kind
            && Objects.equals(fromPin, other.fromPin)
            && Objects.equals(toPin, other.toPin)
            && fromPinEdge == other.fromPinEdge
            && toPinEdge == other.toPinEdge
            && Objects.equals(condEquation, other.condEquation)
            && delayMode == other.delayMode
            && delayPaths.equals(other.delayPaths)
            && retain.equals(other.retain);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, fromPin, toPin, fromPinEdge, toPinEdge, condEquation, delayMode,
            delayPaths, retain);
    }

    @Override
    public String toString() {
        return "Entry{" + kind.id() + " " + fromPin + " -> " + toPin +
            (condEquation != null ? ", cond='" + condEquation + "'" : "") +
            (delayMode != null ? ", " + delayMode.name().toLowerCase() : "") +
            ", paths=" + delayPaths.keySet() + "}";
    }

    public static final class Builder {

        private final EntryKind kind;
        private String fromPin;
        private String toPin;
        private Edge fromPinEdge;
        private Edge toPinEdge;
        private String condEquation;
        private DelayMode delayMode;
        private final Map<String, Triple> delayPaths = new LinkedHashMap<>();
        private final List<Triple> retain = new ArrayList<>();

        private Builder(EntryKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder fromPin(String pin, Edge edge) {
            this.fromPin = pin;
            this.fromPinEdge = edge;
            return this;
        }

        public Builder toPin(String pin, Edge edge) {
            this.toPin = pin;
            this.toPinEdge = edge;
            return this;
        }

        public Builder fromPin(String pin) {
            return fromPin(pin, null);
        }

        public Builder toPin(String pin) {
            return toPin(pin, null);
        }

        public Builder cond(String equation) {
            this.condEquation = equation;
            return this;
        }

        public Builder delayMode(DelayMode mode) {
            this.delayMode = mode;
            return this;
        }

        public Builder delayPath(String slot, Triple value) {
            delayPaths.put(slot, Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder retain(List<Triple> values) {
            retain.addAll(values);
            return this;
        }

        public Entry build() {
            boolean delay = kind.family() == EntryFamily.DELAY;
            if (delay && delayMode == null) {
                throw new IllegalStateException(kind + " entry needs ABSOLUTE or INCREMENT mode");
            }
            if (!delay && delayMode != null) {
                throw new IllegalStateException(kind + " entry cannot carry a delay mode");
            }
            if (delay && kind != EntryKind.IOPATH && condEquation != null) {
                throw new IllegalStateException("COND is only allowed on IOPATH delays, not " + kind);
            }
            if (kind != EntryKind.IOPATH && !retain.isEmpty()) {
                throw new IllegalStateException("RETAIN is only allowed on IOPATH, not " + kind);
            }
            if (kind.family() == EntryFamily.TIMING_ENV && condEquation != null) {
                throw new IllegalStateException("PATHCONSTRAINT cannot be conditional");
            }
            if (delayPaths.isEmpty()) {
                throw new IllegalStateException(kind + " entry has no delay values");
            }
            return new Entry(this);
        }
    }
}
