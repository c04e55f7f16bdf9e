package nl.bytesoflife.deltasdf.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Header of an SDF file. Only items that were present in the input are set.
 */
public final class SdfHeader {

    public static final char DEFAULT_DIVIDER = '.';

    private final Map<HeaderItem, String> text;
    private final Character divider;
    private final Triple voltage;
    private final Triple temperature;
    private final Timescale timescale;

    private SdfHeader(Builder builder) {
        this.text = Collections.unmodifiableMap(new EnumMap<>(builder.text));
        this.divider = builder.divider;
        this.voltage = builder.voltage;
        this.temperature = builder.temperature;
        this.timescale = builder.timescale;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SdfHeader empty() {
        return new Builder().build();
    }

    public String getSdfVersion() {
        return text.get(HeaderItem.SDFVERSION);
    }

    public String getDesign() {
        return text.get(HeaderItem.DESIGN);
    }

    public String getDate() {
        return text.get(HeaderItem.DATE);
    }

    public String getVendor() {
        return text.get(HeaderItem.VENDOR);
    }

    public String getProgram() {
        return text.get(HeaderItem.PROGRAM);
    }

    public String getVersion() {
        return text.get(HeaderItem.VERSION);
    }

    public String getProcess() {
        return text.get(HeaderItem.PROCESS);
    }

    /**
     * Free-text value of a quoted header item, or null.
     */
    public String getText(HeaderItem item) {
        return text.get(item);
    }

    /**
     * Hierarchy divider; {@code .} when the file does not declare one.
     */
    public char getDivider() {
        return divider != null ? divider : DEFAULT_DIVIDER;
    }

    public boolean hasDivider() {
        return divider != null;
    }

    public Triple getVoltage() {
        return voltage;
    }

    public Triple getTemperature() {
        return temperature;
    }

    public Timescale getTimescale() {
        return timescale;
    }

    public boolean isPresent(HeaderItem item) {
        return switch (item) {
            case DIVIDER -> divider != null;
            case VOLTAGE -> voltage != null;
            case TEMPERATURE -> temperature != null;
            case TIMESCALE -> timescale != null;
            default -> text.containsKey(item);
        };
    }

    /**
     * Items that are set, in canonical order.
     */
    public List<HeaderItem> getItems() {
        List<HeaderItem> items = new ArrayList<>();
        for (HeaderItem item : HeaderItem.values()) {
            if (isPresent(item)) {
                items.add(item);
            }
        }
        return items;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SdfHeader other)) return false;
        return text.equals(other.text)
            && Objects.equals(divider, other.divider)
            && Objects.equals(voltage, other.voltage)
            && Objects.equals(temperature, other.temperature)
            && Objects.equals(timescale, other.timescale);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, divider, voltage, temperature, timescale);
    }

    @Override
    public String toString() {
        return "SdfHeader{items=" + getItems() + "}";
    }

    public static final class Builder {

        private final Map<HeaderItem, String> text = new EnumMap<>(HeaderItem.class);
        private Character divider;
        private Triple voltage;
        private Triple temperature;
        private Timescale timescale;

        private Builder() {
        }

        public Builder text(HeaderItem item, String value) {
            if (!item.isQuoted()) {
                throw new IllegalArgumentException(item + " is not a text header item");
            }
            text.put(item, Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder sdfVersion(String value) {
            return text(HeaderItem.SDFVERSION, value);
        }

        public Builder design(String value) {
            return text(HeaderItem.DESIGN, value);
        }

        public Builder divider(char value) {
            if (value != '.' && value != '/') {
                throw new IllegalArgumentException("Divider must be '.' or '/': " + value);
            }
            this.divider = value;
            return this;
        }

        public Builder voltage(Triple value) {
            this.voltage = value;
            return this;
        }

        public Builder temperature(Triple value) {
            this.temperature = value;
            return this;
        }

        public Builder timescale(Timescale value) {
            this.timescale = value;
            return this;
        }

        public SdfHeader build() {
            return new SdfHeader(this);
        }
    }
}
