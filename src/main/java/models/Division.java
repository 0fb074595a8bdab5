package models;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

@Getter
public enum Division {
    ENGINEERING("Engineering"),
    TECH_PROGRAMS("Tech Programs"),
    RADIO_SUPPORT("Radio Support"),
    HUB_SUPPORT("Hub Support");

    private final String label;

    Division(String label) {
        this.label = label;
    }

    public static Optional<Division> find(String label) {
        return Arrays.stream(values()).filter(d -> d.label.equals(label)).findFirst();
    }

    public static Division fromLabel(String label) {
        return find(label).orElseThrow(() -> new InvalidDivisionException(
                "Invalid division. Must be one of: " + validLabels()));
    }

    public static String validLabels() {
        return Arrays.stream(values()).map(Division::getLabel).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return label;
    }
}
