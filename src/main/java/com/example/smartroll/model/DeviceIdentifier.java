package com.example.smartroll.model;

import com.example.smartroll.exception.InvalidIdentifierException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Hardware network address of a student device, six hex octets separated by ':' or '-'.
 * Stored and compared in upper case with ':' separators, so equality is case-insensitive.
 */
public final class DeviceIdentifier {

    private static final Pattern MAC = Pattern.compile(
            "^[0-9A-F]{2}([:-])[0-9A-F]{2}(\\1[0-9A-F]{2}){4}$", Pattern.CASE_INSENSITIVE);

    private final String value;

    private DeviceIdentifier(String value) {
        this.value = value;
    }

    public static DeviceIdentifier parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidIdentifierException("mac is required");
        }
        String trimmed = raw.trim();
        if (!MAC.matcher(trimmed).matches()) {
            throw new InvalidIdentifierException("mac must be six hex octets separated by ':' or '-': " + trimmed);
        }
        return new DeviceIdentifier(trimmed.toUpperCase(Locale.ROOT).replace('-', ':'));
    }

    public static boolean isValid(String raw) {
        return raw != null && MAC.matcher(raw.trim()).matches();
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceIdentifier)) return false;
        return value.equals(((DeviceIdentifier) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
