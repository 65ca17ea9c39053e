package de.bsommerfeld.bytesize.unit;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * User-defined replacement for the built-in units.
 *
 * <p>
 * Tier {@code n} of the table represents {@code base^n} bytes. Values beyond
 * the last tier are shown in the last tier rather than extrapolated, so the
 * table size bounds the exponent. Symbols and both long names are matched
 * case-insensitively when parsing.
 */
public final class CustomUnitTable {

    private final int base;
    private final List<CustomUnit> units;
    private final Map<String, Integer> index;

    private CustomUnitTable(int base, List<CustomUnit> units) {
        Preconditions.checkArgument(base > 1, "base must be greater than 1: %s", base);
        Preconditions.checkArgument(!units.isEmpty(), "custom unit table needs at least one unit");
        Preconditions.checkArgument(units.size() <= UnitTable.MAX_EXPONENT + 1,
                "custom unit table supports at most %s units", UnitTable.MAX_EXPONENT + 1);
        this.base = base;
        this.units = ImmutableList.copyOf(units);
        this.index = buildIndex(this.units);
    }

    public static CustomUnitTable of(int base, List<CustomUnit> units) {
        Preconditions.checkNotNull(units, "units");
        return new CustomUnitTable(base, units);
    }

    public static CustomUnitTable of(int base, CustomUnit... units) {
        return of(base, List.of(units));
    }

    public int base() {
        return base;
    }

    public List<CustomUnit> units() {
        return units;
    }

    public int maxExponent() {
        return units.size() - 1;
    }

    public CustomUnit unit(int exponent) {
        return units.get(Math.max(0, Math.min(maxExponent(), exponent)));
    }

    /**
     * Finds the tier whose symbol, singular or plural name equals the token,
     * ignoring case.
     */
    public OptionalInt exponentOf(String token) {
        if (token == null) {
            return OptionalInt.empty();
        }
        Integer exponent = index.get(token.trim().toLowerCase(Locale.ROOT));
        return exponent == null ? OptionalInt.empty() : OptionalInt.of(exponent);
    }

    private static Map<String, Integer> buildIndex(List<CustomUnit> units) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < units.size(); i++) {
            CustomUnit unit = units.get(i);
            // First definition wins when two tiers share a name.
            index.putIfAbsent(unit.symbol().toLowerCase(Locale.ROOT), i);
            index.putIfAbsent(unit.singular().toLowerCase(Locale.ROOT), i);
            index.putIfAbsent(unit.plural().toLowerCase(Locale.ROOT), i);
        }
        return Map.copyOf(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CustomUnitTable other)) return false;
        return base == other.base && units.equals(other.units);
    }

    @Override
    public int hashCode() {
        return 31 * base + units.hashCode();
    }

    @Override
    public String toString() {
        return "CustomUnitTable{base=" + base + ", units=" + units + '}';
    }
}
