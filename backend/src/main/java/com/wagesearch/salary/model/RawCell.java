package com.wagesearch.salary.model;

/**
 * One untyped cell from a tabular source, tagged as text, number, or absent.
 */
public interface RawCell {

    RawCell ABSENT = new Absent();

    static RawCell of(Object value) {
        if (value == null) {
            return ABSENT;
        }
        if (value instanceof RawCell cell) {
            return cell;
        }
        if (value instanceof Number number) {
            return new Numeric(number.doubleValue());
        }
        return text(value.toString());
    }

    static RawCell text(String value) {
        if (value == null || value.isBlank()) {
            return ABSENT;
        }
        return new Text(value);
    }

    static RawCell number(double value) {
        return new Numeric(value);
    }

    default boolean isAbsent() {
        return this instanceof Absent;
    }

    record Text(String value) implements RawCell {
        public Text {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("text cell must not be blank, use RawCell.ABSENT");
            }
        }
    }

    record Numeric(double value) implements RawCell {
    }

    record Absent() implements RawCell {
    }
}
