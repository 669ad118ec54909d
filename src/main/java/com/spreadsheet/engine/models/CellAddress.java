package com.spreadsheet.engine.models;

import com.spreadsheet.engine.exceptions.InvalidAddressException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A zero-based (row, column) position with a canonical textual form
 * such as "A1" or "AA12".
 * The textual row is 1-based; the column uses bijective base-26 letters
 * (A..Z, AA..AZ, BA.. and so on, with no zero digit).
 */
public final class CellAddress implements Comparable<CellAddress> {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^([A-Z]+)([0-9]+)$");

    private final int row;
    private final int column;

    public CellAddress(int row, int column) {
        if (row < 0 || column < 0) {
            throw new InvalidAddressException("Row and column must be non-negative, got (" + row + ", " + column + ")");
        }
        this.row = row;
        this.column = column;
    }

    /**
     * Converts a zero-based position to its address string, e.g. (0, 0) -> "A1".
     */
    public static String encode(int row, int column) {
        return new CellAddress(row, column).toString();
    }

    /**
     * Parses an address string such as "B12".
     * Throws InvalidAddressException if it does not match [A-Z]+[0-9]+
     * or names row 0.
     */
    public static CellAddress decode(String address) {
        if (address == null) {
            throw new InvalidAddressException("Invalid cell address: null");
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(address);
        if (!matcher.matches()) {
            throw new InvalidAddressException("Invalid cell address: " + address);
        }
        int column = columnIndex(matcher.group(1));
        int row;
        try {
            row = Integer.parseInt(matcher.group(2)) - 1;
        } catch (NumberFormatException e) {
            throw new InvalidAddressException("Row out of range in cell address: " + address, e);
        }
        if (row < 0) {
            throw new InvalidAddressException("Rows start at 1 in cell address: " + address);
        }
        return new CellAddress(row, column);
    }

    public static boolean isAddress(String candidate) {
        return candidate != null && ADDRESS_PATTERN.matcher(candidate).matches();
    }

    /**
     * 0 -> "A", 25 -> "Z", 26 -> "AA", 701 -> "ZZ", 702 -> "AAA".
     */
    public static String columnLetters(int column) {
        StringBuilder letters = new StringBuilder();
        int remaining = column;
        while (true) {
            letters.insert(0, (char) ('A' + remaining % 26));
            remaining = remaining / 26;
            if (remaining == 0) {
                break;
            }
            remaining--;
        }
        return letters.toString();
    }

    /**
     * Inverse of {@link #columnLetters(int)}.
     */
    public static int columnIndex(String letters) {
        long column = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new InvalidAddressException("Invalid column letters: " + letters);
            }
            column = column * 26 + (c - 'A' + 1);
            if (column - 1 > Integer.MAX_VALUE) {
                throw new InvalidAddressException("Column out of range: " + letters);
            }
        }
        if (column == 0) {
            throw new InvalidAddressException("Empty column letters");
        }
        return (int) (column - 1);
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return columnLetters(column) + (row + 1);
    }
}
