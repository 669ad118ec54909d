package com.spreadsheet.engine.models;

import com.spreadsheet.engine.exceptions.InvalidAddressException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A rectangular block of cells, always normalized so that
 * start is the top-left corner and end the bottom-right one.
 * The corners may be given in any order ("C3:A1" equals "A1:C3").
 */
public final class CellRange {

    private final CellAddress start;
    private final CellAddress end;

    private CellRange(CellAddress start, CellAddress end) {
        this.start = start;
        this.end = end;
    }

    public static CellRange of(CellAddress corner, CellAddress otherCorner) {
        CellAddress start = new CellAddress(
                Math.min(corner.getRow(), otherCorner.getRow()),
                Math.min(corner.getColumn(), otherCorner.getColumn()));
        CellAddress end = new CellAddress(
                Math.max(corner.getRow(), otherCorner.getRow()),
                Math.max(corner.getColumn(), otherCorner.getColumn()));
        return new CellRange(start, end);
    }

    /**
     * Parses "A1:C3", or a single address "B2" which becomes a one-cell range.
     */
    public static CellRange parse(String range) {
        if (range == null || range.isEmpty()) {
            throw new InvalidAddressException("Invalid range: " + range);
        }
        String[] corners = range.split(":", -1);
        if (corners.length > 2) {
            throw new InvalidAddressException("Invalid range: " + range);
        }
        CellAddress first = CellAddress.decode(corners[0]);
        CellAddress second = corners.length == 2 ? CellAddress.decode(corners[1]) : first;
        return of(first, second);
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    public long size() {
        long rows = (long) end.getRow() - start.getRow() + 1;
        long columns = (long) end.getColumn() - start.getColumn() + 1;
        return rows * columns;
    }

    /**
     * All addresses in the range, row by row from start to end inclusive.
     */
    public List<String> cells() {
        List<String> cells = new ArrayList<>();
        for (int row = start.getRow(); row <= end.getRow(); row++) {
            for (int column = start.getColumn(); column <= end.getColumn(); column++) {
                cells.add(CellAddress.encode(row, column));
            }
        }
        return cells;
    }

    public boolean contains(CellAddress address) {
        return address.getRow() >= start.getRow() && address.getRow() <= end.getRow()
                && address.getColumn() >= start.getColumn() && address.getColumn() <= end.getColumn();
    }

    public boolean overlaps(CellRange other) {
        return !(end.getRow() < other.start.getRow()
                || other.end.getRow() < start.getRow()
                || end.getColumn() < other.start.getColumn()
                || other.end.getColumn() < start.getColumn());
    }

    /**
     * Smallest range covering both this range and the other one.
     */
    public CellRange merge(CellRange other) {
        return new CellRange(
                new CellAddress(Math.min(start.getRow(), other.start.getRow()),
                        Math.min(start.getColumn(), other.start.getColumn())),
                new CellAddress(Math.max(end.getRow(), other.end.getRow()),
                        Math.max(end.getColumn(), other.end.getColumn())));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start.equals(end) ? start.toString() : start + ":" + end;
    }
}
