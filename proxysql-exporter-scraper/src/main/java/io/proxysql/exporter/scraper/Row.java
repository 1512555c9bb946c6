package io.proxysql.exporter.scraper;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Column names and text values of one admin result row, in result order.
 */
public record Row(List<String> columns, List<String> values) {

    public Row {
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException("columns and values differ in size: " + columns.size() + " != " + values.size());
        }
        columns = List.copyOf(columns);
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Row of(List<String> columns, String... values) {
        return new Row(columns, Arrays.asList(values));
    }

    public static List<String> columns(ResultSetMetaData metaData) throws SQLException {
        List<String> columns = new ArrayList<>(metaData.getColumnCount());
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            columns.add(metaData.getColumnLabel(i));
        }
        return columns;
    }

    public static Row read(List<String> columns, ResultSet rs) throws SQLException {
        List<String> values = new ArrayList<>(columns.size());
        for (int i = 1; i <= columns.size(); i++) {
            values.add(rs.getString(i));
        }
        return new Row(columns, values);
    }

    public int size() {
        return columns.size();
    }

    public String column(int index) {
        return columns.get(index);
    }

    public String value(int index) {
        return values.get(index);
    }

    /**
     * Value of the first column whose name matches ignoring case, or null.
     */
    public String get(String column) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).toLowerCase(Locale.ROOT).equals(column)) {
                return values.get(i);
            }
        }
        return null;
    }
}
