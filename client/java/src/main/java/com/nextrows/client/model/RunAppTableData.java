package com.nextrows.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tabular app output. Cells are {@link String}, {@link Number},
 * {@link Boolean} or null.
 *
 * @param columns   column headers
 * @param tableData rows, each exactly {@code columns.size()} cells long
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunAppTableData(List<String> columns, List<List<Object>> tableData) {

    public RunAppTableData {
        columns = columns != null ? List.copyOf(columns) : List.of();
        List<List<Object>> rows = new ArrayList<>();
        if (tableData != null) {
            for (int i = 0; i < tableData.size(); i++) {
                List<Object> row = tableData.get(i);
                if (row == null) {
                    throw new IllegalArgumentException("row " + i + " is null");
                }
                if (row.size() != columns.size()) {
                    throw new IllegalArgumentException("row " + i + " has " + row.size() + " cells but there are "
                            + columns.size() + " columns");
                }
                rows.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        tableData = Collections.unmodifiableList(rows);
    }

    public int rowCount() {
        return tableData.size();
    }
}
