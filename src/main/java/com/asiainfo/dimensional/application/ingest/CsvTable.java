package com.asiainfo.dimensional.application.ingest;

import java.util.List;
import java.util.Map;

/**
 * 解析后的上传表格：列名已归一化（trim + 小写），每行按列名取值
 */
public record CsvTable(List<String> columns, List<Row> rows) {

    public CsvTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    /**
     * @param line  CSV 记录行号，表头为第 1 行，空行同样计数
     * @param cells 列名 -> 原始单元格
     */
    public record Row(int line, Map<String, String> cells) {

        public String get(String column) {
            return cells.get(column);
        }
    }
}
