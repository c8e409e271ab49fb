package com.gridcast.connector;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 分号分隔文本：跳过 # 注释行与空行，首个非注释行为表头。
 * 单元格去除首尾空白与引号，缺失标记与空串读为 null
 */
@Value
public class DelimitedText {

    List<String> header;
    List<List<String>> rows;

    public static DelimitedText parse(String text, Set<String> missingMarkers) {
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        List<String> header = null;
        List<List<String>> rows = new ArrayList<>();
        for (String line : text.split("\\r?\\n")) {
            if (line.isBlank() || line.stripLeading().startsWith("#")) {
                continue;
            }
            List<String> cells = splitLine(line, missingMarkers);
            if (header == null) {
                header = cells;
            } else {
                rows.add(Collections.unmodifiableList(cells));
            }
        }
        return new DelimitedText(header == null ? List.of() : header, rows);
    }

    /**
     * 列下标，不存在时为 -1
     */
    public int indexOf(String column) {
        for (int i = 0; i < header.size(); i++) {
            if (column.equals(header.get(i))) return i;
        }
        return -1;
    }

    public static String cell(List<String> row, int index) {
        return index >= 0 && index < row.size() ? row.get(index) : null;
    }

    private static List<String> splitLine(String line, Set<String> missingMarkers) {
        String[] parts = line.split(";", -1);
        List<String> cells = new ArrayList<>(parts.length);
        for (String part : parts) {
            String v = part.strip();
            if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
                v = v.substring(1, v.length() - 1).strip();
            }
            cells.add(v.isEmpty() || missingMarkers.contains(v) ? null : v);
        }
        return cells;
    }
}
