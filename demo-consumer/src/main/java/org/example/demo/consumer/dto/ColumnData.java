package org.example.demo.consumer.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * HTTP 接口里的一列：类型名 + 值（null 表示空行）
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ColumnData {

    /**
     * SQL 类型名，比如 bigint、varchar
     */
    private String type;

    private List<Object> values;
}
