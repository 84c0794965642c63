package org.example.demo.consumer.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class EvaluateRequest {

    /**
     * 参数列，按函数签名的参数顺序
     */
    private List<ColumnData> arguments;
}
