package org.example.remotefn.common.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.remotefn.common.enumeration.PageFormat;

import java.io.Serializable;

/**
 * 一批列数据编码后的样子，在请求和响应里传输。
 * payload 里是列式编码的字节，rowCount 冗余保存一份，解码后要和 payload 里声明的行数一致。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ColumnPage implements Serializable {
    private static final long serialVersionUID = 1L;

    private PageFormat format;

    private int rowCount;

    private byte[] payload;

    public static ColumnPage columnar(int rowCount, byte[] payload) {
        return new ColumnPage(PageFormat.COLUMNAR, rowCount, payload);
    }
}
