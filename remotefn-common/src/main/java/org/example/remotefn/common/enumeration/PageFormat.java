package org.example.remotefn.common.enumeration;

/**
 * 列数据页的序列化格式，目前只有一种
 */
public enum PageFormat {
    COLUMNAR
}
