package com.topography.batch.storage;

import com.topography.batch.exception.TableStorageException;
import com.topography.batch.model.ResultTable;

import java.nio.file.Path;

/**
 * 表格文件读写接口。
 * 用于读取按文件名关联的外部元数据表，以及导出批处理结果表。
 */
public interface TableStorage {

    /**
     * 读取表格文件，第一行（或第一列定义）为列名。
     * 数值单元格读为Double，空单元格读为null，其余读为String。
     *
     * @param path 表格文件路径
     * @return 读取的表
     * @throws TableStorageException 文件不存在、不可读或格式错误
     */
    ResultTable read(Path path);

    /**
     * 将表写入文件，已存在的文件会被覆盖。
     *
     * @param table 要写入的表
     * @param path  目标文件路径
     * @throws TableStorageException 写入失败
     */
    void write(ResultTable table, Path path);
}
