package com.topography.batch.core;

import com.topography.batch.exception.SurfaceLoadException;
import com.topography.batch.surface.Surface;

import java.nio.file.Path;

/**
 * 测量文件加载接口。
 *
 * 实现必须是线程安全的：同一实例会被多个工作线程并发调用，
 * 每次调用都返回一个独立的表面对象。
 */
public interface SurfaceLoader {

    /**
     * 从文件加载表面数据。
     *
     * @param file 测量文件路径
     * @return 新的表面对象
     * @throws SurfaceLoadException 文件不可读或格式错误
     */
    Surface load(Path file) throws SurfaceLoadException;
}
