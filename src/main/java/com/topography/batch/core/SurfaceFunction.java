package com.topography.batch.core;

import com.topography.batch.model.FunctionMetadata;
import com.topography.batch.surface.Surface;

import java.util.List;
import java.util.Map;

/**
 * 表面能力接口：能力表中每一项的统一契约。
 *
 * 一个能力对应表面对象上的一个具名方法，分为两类：
 * - 操作：原地修改表面，返回值被忽略
 * - 参数：返回一个标量，或与元数据中返回标签等长的多个值
 *
 * 实现约定：
 * - 实现必须是无状态、线程安全的，同一实例会被多个文件的任务并发调用
 * - 参数的返回标签是能力本身的静态属性，通过getMetadata()发现
 */
public interface SurfaceFunction {

    /**
     * 在表面上调用该能力。
     *
     * @param surface 目标表面
     * @param args    位置参数，可为空列表
     * @param kwargs  关键字参数，可为空映射
     * @return 操作返回值无意义；参数返回标量、double[]、Object[]或List
     */
    Object invoke(Surface surface, List<Object> args, Map<String, Object> kwargs);

    /**
     * 返回能力的元数据：标识、类别、参数定义和返回标签。
     *
     * @return 能力元数据
     */
    FunctionMetadata getMetadata();
}
