package com.topography.batch.core;

import com.topography.batch.model.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * 能力管理器接口：表面对象公开能力的注册表。
 *
 * 批处理对象通过它判断一个标识是否为可登记的参数，
 * 任务执行时通过它按标识查找要调用的能力。
 */
public interface FunctionManager {

    /**
     * 注册一个能力。
     * 注册时会检查functionId唯一性，重复注册将返回false。
     *
     * @param functionId 能力唯一标识
     * @param function   能力实例
     * @return 注册是否成功
     */
    boolean registerFunction(String functionId, SurfaceFunction function);

    /**
     * 获取指定能力实例。
     *
     * @param functionId 能力唯一标识
     * @return 能力实例；未找到返回null
     */
    SurfaceFunction getFunction(String functionId);

    /**
     * 获取所有已注册的能力，按注册顺序排列。
     *
     * @return 全部能力实例列表
     */
    List<SurfaceFunction> getAllFunctions();

    /**
     * 全部可用参数的标识，按注册顺序排列，每个标识只出现一次。
     *
     * @return 参数标识列表
     */
    List<String> getAvailableParameters();

    /**
     * 判断标识是否为已注册的参数类能力。
     *
     * @param functionId 能力标识
     * @return 是参数返回true；未注册或为操作返回false
     */
    boolean isParameter(String functionId);

    /**
     * 验证一次调用的参数是否合规。
     * 在批处理执行前对每个已登记调用执行，将配置错误拦截在读取文件之前。
     *
     * 校验内容包括：
     * - 能力是否已注册
     * - 位置参数个数、关键字参数名称是否合法
     * - 必选参数是否缺失
     * - 参数类型是否匹配
     * - 数值参数是否在合法范围内
     * - 枚举参数是否为合法选项
     *
     * @param functionId 能力唯一标识
     * @param args       位置参数
     * @param kwargs     关键字参数
     * @return 详细的验证结果
     */
    ValidationResult validateFunction(String functionId, List<Object> args, Map<String, Object> kwargs);
}
