package com.topography.batch.model;

import java.util.Map;

/**
 * 涉及多个参数的约束，在单个参数的类型与范围检查全部通过后执行
 */
@FunctionalInterface
public interface ArgumentConstraint {

    /**
     * @param bound 绑定后的参数，参数名到值
     * @return 违反约束时的错误信息，满足时返回null
     */
    String check(Map<String, Object> bound);
}
