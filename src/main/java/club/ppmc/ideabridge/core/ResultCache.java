/**
 * ResultCache.java
 *
 * 按操作类别缓存最近一次的结构化结果（构建结果、测试结果）。
 * 新操作开始时清空该类别的缓存，完成时（包括失败与超时）重新写入。
 */
package club.ppmc.ideabridge.core;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class ResultCache {

    private final Map<OperationClass, Object> results = new ConcurrentHashMap<>();

    public void put(OperationClass operationClass, Object result) {
        results.put(operationClass, result);
    }

    public void clear(OperationClass operationClass) {
        results.remove(operationClass);
    }

    public <T> Optional<T> get(OperationClass operationClass, Class<T> type) {
        Object result = results.get(operationClass);
        return type.isInstance(result) ? Optional.of(type.cast(result)) : Optional.empty();
    }
}
