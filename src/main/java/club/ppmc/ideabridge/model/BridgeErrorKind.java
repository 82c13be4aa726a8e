/**
 * BridgeErrorKind.java
 *
 * 桥接层的错误类型全集。每种错误都在检测点被捕获为数据，沿调用链返回，不会以未捕获异常的形式越过核心边界。
 * 每个类型携带一个边界分类 (ErrorCategory) 和一个处理建议 (Remedy)。
 */
package club.ppmc.ideabridge.model;

public enum BridgeErrorKind {
    NO_PROJECT_OPEN(ErrorCategory.CONFLICT, Remedy.FIX_REQUEST),
    LOCK_ACQUISITION_TIMEOUT(ErrorCategory.CONFLICT, Remedy.RESET_LOCK),
    UPSTREAM_ACTIVITY_TIMEOUT(ErrorCategory.CONFLICT, Remedy.WAIT_LONGER),
    /** 调用方已得到结果，但宿主端的任务可能仍在运行。 */
    OPERATION_TIMEOUT(ErrorCategory.TIMEOUT, Remedy.WAIT_LONGER),
    RUN_NOT_FOUND(ErrorCategory.NOT_FOUND, Remedy.FIX_REQUEST),
    NO_ACTIVE_DEBUG_SESSION(ErrorCategory.CONFLICT, Remedy.FIX_REQUEST),
    SESSION_NOT_SUSPENDED(ErrorCategory.CONFLICT, Remedy.RETRY_LATER),
    EVALUATOR_UNAVAILABLE(ErrorCategory.CONFLICT, Remedy.NONE),
    EXTRACTION_FAILED(ErrorCategory.INTERNAL, Remedy.RETRY_LATER),
    NO_MATCHING_TESTS(ErrorCategory.NOT_FOUND, Remedy.FIX_REQUEST),
    CONFIGURATION_NOT_FOUND(ErrorCategory.NOT_FOUND, Remedy.FIX_REQUEST),
    FRAME_NOT_FOUND(ErrorCategory.NOT_FOUND, Remedy.FIX_REQUEST),
    LAUNCH_FAILED(ErrorCategory.INTERNAL, Remedy.RETRY_LATER),
    HOST_ERROR(ErrorCategory.INTERNAL, Remedy.RETRY_LATER),
    ENVIRONMENT_MISCONFIGURED(ErrorCategory.INTERNAL, Remedy.FIX_REQUEST),
    VALIDATION_FAILED(ErrorCategory.VALIDATION, Remedy.FIX_REQUEST),
    INTERNAL_ERROR(ErrorCategory.INTERNAL, Remedy.NONE);

    private final ErrorCategory category;
    private final Remedy remedy;

    BridgeErrorKind(ErrorCategory category, Remedy remedy) {
        this.category = category;
        this.remedy = remedy;
    }

    public ErrorCategory category() {
        return category;
    }

    public Remedy remedy() {
        return remedy;
    }
}
