package net.hourglass.core.spi;

/**
 * 실제 파이프라인 실행기.
 * 실패 시 예외 메시지가 재시도 판단에 쓰이므로 원인을 메시지에 담아 던질 것.
 */
@FunctionalInterface
public interface PipelineExecutor {
    ExecutionResult execute(ExecutionRequest request) throws Exception;
}
