package net.hourglass.core.spi;

import java.util.concurrent.Callable;

/**
 * 트랜잭션 경계.
 * 리스 락 조작은 requiresNew로 즉시 커밋한다. SQLite는 쓰기 트랜잭션이 하나뿐이므로
 * 열린 트랜잭션 안에서 requiresNew를 호출하지 말 것.
 */
public interface TxRunner {
    /** 진행 중인 트랜잭션이 있으면 참여, 없으면 새로 시작 */
    <T> T required(Callable<T> body) throws Exception;

    /** 항상 별도 트랜잭션 */
    <T> T requiresNew(Callable<T> body) throws Exception;
}
