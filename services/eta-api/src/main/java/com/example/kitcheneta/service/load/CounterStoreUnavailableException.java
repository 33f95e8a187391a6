package com.example.kitcheneta.service.load;

/**
 * 共享计数存储（Redis）不可达或超时。只在 {@link LoadCacheService} 内部被捕获。
 */
public class CounterStoreUnavailableException extends RuntimeException {

    public CounterStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
