package com.example.kitcheneta.exception;

/**
 * 可预期的业务失败（菜品不可售、门店/订单不存在等），
 * 继承 RuntimeException 以便触发 @Transactional 的自动回滚。
 */
public class EtaBusinessException extends RuntimeException {

    private final EtaErrorCode errorCode;

    public EtaBusinessException(EtaErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public EtaBusinessException(EtaErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public EtaErrorCode getErrorCode() {
        return errorCode;
    }
}
