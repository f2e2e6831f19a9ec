package com.church.chms.gateway.sms;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 单次发送的结果，失败时带上服务商返回的原因
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SmsResult {

    private static final SmsResult OK = new SmsResult(true, null);

    private final boolean success;
    private final String error;

    public static SmsResult ok() {
        return OK;
    }

    public static SmsResult failed(String error) {
        return new SmsResult(false, error);
    }
}
