package com.church.chms.gateway.sms;

/**
 * 短信服务商。新增服务商只需实现该接口并注册为 Spring Bean。
 */
public interface SmsProvider {

    /**
     * 服务商名称，与 chms.sms.provider 的取值对应 (不区分大小写)
     */
    String name();

    /**
     * 发送一条短信；实现不保存调用之间的状态，可被并发调用
     */
    SmsResult send(String to, String message);
}
