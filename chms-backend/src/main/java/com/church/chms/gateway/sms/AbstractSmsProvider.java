package com.church.chms.gateway.sms;

/**
 * 服务商公共逻辑：号码规范化与响应截断
 */
public abstract class AbstractSmsProvider implements SmsProvider {

    /**
     * 去掉非数字字符；加纳本地号码 0XXXXXXXXX 转为 233XXXXXXXXX
     */
    public static String normalizePhone(String phone) {
        String digits = phone == null ? "" : phone.replaceAll("\\D", "");
        if (digits.length() == 10 && digits.startsWith("0")) {
            return "233" + digits.substring(1);
        }
        return digits;
    }

    protected static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
