package com.church.chms.gateway.email;

import com.church.chms.config.ChmsProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;

/**
 * SMTP 邮件发送；STARTTLS 与服务器参数见 spring.mail.*
 */
@Slf4j
@Component
public class EmailGateway {

    private final JavaMailSender mailSender;
    private final ChmsProperties.Mail settings;

    public EmailGateway(JavaMailSender mailSender, ChmsProperties properties) {
        this.mailSender = mailSender;
        this.settings = properties.getMail();
    }

    /**
     * 发送 HTML 邮件
     *
     * @return 发送成功返回 true，失败记录日志并返回 false
     */
    public boolean send(String to, String subject, String htmlBody) {
        if (to == null || to.isBlank()) {
            log.warn("邮件未发送: 收件人为空 (subject={})", subject);
            return false;
        }
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            helper.setFrom(settings.getFromEmail(), settings.getFromName());
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(htmlBody, true);
            mailSender.send(message);
            log.info("邮件已发送至 {}", to);
            return true;
        } catch (MessagingException | UnsupportedEncodingException | MailException e) {
            log.error("Email delivery failed | To: {} | Error: {}", to, e.getMessage());
            return false;
        }
    }
}
