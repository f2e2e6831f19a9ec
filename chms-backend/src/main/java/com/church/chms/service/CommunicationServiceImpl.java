package com.church.chms.service;

import com.church.chms.entity.ChurchMember;
import com.church.chms.entity.Communication;
import com.church.chms.entity.CommunicationDelivery;
import com.church.chms.entity.MemberPhone;
import com.church.chms.exception.BadRequestException;
import com.church.chms.gateway.email.EmailGateway;
import com.church.chms.gateway.sms.SmsGateway;
import com.church.chms.gateway.sms.SmsResult;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.CommunicationDeliveryRepository;
import com.church.chms.repository.CommunicationRepository;
import com.church.chms.repository.MemberPhoneRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
public class CommunicationServiceImpl implements CommunicationService {

    private static final Set<String> CHANNELS = Set.of(
            CommunicationDelivery.CHANNEL_IN_APP, CommunicationDelivery.CHANNEL_EMAIL, CommunicationDelivery.CHANNEL_SMS);

    private final CommunicationRepository communicationRepository;
    private final CommunicationDeliveryRepository deliveryRepository;
    private final ChurchMemberRepository memberRepository;
    private final MemberPhoneRepository phoneRepository;
    private final EmailGateway emailGateway;
    private final SmsGateway smsGateway;
    private final DeliveryStatusWriter statusWriter;
    private final Clock clock;

    public CommunicationServiceImpl(CommunicationRepository communicationRepository,
                                    CommunicationDeliveryRepository deliveryRepository,
                                    ChurchMemberRepository memberRepository,
                                    MemberPhoneRepository phoneRepository,
                                    EmailGateway emailGateway,
                                    SmsGateway smsGateway,
                                    DeliveryStatusWriter statusWriter,
                                    Clock clock) {
        this.communicationRepository = communicationRepository;
        this.deliveryRepository = deliveryRepository;
        this.memberRepository = memberRepository;
        this.phoneRepository = phoneRepository;
        this.emailGateway = emailGateway;
        this.smsGateway = smsGateway;
        this.statusWriter = statusWriter;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Long notify(String title, String message, Long sentBy, Long targetGroupId, Long targetMemberId) {
        Communication communication = new Communication();
        communication.setTitle(title);
        communication.setMessage(message);
        communication.setSentBy(sentBy);
        communication.setTargetGroupId(targetGroupId);
        communication.setTargetMemberId(targetMemberId);
        communication.setCreatedAt(LocalDateTime.now(clock));
        return communicationRepository.save(communication).getCommunicationId();
    }

    @Override
    @Transactional
    public Long send(String title, String message, Long sentBy, Long targetGroupId,
                     Collection<Long> recipientIds, Collection<String> channels) {
        Set<String> resolved = resolveChannels(channels);
        Long communicationId = notify(title, message, sentBy, targetGroupId, null);

        LocalDateTime now = LocalDateTime.now(clock);
        List<CommunicationDelivery> deliveries = new ArrayList<>();
        for (Long recipientId : recipientIds) {
            for (String channel : resolved) {
                CommunicationDelivery delivery = new CommunicationDelivery();
                delivery.setCommunicationId(communicationId);
                delivery.setMbrId(recipientId);
                delivery.setChannel(channel);
                delivery.setStatus(CommunicationDelivery.STATUS_PENDING);
                delivery.setCreatedAt(now);
                deliveries.add(delivery);
            }
        }
        deliveryRepository.saveAll(deliveries);
        log.info("通知 {} 已排队 {} 条投递 (渠道 {})", communicationId, deliveries.size(), resolved);
        return communicationId;
    }

    /**
     * 不在外层事务中运行：每条投递发出后立即由 {@link DeliveryStatusWriter} 提交状态
     */
    @Override
    public int dispatchPending(int batchSize) {
        List<CommunicationDelivery> batch = deliveryRepository.findByStatusOrderByDeliveryIdAsc(
                CommunicationDelivery.STATUS_PENDING, PageRequest.of(0, batchSize));
        if (batch.isEmpty()) {
            return 0;
        }

        Map<Long, Communication> communications = new HashMap<>();
        int sent = 0;
        for (CommunicationDelivery delivery : batch) {
            Communication communication = communications.computeIfAbsent(delivery.getCommunicationId(),
                    id -> communicationRepository.findById(id).orElse(null));
            String error = communication == null ? "Communication not found" : deliver(delivery, communication);
            if (error == null) {
                delivery.setStatus(CommunicationDelivery.STATUS_SENT);
                delivery.setDeliveredAt(LocalDateTime.now(clock));
                delivery.setErrorMessage(null);
                sent++;
            } else {
                delivery.setStatus(CommunicationDelivery.STATUS_FAILED);
                // error_message 列宽 500
                delivery.setErrorMessage(error.length() > 500 ? error.substring(0, 500) : error);
            }
            statusWriter.record(delivery);
        }
        log.info("投递批次完成: 共 {} 条, 成功 {} 条, 失败 {} 条", batch.size(), sent, batch.size() - sent);
        return batch.size();
    }

    /**
     * @return 失败原因，成功时为 null
     */
    private String deliver(CommunicationDelivery delivery, Communication communication) {
        switch (delivery.getChannel()) {
            case CommunicationDelivery.CHANNEL_IN_APP:
                return null;
            case CommunicationDelivery.CHANNEL_EMAIL: {
                Optional<ChurchMember> member = memberRepository.findByMbrIdAndDeletedFalse(delivery.getMbrId());
                if (member.isEmpty() || member.get().getEmailAddress() == null) {
                    return "No email address";
                }
                String body = "<p>" + HtmlUtils.htmlEscape(communication.getMessage()) + "</p>";
                return emailGateway.send(member.get().getEmailAddress(), communication.getTitle(), body)
                        ? null : "Email delivery failed";
            }
            case CommunicationDelivery.CHANNEL_SMS: {
                Optional<MemberPhone> phone = phoneRepository.findFirstByMbrIdAndPrimaryPhoneTrue(delivery.getMbrId());
                if (phone.isEmpty()) {
                    return "No primary phone number";
                }
                SmsResult result = smsGateway.send(phone.get().getPhoneNumber(), communication.getMessage());
                return result.isSuccess() ? null : "SMS delivery failed: " + result.getError();
            }
            default:
                return "Unknown channel " + delivery.getChannel();
        }
    }

    private Set<String> resolveChannels(Collection<String> channels) {
        if (channels == null || channels.isEmpty()) {
            return Set.of(CommunicationDelivery.CHANNEL_IN_APP);
        }
        Set<String> resolved = new LinkedHashSet<>();
        for (String channel : channels) {
            if (!CHANNELS.contains(channel)) {
                throw new BadRequestException("Invalid channel: " + channel);
            }
            resolved.add(channel);
        }
        return resolved;
    }
}
