package com.church.chms.service;

import java.util.Collection;

/**
 * 站内通知与多渠道投递
 */
public interface CommunicationService {

    /**
     * 写入一条通知 (不生成投递记录)，返回 communication_id
     */
    Long notify(String title, String message, Long sentBy, Long targetGroupId, Long targetMemberId);

    /**
     * 写入通知，并为每个接收成员、每个渠道生成一条 Pending 投递
     *
     * @param channels InApp / Email / SMS，为空时只用 InApp
     */
    Long send(String title, String message, Long sentBy, Long targetGroupId,
              Collection<Long> recipientIds, Collection<String> channels);

    /**
     * 发送一批 Pending 投递，返回处理数量
     */
    int dispatchPending(int batchSize);
}
