package com.church.chms.service;

import com.church.chms.dto.EventRequest;
import com.church.chms.dto.EventView;
import com.church.chms.orm.PageResult;

import java.time.LocalDate;

public interface EventService {

    /**
     * 活动日期必须晚于今天；创建人为当前登录成员
     */
    Long create(EventRequest request);

    void update(Long eventId, EventRequest request);

    /**
     * 连同志愿者分配一起删除
     */
    void delete(Long eventId);

    EventView get(Long eventId);

    PageResult<EventView> getAll(int page, int limit, Long branchId, LocalDate dateFrom, LocalDate dateTo);
}
