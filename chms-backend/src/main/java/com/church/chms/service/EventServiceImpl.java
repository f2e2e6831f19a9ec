package com.church.chms.service;

import com.church.chms.dto.EventRequest;
import com.church.chms.dto.EventView;
import com.church.chms.entity.Event;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.BranchRepository;
import com.church.chms.repository.EventRepository;
import com.church.chms.repository.EventVolunteerRepository;
import com.church.chms.security.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Slf4j
@Service
@Transactional(readOnly = true)
public class EventServiceImpl implements EventService {

    private final EventRepository eventRepository;
    private final EventVolunteerRepository volunteerRepository;
    private final BranchRepository branchRepository;
    private final CommunicationService communicationService;
    private final OrmTemplate orm;
    private final RequestContext requestContext;
    private final Clock clock;

    public EventServiceImpl(EventRepository eventRepository,
                            EventVolunteerRepository volunteerRepository,
                            BranchRepository branchRepository,
                            CommunicationService communicationService,
                            OrmTemplate orm,
                            RequestContext requestContext,
                            Clock clock) {
        this.eventRepository = eventRepository;
        this.volunteerRepository = volunteerRepository;
        this.branchRepository = branchRepository;
        this.communicationService = communicationService;
        this.orm = orm;
        this.requestContext = requestContext;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Long create(EventRequest request) {
        validate(request);
        Long creator = requestContext.requireMemberId();

        Event event = new Event();
        apply(event, request);
        event.setCreatedBy(creator);
        event.setCreatedAt(LocalDateTime.now(clock));
        Long eventId = eventRepository.save(event).getEventId();

        communicationService.notify("New Event Created",
                "Event '" + event.getEventTitle() + "' has been scheduled for " + event.getEventDate() + ".",
                creator, null, null);
        log.info("活动创建成功: eventId={}, date={}", eventId, event.getEventDate());
        return eventId;
    }

    @Override
    @Transactional
    public void update(Long eventId, EventRequest request) {
        Event event = findEvent(eventId);
        validate(request);
        apply(event, request);
        event.setUpdatedAt(LocalDateTime.now(clock));
        eventRepository.save(event);

        communicationService.notify("Event Updated",
                "Event '" + event.getEventTitle() + "' on " + event.getEventDate() + " has been updated.",
                requestContext.currentMemberId().orElse(null), null, null);
    }

    @Override
    @Transactional
    public void delete(Long eventId) {
        Event event = findEvent(eventId);
        int volunteers = volunteerRepository.deleteByEventId(eventId);
        eventRepository.delete(event);
        log.info("活动已删除: eventId={}, 同时移除 {} 条志愿者分配", eventId, volunteers);
    }

    @Override
    public EventView get(Long eventId) {
        EventView view = orm.selectOne(baseQuery().where("ev.event_id", eventId), EventView.class);
        if (view == null) {
            throw new ResourceNotFoundException("Event not found");
        }
        return view;
    }

    @Override
    public PageResult<EventView> getAll(int page, int limit, Long branchId, LocalDate dateFrom, LocalDate dateTo) {
        QueryBuilder query = baseQuery()
                .whereIfPresent("ev.branch_id", branchId)
                .whereIfPresent("ev.event_date", ">=", dateFrom)
                .whereIfPresent("ev.event_date", "<=", dateTo)
                .orderBy("ev.event_date", "DESC")
                .orderBy("ev.event_id", "DESC");
        return orm.paginate(query, page, limit, EventView.class);
    }

    private void validate(EventRequest request) {
        if (!request.getEventDate().isAfter(LocalDate.now(clock))) {
            throw new BadRequestException("Event date must be in the future");
        }
        if (!branchRepository.existsById(request.getBranchId())) {
            throw new BadRequestException("Invalid branch ID");
        }
    }

    private static void apply(Event event, EventRequest request) {
        event.setEventTitle(request.getTitle().trim());
        event.setEventDescription(request.getDescription());
        event.setEventDate(request.getEventDate());
        event.setLocation(request.getLocation());
        event.setBranchId(request.getBranchId());
    }

    private Event findEvent(Long eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event not found"));
    }

    private QueryBuilder baseQuery() {
        return QueryBuilder.from("event", "ev")
                .select("ev.event_id", "ev.event_title", "ev.event_description", "ev.event_date", "ev.location",
                        "ev.branch_id", "b.branch_name", "ev.created_by",
                        "CONCAT(m.first_name, ' ', m.family_name) AS creator_name", "ev.created_at", "ev.updated_at")
                .leftJoin("branch", "b", "b.branch_id = ev.branch_id")
                .leftJoin("churchmember", "m", "m.mbr_id = ev.created_by");
    }
}
