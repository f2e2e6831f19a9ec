package com.church.chms.service;

import com.church.chms.dto.EventRequest;
import com.church.chms.entity.Event;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.exception.UnauthorizedException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.repository.BranchRepository;
import com.church.chms.repository.EventRepository;
import com.church.chms.repository.EventVolunteerRepository;
import com.church.chms.security.RequestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class EventServiceImplTest {

    @Mock
    private EventRepository eventRepository;

    @Mock
    private EventVolunteerRepository volunteerRepository;

    @Mock
    private BranchRepository branchRepository;

    @Mock
    private CommunicationService communicationService;

    @Mock
    private OrmTemplate orm;

    @Mock
    private RequestContext requestContext;

    private EventServiceImpl eventService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
        eventService = new EventServiceImpl(eventRepository, volunteerRepository, branchRepository,
                communicationService, orm, requestContext, clock);
    }

    private static EventRequest request(LocalDate date) {
        return new EventRequest("Youth Camp", "Annual retreat", date, "Camp grounds", 1L);
    }

    @Test
    void testCreate_Success() {
        when(branchRepository.existsById(1L)).thenReturn(true);
        when(requestContext.requireMemberId()).thenReturn(4L);
        when(eventRepository.save(any(Event.class))).thenAnswer(invocation -> {
            Event saved = invocation.getArgument(0);
            saved.setEventId(12L);
            return saved;
        });

        assertEquals(12L, eventService.create(request(LocalDate.of(2025, 4, 10))));

        ArgumentCaptor<Event> captor = ArgumentCaptor.forClass(Event.class);
        verify(eventRepository).save(captor.capture());
        assertEquals(4L, captor.getValue().getCreatedBy());
        assertEquals("Youth Camp", captor.getValue().getEventTitle());
        verify(communicationService).notify(eq("New Event Created"), anyString(), eq(4L), isNull(), isNull());
    }

    // 当天的日期也不算将来
    @Test
    void testCreate_DateNotInFuture() {
        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> eventService.create(request(LocalDate.of(2025, 3, 1))));
        assertEquals("Event date must be in the future", ex.getMessage());
        verifyNoInteractions(eventRepository);
    }

    @Test
    void testCreate_InvalidBranch() {
        when(branchRepository.existsById(1L)).thenReturn(false);

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> eventService.create(request(LocalDate.of(2025, 4, 10))));
        assertEquals("Invalid branch ID", ex.getMessage());
    }

    @Test
    void testCreate_RequiresCaller() {
        when(branchRepository.existsById(1L)).thenReturn(true);
        when(requestContext.requireMemberId()).thenThrow(new UnauthorizedException("Authentication token missing"));

        assertThrows(UnauthorizedException.class, () -> eventService.create(request(LocalDate.of(2025, 4, 10))));
        verify(eventRepository, never()).save(any());
    }

    @Test
    void testUpdate_NotFound() {
        when(eventRepository.findById(12L)).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> eventService.update(12L, request(LocalDate.of(2025, 4, 10))));
        assertEquals("Event not found", ex.getMessage());
    }

    @Test
    void testUpdate_NotifiesChange() {
        Event event = new Event();
        event.setEventId(12L);
        when(eventRepository.findById(12L)).thenReturn(Optional.of(event));
        when(branchRepository.existsById(1L)).thenReturn(true);
        when(requestContext.currentMemberId()).thenReturn(Optional.of(4L));

        eventService.update(12L, request(LocalDate.of(2025, 5, 1)));

        assertEquals(LocalDate.of(2025, 5, 1), event.getEventDate());
        assertNotNull(event.getUpdatedAt());
        verify(communicationService).notify(eq("Event Updated"), anyString(), eq(4L), isNull(), isNull());
    }

    @Test
    void testDelete_RemovesVolunteersFirst() {
        Event event = new Event();
        event.setEventId(12L);
        when(eventRepository.findById(12L)).thenReturn(Optional.of(event));
        when(volunteerRepository.deleteByEventId(12L)).thenReturn(3);

        eventService.delete(12L);

        InOrder order = inOrder(volunteerRepository, eventRepository);
        order.verify(volunteerRepository).deleteByEventId(12L);
        order.verify(eventRepository).delete(event);
    }
}
