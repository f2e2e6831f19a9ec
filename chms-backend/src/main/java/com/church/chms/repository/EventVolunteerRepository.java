package com.church.chms.repository;

import com.church.chms.entity.EventVolunteer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface EventVolunteerRepository extends JpaRepository<EventVolunteer, Long> {

    boolean existsByEventIdAndMbrId(Long eventId, Long mbrId);

    @Modifying
    @Query("delete from EventVolunteer v where v.eventId = :eventId")
    int deleteByEventId(@Param("eventId") Long eventId);
}
