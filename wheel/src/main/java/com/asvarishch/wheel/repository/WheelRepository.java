package com.asvarishch.wheel.repository;

import com.asvarishch.wheel.model.Wheel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WheelRepository extends JpaRepository<Wheel, Long> {

    List<Wheel> findByOrganizerOrderByWheelIdAsc(String organizer);
}
