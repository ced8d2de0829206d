package com.koni.homeenergy.infrastructure.persistence.repository;

import com.koni.homeenergy.infrastructure.persistence.entity.DeviceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA repository over the device registry table.
 */
@Repository
public interface DeviceJpaRepository extends JpaRepository<DeviceEntity, String> {

    List<DeviceEntity> findByType(String type);

    List<DeviceEntity> findByRoomIgnoreCase(String room);

    List<DeviceEntity> findByTypeAndRoomIgnoreCase(String type, String room);
}
