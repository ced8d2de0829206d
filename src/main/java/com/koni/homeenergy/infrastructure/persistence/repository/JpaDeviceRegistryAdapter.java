package com.koni.homeenergy.infrastructure.persistence.repository;

import com.koni.homeenergy.domain.model.Device;
import com.koni.homeenergy.domain.repository.DeviceRegistry;
import com.koni.homeenergy.infrastructure.persistence.entity.DeviceEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JPA adapter exposing the device registry table through the read-only DeviceRegistry port.
 */
@Component
@RequiredArgsConstructor
public class JpaDeviceRegistryAdapter implements DeviceRegistry {

    private final DeviceJpaRepository jpaRepository;

    @Override
    public boolean exists(String deviceId) {
        if (deviceId == null) {
            throw new IllegalArgumentException("DeviceId cannot be null");
        }
        return StorageFailures.translate("device lookup", () -> jpaRepository.existsById(deviceId));
    }

    @Override
    public List<Device> findMany(Collection<String> deviceIds) {
        if (deviceIds.isEmpty()) {
            return List.of();
        }
        return StorageFailures.translate("device lookup", () -> toDomain(jpaRepository.findAllById(deviceIds)));
    }

    @Override
    public List<Device> findByTypeOrRoom(String type, String room) {
        return StorageFailures.translate("device lookup", () -> {
            if (type != null && room != null) {
                return toDomain(jpaRepository.findByTypeAndRoomIgnoreCase(type, room));
            }
            if (type != null) {
                return toDomain(jpaRepository.findByType(type));
            }
            if (room != null) {
                return toDomain(jpaRepository.findByRoomIgnoreCase(room));
            }
            return toDomain(jpaRepository.findAll());
        });
    }

    private List<Device> toDomain(List<DeviceEntity> entities) {
        return entities.stream()
                .map(entity -> new Device(
                        entity.getDeviceId(),
                        entity.getName(),
                        entity.getType(),
                        entity.getRoom(),
                        entity.getRatedPower()))
                .collect(Collectors.toList());
    }
}
