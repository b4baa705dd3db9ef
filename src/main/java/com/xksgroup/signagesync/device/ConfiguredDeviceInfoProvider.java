package com.xksgroup.signagesync.device;

import com.xksgroup.signagesync.model.DeviceInfo;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ConfiguredDeviceInfoProvider implements DeviceInfoProvider {

    private final DeviceInfo deviceInfo;

    public ConfiguredDeviceInfoProvider(@Value("${device.id:}") String deviceId,
                                        @Value("${device.name:}") String deviceName,
                                        @Value("${device.location:}") String location,
                                        @Value("${device.active:true}") boolean active,
                                        @Value("${device.map-location:}") String mapLocation) {
        this.deviceInfo = DeviceInfo.builder()
                .deviceId(deviceId)
                .deviceName(deviceName)
                .location(location)
                .active(active)
                .mapLocation(mapLocation)
                .build();
    }

    @Override
    public DeviceInfo currentDevice() {
        return deviceInfo;
    }
}
