package com.xksgroup.signagesync.device;

import com.xksgroup.signagesync.model.DeviceInfo;

/**
 * Source of the device descriptor. Registration and admin bookkeeping live behind this seam.
 */
public interface DeviceInfoProvider {

    DeviceInfo currentDevice();
}
