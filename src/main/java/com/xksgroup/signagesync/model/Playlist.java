package com.xksgroup.signagesync.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Playlist {

    private String id;
    private String title;

    // Time-of-day window [startTime, endTime); startTime > endTime wraps past midnight
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime startTime;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime endTime;

    @Builder.Default
    private boolean active = true;

    private Integer order;
    private boolean portrait;

    private String deviceId;
    private String deviceName;

    @Builder.Default
    private List<String> videoIds = new ArrayList<>();
}
