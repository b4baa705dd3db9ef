package com.xksgroup.signagesync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Video {

    private String id;
    private String name;

    // Remote location declared by the manifest
    private String url;

    // Download state, carried over between syncs for the same id
    private String localPath;
    private boolean downloaded;

    // Position inside the owning playlist, when the manifest provides one
    private Integer order;
}
