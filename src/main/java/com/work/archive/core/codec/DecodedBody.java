package com.work.archive.core.codec;

import java.util.Collections;
import java.util.List;

public class DecodedBody {

    private final List<DecodedExtrinsic> extrinsics;
    private final List<DecodedEvent> events;

    public DecodedBody(List<DecodedExtrinsic> extrinsics, List<DecodedEvent> events) {
        this.extrinsics = extrinsics == null ? Collections.emptyList() : extrinsics;
        this.events = events == null ? Collections.emptyList() : events;
    }

    public List<DecodedExtrinsic> getExtrinsics() {
        return extrinsics;
    }

    public List<DecodedEvent> getEvents() {
        return events;
    }
}
