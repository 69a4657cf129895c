package com.work.archive.core.codec;

public class DecodedEvent {

    private final int index;
    private final String module;
    private final String eventName;
    private final String parametersJson;

    public DecodedEvent(int index, String module, String eventName, String parametersJson) {
        this.index = index;
        this.module = module;
        this.eventName = eventName;
        this.parametersJson = parametersJson;
    }

    public int getIndex() {
        return index;
    }

    public String getModule() {
        return module;
    }

    public String getEventName() {
        return eventName;
    }

    public String getParametersJson() {
        return parametersJson;
    }
}
