package com.campus.timetable.time;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OverlapKind {
    @JsonProperty("direct") DIRECT,
    @JsonProperty("back-to-back") BACK_TO_BACK,
    @JsonProperty("none") NONE
}
