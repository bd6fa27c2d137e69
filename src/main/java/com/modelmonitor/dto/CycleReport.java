package com.modelmonitor.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

@Value
@Builder
public class CycleReport {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate cycleDate;
    boolean skipped;
    int reconciledJobs;
    Map<String, CycleOutcome> outcomes;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant completedAt;

    public long count(CycleOutcome outcome) {
        return outcomes.values().stream().filter(o -> o == outcome).count();
    }
}
