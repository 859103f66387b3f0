package com.asiainfo.dimensional.domain.model;

import java.time.Instant;

public record LatestObservation(Instant timeStartTs, double value, Instant ingestedTs) {
}
