package com.jay.fundrater.model;

import java.util.List;

/** Summary text plus the momentum-health score it was built around. */
public record Narrative(String summary, List<String> sentences, int momentumScore, String momentumLabel) {
}
