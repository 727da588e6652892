package com.vigil.config;

import lombok.Data;

@Data
public class LoggingConfig {

    private String eventsFile = "./data/events.jsonl";
    private String milestonesFile = "./data/milestones.jsonl";
}
