package com.autonomous.orchestrator.model;

import lombok.Value;

@Value
public class TaskItem {
    String description;
    boolean done;
}
