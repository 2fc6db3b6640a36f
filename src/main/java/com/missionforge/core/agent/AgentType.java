package com.missionforge.core.agent;

/**
 * The three LLM roles of a verification session. Each role keeps its own
 * conversation and sampling temperature.
 */
public enum AgentType {
    MISSION_PLANNER,
    PROPERTY_GENERATOR,
    ARBITER
}
