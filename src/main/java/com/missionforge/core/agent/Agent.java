package com.missionforge.core.agent;

public interface Agent {

    String getAgentId();

    AgentType getAgentType();
}
