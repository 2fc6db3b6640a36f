package com.missionforge.llm;

import com.missionforge.core.agent.AgentType;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Profile({"mock", "test"})
public class MockLLMClient implements LLMClient {

    @Override
    public String generateWithRole(AgentType role, Conversation conversation, String prompt, double temperature) {
        // Stub: one fixed answer per role, fenced the way the real models are asked to
        return switch (role) {
            case MISSION_PLANNER -> """
                    Here is the mission plan:
                    ```xml
                    <?xml version="1.0" encoding="UTF-8"?>
                    <Mission xmlns="https://robotics.ucmerced.edu/task"
                             xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance"
                             xsi:schemaLocation="https://robotics.ucmerced.edu/task mission.xsd">
                      <CompositeTaskInformation>
                        <TaskID>MockMission</TaskID>
                        <TaskDescription>Visit a tree, sample temperature, branch on the reading</TaskDescription>
                      </CompositeTaskInformation>
                      <ActionSequence>
                        <Sequence>
                          <AtomicTask>
                            <TaskID>MoveToTree1</TaskID>
                            <Action>
                              <ActionType>moveToLocation</ActionType>
                              <moveToLocation>
                                <Latitude>37.2661</Latitude>
                                <Longitude>-120.4201</Longitude>
                              </moveToLocation>
                            </Action>
                          </AtomicTask>
                          <AtomicTask>
                            <TaskID>TakeTemperatureSample1</TaskID>
                            <Action>
                              <ActionType>takeAmbientTemperature</ActionType>
                            </Action>
                          </AtomicTask>
                          <Fallback>
                            <ValueCondition variable="temp" comparator="gt" threshold="30"/>
                            <AtomicTask>
                              <TaskID>MoveToTree2</TaskID>
                              <Action>
                                <ActionType>moveToLocation</ActionType>
                              </Action>
                            </AtomicTask>
                            <AtomicTask>
                              <TaskID>MoveToEndTree</TaskID>
                              <Action>
                                <ActionType>moveToLocation</ActionType>
                              </Action>
                            </AtomicTask>
                          </Fallback>
                        </Sequence>
                      </ActionSequence>
                    </Mission>
                    ```
                    """;

            case PROPERTY_GENERATOR -> """
                    ```ltl
                    ltl mission { <>(MoveToTree1.action.actionType == moveToLocation && <>(TakeTemperatureSample1.action.actionType == takeAmbientTemperature && <>(MoveToEndTree.action.actionType == moveToLocation))) }
                    ```
                    """;

            case ARBITER -> "Yes";
        };
    }
}
