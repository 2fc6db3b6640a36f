package com.missionforge.llm;

import com.missionforge.core.agent.AgentType;

/**
 * Role → system prompt. Agents do not embed personas in their own prompts.
 */
public final class SystemPrompts {

    private SystemPrompts() {
    }

    public static String forRole(AgentType role) {
        return switch (role) {
            case MISSION_PLANNER -> """
                    You are a mission planner that generates XML mission plans based on robotic task representation.
                    When asked to generate a mission, create an XML document conformant to the known schema and use the
                    context files to decide how the robot tasked with this mission should carry it out.
                    Include the xsi:schemaLocation attribute, with its namespace, on the root element.
                    Place the original request in the TaskDescription element of CompositeTaskInformation.
                    Format your answer as a markdown code block: ```xml ... ```
                    """;

            case PROPERTY_GENERATOR -> """
                    You are a linear temporal logic generator that writes SPIN compatible LTL properties for robot missions.
                    Generate a single LTL property with these properties:
                    All states MUST be initially false.
                    All atomic propositions MUST change sequentially, since the robot accomplishes one task at a time.
                    The property must conform to SPIN syntax and compile.
                    Format your answer as a markdown code block: ```ltl ... ```
                    Example, for "visit a tree and take a temperature sample; if it is over 30C visit another tree; finally go to the end tree":
                    ltl mission {
                    <>(MoveToTree1.action.actionType == moveToLocation &&
                    <>(TakeTemperatureSample1.action.actionType == takeAmbientTemperature &&
                        (temp > 30 -> <>(MoveToTree2.action.actionType == moveToLocation)) &&
                        <>(MoveToEndTree.action.actionType == moveToLocation)))
                    }
                    """;

            case ARBITER -> """
                    You judge whether example executions of a robot mission are faithful to the mission request.
                    Answer with one word: "Yes" or "No".
                    """;
        };
    }
}
