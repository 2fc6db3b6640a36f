package com.missionforge.core.state;

import com.missionforge.core.agent.AgentType;
import com.missionforge.core.automaton.AcceptingRun;
import com.missionforge.core.automaton.Automaton;
import com.missionforge.core.checker.VerifyResult;
import com.missionforge.core.compiler.CompiledProgram;
import com.missionforge.core.tree.BehaviorNode;
import com.missionforge.llm.Conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * VerificationSession: everything one mission request accumulates while it
 * moves through the phase graph.
 *
 * Owned by VerificationOrchestrator for the duration of one verify() call;
 * agents only see the conversation handed to them.
 */
public class VerificationSession {

    private static final Logger log = LoggerFactory.getLogger(VerificationSession.class);

    private final String id;
    private final String missionRequest;
    private final Path   workDirectory;

    private VerificationState state = VerificationState.NEED_XML;
    private int               retryCount;
    private String            lastDiagnostic;

    // mission side
    private boolean         xmlValid;
    private Path            schemaRef;
    private String          missionXml;
    private BehaviorNode    missionTree;
    private CompiledProgram compiledProgram;
    private Path            missionPath;

    // property side
    private boolean            ltlValid;
    private String             propertyText;
    private Automaton          automaton;
    private VerifyResult       verifyResult;
    private List<AcceptingRun> sampledRuns = List.of();

    private final Map<AgentType, Conversation> conversations   = new EnumMap<>(AgentType.class);
    private final Map<AgentType, Feedback>     pendingFeedback = new EnumMap<>(AgentType.class);

    // =========================================================================
    // Constructor
    // =========================================================================

    public VerificationSession(String id, String missionRequest, Path workDirectory,
                               Map<AgentType, Conversation> conversations) {
        this.id             = id;
        this.missionRequest = missionRequest;
        this.workDirectory  = workDirectory;
        this.conversations.putAll(conversations);
    }

    public String getId()             { return id; }
    public String getMissionRequest() { return missionRequest; }
    public Path getWorkDirectory()    { return workDirectory; }

    // =========================================================================
    // Phase
    // =========================================================================

    public VerificationState getState() { return state; }

    public void setState(VerificationState next) {
        if (this.state != next) {
            log.info("[Session {}] Phase transition: {} → {}", id, this.state, next);
            this.state = next;
        }
    }

    // =========================================================================
    // Retry budget
    // =========================================================================

    public int getRetryCount() { return retryCount; }

    public void incrementRetryCount() {
        retryCount++;
    }

    public String getLastDiagnostic()              { return lastDiagnostic; }
    public void setLastDiagnostic(String diagnostic) { this.lastDiagnostic = diagnostic; }

    // =========================================================================
    // Feedback routing
    // =========================================================================

    public void setFeedback(AgentType role, Feedback feedback) {
        pendingFeedback.put(role, feedback);
    }

    /** Feedback for the role's next request, consumed by this call. */
    public Feedback takeFeedback(AgentType role) {
        return pendingFeedback.remove(role);
    }

    // =========================================================================
    // Conversations
    // =========================================================================

    public Conversation conversation(AgentType role) {
        Conversation conversation = conversations.get(role);
        if (conversation == null) {
            throw new IllegalStateException("Session " + id + " has no conversation for " + role);
        }
        return conversation;
    }

    public void resetConversation(AgentType role) {
        Conversation conversation = conversations.get(role);
        if (conversation != null) conversation.reset();
    }

    public void resetConversations() {
        for (Conversation conversation : conversations.values()) {
            conversation.reset();
        }
    }

    // =========================================================================
    // Artifacts
    // =========================================================================

    /** The current mission passed the lint, parsed and compiled. */
    public boolean isXmlValid()                    { return xmlValid; }
    public void setXmlValid(boolean xmlValid)      { this.xmlValid = xmlValid; }

    /** Schema the current mission was validated against; null when linting is off. */
    public Path getSchemaRef()                     { return schemaRef; }
    public void setSchemaRef(Path schemaRef)       { this.schemaRef = schemaRef; }

    public String getMissionXml()                  { return missionXml; }
    public void setMissionXml(String missionXml)   { this.missionXml = missionXml; }

    public BehaviorNode getMissionTree()                    { return missionTree; }
    public void setMissionTree(BehaviorNode missionTree)    { this.missionTree = missionTree; }

    public CompiledProgram getCompiledProgram()                        { return compiledProgram; }
    public void setCompiledProgram(CompiledProgram compiledProgram)    { this.compiledProgram = compiledProgram; }

    public Path getMissionPath()                  { return missionPath; }
    public void setMissionPath(Path missionPath)  { this.missionPath = missionPath; }

    /** The current property translated into an automaton. */
    public boolean isLtlValid()                        { return ltlValid; }
    public void setLtlValid(boolean ltlValid)          { this.ltlValid = ltlValid; }

    public String getPropertyText()                    { return propertyText; }
    public void setPropertyText(String propertyText)   { this.propertyText = propertyText; }

    public Automaton getAutomaton()                  { return automaton; }
    public void setAutomaton(Automaton automaton)    { this.automaton = automaton; }

    public VerifyResult getVerifyResult()                    { return verifyResult; }
    public void setVerifyResult(VerifyResult verifyResult)   { this.verifyResult = verifyResult; }

    public List<AcceptingRun> getSampledRuns() { return sampledRuns; }

    public void setSampledRuns(List<AcceptingRun> runs) {
        this.sampledRuns = Collections.unmodifiableList(new ArrayList<>(runs));
    }

    @Override
    public String toString() {
        return "VerificationSession{id=" + id + ", state=" + state + ", retries=" + retryCount
                + ", xmlValid=" + xmlValid + ", ltlValid=" + ltlValid + "}";
    }
}
